package com.ella.insights;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.ella.insights.config.InsightsProperties;

@SpringBootTest
class InsightsEngineApplicationTests {

	@Autowired
	private InsightsProperties properties;

	@Test
	void contextLoads() {
	}

	@Test
	void bindsThresholdsFromApplicationProperties() {
		assertEquals(5, properties.minimumTransactions());
		assertEquals(0, properties.significantChangePercent().compareTo(new BigDecimal("15")));
		assertEquals(2.0, properties.zScoreThreshold());
		assertEquals(60, properties.inactivityDays());
	}

}
