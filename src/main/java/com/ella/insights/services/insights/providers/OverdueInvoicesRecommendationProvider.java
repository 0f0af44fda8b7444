package com.ella.insights.services.insights.providers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.ella.insights.dto.InsightItem;
import com.ella.insights.entities.Invoice;
import com.ella.insights.enums.InsightCategory;
import com.ella.insights.enums.InsightSeverity;
import com.ella.insights.services.insights.InsightDataCache;
import com.ella.insights.services.insights.InsightUtils;

@Component
@Order(30)
public class OverdueInvoicesRecommendationProvider implements RecommendationInsightProvider {

    private static final long WARNING_AFTER_DAYS = 30;

    @Override
    public List<InsightItem> generate(InsightDataCache cache) {
        LocalDate today = cache.getToday();
        List<Invoice> invoices = cache.getCompanyData().getInvoices();
        if (invoices == null || invoices.isEmpty()) {
            return List.of();
        }

        List<Invoice> overdue = invoices.stream()
                .filter(Objects::nonNull)
                .filter(i -> i.isOverdue(today))
                .filter(i -> i.getBalance() != null && i.getBalance().signum() > 0)
                .sorted(Comparator.comparing(Invoice::getDueDate))
                .toList();
        if (overdue.isEmpty()) {
            return List.of();
        }

        BigDecimal totalOverdue = overdue.stream()
                .map(Invoice::getEffectiveBalanceUsd)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        long oldestDaysOverdue = ChronoUnit.DAYS.between(overdue.get(0).getDueDate(), today);

        return List.of(InsightItem.builder()
                .title("Payment Collection Needed")
                .description(String.format(
                        "%d invoice(s) totaling %s are overdue. Oldest is %d days past due.",
                        overdue.size(),
                        InsightUtils.formatCurrency(totalOverdue),
                        oldestDaysOverdue
                ))
                .recommendation("Send payment reminders and follow up with these customers to improve cash flow.")
                .severity(oldestDaysOverdue > WARNING_AFTER_DAYS ? InsightSeverity.WARNING : InsightSeverity.INFO)
                .category(InsightCategory.PAYMENT)
                .metricValue(totalOverdue)
                .build());
    }
}
