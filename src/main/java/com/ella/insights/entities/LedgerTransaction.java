package com.ella.insights.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-side view shared by sales and purchases. Amounts are already converted to the
 * reporting currency by the ledger.
 */
public interface LedgerTransaction {

    String getId();

    LocalDate getDate();

    BigDecimal getEffectiveTotalUsd();

    List<LineItem> getLineItems();
}
