package com.ella.insights.ledger;

import java.util.List;
import java.util.Optional;

import com.ella.insights.entities.Customer;
import com.ella.insights.entities.ForecastAccuracyRecord;
import com.ella.insights.entities.InventoryItem;
import com.ella.insights.entities.Invoice;
import com.ella.insights.entities.Product;
import com.ella.insights.entities.Purchase;
import com.ella.insights.entities.Sale;
import com.ella.insights.entities.SaleReturn;
import com.ella.insights.entities.Supplier;

/**
 * Read-only snapshot of a company's ledger as seen by the insights engine.
 * Lookups return {@link Optional#empty()} for unknown or blank ids.
 */
public interface CompanyData {

    List<Sale> getSales();

    List<Purchase> getPurchases();

    List<SaleReturn> getReturns();

    List<Invoice> getInvoices();

    List<InventoryItem> getInventory();

    List<ForecastAccuracyRecord> getForecastRecords();

    Optional<Product> findProduct(String productId);

    Optional<Customer> findCustomer(String customerId);

    Optional<Supplier> findSupplier(String supplierId);
}
