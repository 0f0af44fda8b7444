package com.ella.insights.ledger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.ella.insights.entities.Customer;
import com.ella.insights.entities.ForecastAccuracyRecord;
import com.ella.insights.entities.InventoryItem;
import com.ella.insights.entities.Invoice;
import com.ella.insights.entities.Product;
import com.ella.insights.entities.Purchase;
import com.ella.insights.entities.Sale;
import com.ella.insights.entities.SaleReturn;
import com.ella.insights.entities.Supplier;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Immutable in-memory {@link CompanyData}, used to hand the engine a snapshot of the ledger.
 */
@Getter
public class InMemoryCompanyData implements CompanyData {

    private final List<Sale> sales;
    private final List<Purchase> purchases;
    private final List<SaleReturn> returns;
    private final List<Invoice> invoices;
    private final List<InventoryItem> inventory;
    private final List<ForecastAccuracyRecord> forecastRecords;

    @Getter(AccessLevel.NONE)
    private final Map<String, Product> productsById;
    @Getter(AccessLevel.NONE)
    private final Map<String, Customer> customersById;
    @Getter(AccessLevel.NONE)
    private final Map<String, Supplier> suppliersById;

    @Builder
    private InMemoryCompanyData(
            @Singular("sale") List<Sale> sales,
            @Singular("purchase") List<Purchase> purchases,
            @Singular("saleReturn") List<SaleReturn> returns,
            @Singular("invoice") List<Invoice> invoices,
            @Singular("inventoryItem") List<InventoryItem> inventory,
            @Singular("forecastRecord") List<ForecastAccuracyRecord> forecastRecords,
            @Singular("product") List<Product> products,
            @Singular("customer") List<Customer> customers,
            @Singular("supplier") List<Supplier> suppliers
    ) {
        this.sales = List.copyOf(sales);
        this.purchases = List.copyOf(purchases);
        this.returns = List.copyOf(returns);
        this.invoices = List.copyOf(invoices);
        this.inventory = List.copyOf(inventory);
        this.forecastRecords = List.copyOf(forecastRecords);
        this.productsById = index(products, Product::getId);
        this.customersById = index(customers, Customer::getId);
        this.suppliersById = index(suppliers, Supplier::getId);
    }

    @Override
    public Optional<Product> findProduct(String productId) {
        return lookup(productsById, productId);
    }

    @Override
    public Optional<Customer> findCustomer(String customerId) {
        return lookup(customersById, customerId);
    }

    @Override
    public Optional<Supplier> findSupplier(String supplierId) {
        return lookup(suppliersById, supplierId);
    }

    private static <T> Map<String, T> index(List<T> values, Function<T, String> idOf) {
        return values.stream()
                .filter(v -> idOf.apply(v) != null)
                .collect(Collectors.toUnmodifiableMap(idOf, Function.identity(), (first, second) -> first));
    }

    private static <T> Optional<T> lookup(Map<String, T> byId, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }
}
