package com.ryuqq.connector.adapter.d365;

import com.ryuqq.connector.core.domain.retail.Address;
import com.ryuqq.connector.core.domain.retail.InventoryInfo;
import com.ryuqq.connector.core.domain.retail.Order;
import com.ryuqq.connector.core.domain.retail.OrderLineItem;
import com.ryuqq.connector.core.domain.retail.OrderList;
import com.ryuqq.connector.core.domain.retail.OrderRequest;
import com.ryuqq.connector.core.domain.retail.OrderStatus;
import com.ryuqq.connector.core.domain.retail.Price;
import com.ryuqq.connector.core.domain.retail.Product;
import com.ryuqq.connector.core.domain.retail.ProductFilters;
import com.ryuqq.connector.core.domain.retail.ProductImage;
import com.ryuqq.connector.core.domain.retail.ProductList;
import com.ryuqq.connector.core.domain.retail.ProductVariant;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 데모 모드용 내장 카탈로그.
 *
 * <p>백엔드 없이 개발/시연할 수 있도록 고정된 가구 상품 5종과 주문 데이터를 제공합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
class D365DemoCatalog {

    static final String CURRENCY = "USD";
    static final String DEMO_CUSTOMER_ID = "demo-customer-1";
    static final String DEMO_STORE_ID = "ikea-seattle";

    private static final int DEFAULT_LIMIT = 10;
    private static final BigDecimal TAX_RATE = new BigDecimal("0.08");
    private static final String IMAGE_BASE = "https://www.ikea.com/us/en/images/products/";
    private static final String BILLY_IMAGE = IMAGE_BASE + "billy-bookcase-white__0625599_pe692385_s5.jpg";

    private final Clock clock;
    private final List<Product> products;

    D365DemoCatalog(Clock clock) {
        this.clock = clock;
        this.products = List.of(
            billy("1001", null, null),
            product("1002", "KALLAX-001", "KALLAX Shelf unit, white",
                "KALLAX is perfect for storing and organizing your things. "
                    + "The simple design creates a modern and stylish expression.",
                "59.99", "kallax-shelf-unit-white__0644763_pe702939_s5.jpg", List.of(), true, 28),
            product("1003", "POANG-001", "POÄNG Armchair, birch veneer/Knisa light beige",
                "The timeless bentwood frame is light and strong, with a design that's comfortable to sit in.",
                "129.00", "poang-armchair-birch-veneer-knisa-light-beige__0818698_pe773911_s5.jpg",
                List.of(
                    variant("1003-beige", "POANG-001-BEIGE", "Beige", "129.00", "beige", 15),
                    variant("1003-gray", "POANG-001-GRAY", "Gray", "129.00", "gray", 8)
                ),
                true, 23),
            product("1004", "LACK-COFFEE-TABLE-001", "LACK Coffee table, black-brown",
                "Separate shelf for magazines, etc. helps you keep your things organized and the table top clear.",
                "39.99", "lack-coffee-table-black-brown__0086081_pe216434_s5.jpg", List.of(), true, 52),
            product("1005", "EKTORP-SOFA-001", "EKTORP 3-seat sofa, Lofallet beige",
                "A timeless design with generous seating comfort and soft cushions "
                    + "that make it comfortable to relax in for a long time.",
                "599.00", "ektorp-3-seat-sofa-lofallet-beige__0818355_pe773685_s5.jpg", List.of(), false, 0)
        );
    }

    /**
     * 필터와 페이지네이션을 적용한 상품 목록.
     *
     * <p>limit이 0이면 10개, 검색어는 이름 또는 설명에 포함되면 일치합니다.</p>
     */
    ProductList products(ProductFilters filters) {
        List<Product> matched = new ArrayList<>();
        for (Product product : products) {
            if (matches(product, filters)) {
                matched.add(product);
            }
        }

        int limit = filters.limit() == 0 ? DEFAULT_LIMIT : filters.limit();
        int offset = Math.min(filters.offset(), matched.size());
        int end = Math.min(offset + limit, matched.size());

        return new ProductList(matched.subList(offset, end), matched.size(), limit, offset, end < matched.size());
    }

    private static boolean matches(Product product, ProductFilters filters) {
        if (filters.category() != null && !filters.category().isEmpty()
            && !product.category().equals(filters.category())) {
            return false;
        }
        BigDecimal amount = product.price().amount();
        if (filters.minPrice() != null && amount.compareTo(filters.minPrice()) < 0) {
            return false;
        }
        if (filters.maxPrice() != null && amount.compareTo(filters.maxPrice()) > 0) {
            return false;
        }
        if (Boolean.TRUE.equals(filters.inStock()) && !product.isInStock()) {
            return false;
        }
        String term = filters.searchTerm();
        if (term != null && !term.isEmpty()) {
            return product.name().contains(term) || product.description().contains(term);
        }
        return true;
    }

    /**
     * ID로 상품 조회. 카탈로그에 없으면 해당 ID의 BILLY 책장을 반환합니다.
     */
    Product product(String productId) {
        return findBy(product -> product.id().equals(productId))
            .orElseGet(() -> billy(productId, clock.instant().minus(Duration.ofDays(30)), clock.instant()));
    }

    /**
     * SKU로 상품 조회. 카탈로그에 없으면 SKU를 ID로 하는 BILLY 책장을 반환합니다.
     */
    Product productBySku(String sku) {
        return findBy(product -> product.sku().equals(sku))
            .orElseGet(() -> billy(sku, clock.instant().minus(Duration.ofDays(30)), clock.instant()));
    }

    private Optional<Product> findBy(Predicate<Product> predicate) {
        return products.stream().filter(predicate).findFirst();
    }

    /**
     * 주문 생성 결과 (세율 8%, 상태 PENDING).
     */
    Order createOrder(OrderRequest request) {
        Instant now = clock.instant();
        long epochSeconds = now.getEpochSecond();

        BigDecimal subtotal = BigDecimal.ZERO;
        for (OrderLineItem item : request.lineItems()) {
            if (item.totalPrice() != null) {
                subtotal = subtotal.add(item.totalPrice().amount());
            }
        }
        BigDecimal tax = subtotal.multiply(TAX_RATE).setScale(2, RoundingMode.HALF_UP);
        BigDecimal total = subtotal.add(tax);

        return new Order(
            Long.toString(epochSeconds),
            "ORD-" + epochSeconds,
            DEMO_CUSTOMER_ID,
            request.storeId(),
            OrderStatus.PENDING,
            request.lineItems(),
            Price.of(subtotal, CURRENCY),
            Price.of(tax, CURRENCY),
            null,
            Price.of(total, CURRENCY),
            request.billingAddress(),
            request.shippingAddress(),
            request.paymentMethod(),
            request.metadata(),
            now,
            now
        );
    }

    /**
     * 결제 완료된 BILLY 책장 2개 주문.
     */
    Order order(String orderId) {
        Instant now = clock.instant();
        Address address = new Address("John", "Doe", null, "123 Main St", null,
            "Seattle", "WA", "98101", "US", null);
        OrderLineItem line = new OrderLineItem("1", "1001", null, "BILLY-WHITE-001", "BILLY Bookcase, white", 2,
            Price.of("79.99", CURRENCY), Price.of("159.98", CURRENCY), BILLY_IMAGE);

        return new Order(
            orderId,
            "ORD-" + orderId,
            DEMO_CUSTOMER_ID,
            DEMO_STORE_ID,
            OrderStatus.PAID,
            List.of(line),
            Price.of("159.98", CURRENCY),
            Price.of("12.80", CURRENCY),
            null,
            Price.of("172.78", CURRENCY),
            address,
            address,
            null,
            Map.of(),
            now.minus(Duration.ofHours(24)),
            now.minus(Duration.ofHours(2))
        );
    }

    /**
     * 데모 주문 3건 (1001, 1002, 1003)의 페이지.
     */
    OrderList orders(String customerId, int limit, int offset) {
        List<Order> all = List.of(order("1001"), order("1002"), order("1003"));

        int start = Math.min(Math.max(offset, 0), all.size());
        int end = Math.min(start + Math.max(limit, 0), all.size());

        return new OrderList(all.subList(start, end), all.size(), limit, offset, end < all.size());
    }

    private static Product billy(String id, Instant createdAt, Instant updatedAt) {
        return new Product(
            id,
            "BILLY-WHITE-001",
            "BILLY Bookcase, white",
            "BILLY is a modern bookcase that is both practical and stylish. "
                + "With adjustable shelves, you can customize the storage space for your books and decorative items.",
            "furniture",
            Price.of("79.99", CURRENCY),
            List.of(new ProductImage(BILLY_IMAGE, null, true, 0)),
            List.of(),
            InventoryInfo.of(true, 45),
            Map.of(),
            createdAt,
            updatedAt
        );
    }

    private static Product product(String id, String sku, String name, String description, String price,
                                   String image, List<ProductVariant> variants, boolean available, int quantity) {
        return new Product(
            id,
            sku,
            name,
            description,
            "furniture",
            Price.of(price, CURRENCY),
            List.of(new ProductImage(IMAGE_BASE + image, null, true, 0)),
            variants,
            InventoryInfo.of(available, quantity),
            Map.of(),
            null,
            null
        );
    }

    private static ProductVariant variant(String id, String sku, String name, String price, String color, int quantity) {
        return new ProductVariant(id, sku, name, Price.of(price, CURRENCY), Map.of("color", color),
            InventoryInfo.of(true, quantity));
    }
}
