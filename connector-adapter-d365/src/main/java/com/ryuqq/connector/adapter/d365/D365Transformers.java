package com.ryuqq.connector.adapter.d365;

import com.ryuqq.connector.adapter.d365.odata.D365Address;
import com.ryuqq.connector.adapter.d365.odata.D365Order;
import com.ryuqq.connector.adapter.d365.odata.D365OrderLine;
import com.ryuqq.connector.adapter.d365.odata.D365OrderListResponse;
import com.ryuqq.connector.adapter.d365.odata.D365Product;
import com.ryuqq.connector.adapter.d365.odata.D365ProductImage;
import com.ryuqq.connector.adapter.d365.odata.D365ProductListResponse;
import com.ryuqq.connector.adapter.d365.odata.D365ProductVariant;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * D365 OData 모델 ↔ 도메인 모델 변환.
 *
 * @author Connector Team
 * @since 1.0.0
 */
final class D365Transformers {

    private static final Logger log = LoggerFactory.getLogger(D365Transformers.class);

    private static final String DEFAULT_CURRENCY = "USD";

    private static final Map<OrderStatus, String> TO_D365_STATUS = new EnumMap<>(OrderStatus.class);
    private static final Map<String, OrderStatus> FROM_D365_STATUS = new HashMap<>();

    static {
        TO_D365_STATUS.put(OrderStatus.PENDING, "Created");
        TO_D365_STATUS.put(OrderStatus.PROCESSING, "Processing");
        TO_D365_STATUS.put(OrderStatus.PAID, "Confirmed");
        TO_D365_STATUS.put(OrderStatus.SHIPPED, "Shipped");
        TO_D365_STATUS.put(OrderStatus.DELIVERED, "Delivered");
        TO_D365_STATUS.put(OrderStatus.CANCELLED, "Cancelled");
        TO_D365_STATUS.put(OrderStatus.REFUNDED, "Returned");
        TO_D365_STATUS.forEach((domain, d365) -> FROM_D365_STATUS.put(d365, domain));
    }

    private D365Transformers() {
    }

    // ============================================================
    // D365 → Domain
    // ============================================================

    /**
     * 상품 목록 변환. 페이지 정보는 조회에 사용한 filters 기준 (limit=0 이면 받은 건수).
     */
    static ProductList toProductList(D365ProductListResponse response, ProductFilters filters) {
        List<Product> products = new ArrayList<>(response.value().size());
        for (D365Product product : response.value()) {
            products.add(toProduct(product));
        }
        int limit = filters.limit() > 0 ? filters.limit() : products.size();
        return new ProductList(products, response.count(), limit, filters.offset(), response.hasNextLink());
    }

    static Product toProduct(D365Product source) {
        List<ProductImage> images = new ArrayList<>();
        if (source.primaryImageUrl() != null && !source.primaryImageUrl().isEmpty()) {
            images.add(new ProductImage(source.primaryImageUrl(), null, true, 0));
        }
        List<D365ProductImage> extraImages = source.images();
        for (int i = 0; i < extraImages.size(); i++) {
            D365ProductImage image = extraImages.get(i);
            images.add(new ProductImage(image.url(), image.altText(), false, i + 1));
        }

        List<ProductVariant> variants = new ArrayList<>(source.variants().size());
        for (D365ProductVariant variant : source.variants()) {
            variants.add(toVariant(variant, source.currencyCode()));
        }

        return new Product(
            Long.toString(source.recId()),
            source.itemId(),
            source.name(),
            source.description(),
            source.categoryName(),
            Price.of(source.price(), source.currencyCode()),
            images,
            variants,
            InventoryInfo.of(source.available(), source.availableQuantity()),
            Map.of(),
            null,
            null
        );
    }

    private static ProductVariant toVariant(D365ProductVariant source, String currency) {
        Map<String, String> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, "color", source.colorId());
        putIfPresent(attributes, "size", source.sizeId());
        putIfPresent(attributes, "style", source.styleId());

        return new ProductVariant(
            Long.toString(source.recId()),
            source.itemId(),
            source.name(),
            Price.of(source.price(), currency),
            attributes,
            InventoryInfo.of(source.available(), source.availableQuantity())
        );
    }

    static OrderList toOrderList(D365OrderListResponse response, String storeId, int limit, int offset) {
        List<Order> orders = new ArrayList<>(response.value().size());
        for (D365Order order : response.value()) {
            orders.add(toOrder(order, storeId));
        }
        return new OrderList(orders, response.count(), limit, offset, response.hasNextLink());
    }

    static Order toOrder(D365Order source, String storeId) {
        String currency = source.currencyCode();

        List<OrderLineItem> lineItems = new ArrayList<>(source.lines().size());
        for (D365OrderLine line : source.lines()) {
            lineItems.add(new OrderLineItem(
                Long.toString(line.recId()),
                null,
                null,
                line.itemId(),
                line.productName(),
                line.quantity().intValue(),
                Price.of(line.salesPrice(), currency),
                Price.of(line.lineAmount(), currency),
                line.imageUrl()
            ));
        }

        return new Order(
            Long.toString(source.recId()),
            source.salesId(),
            source.customerAccount(),
            storeId,
            fromD365Status(source.salesStatus()),
            lineItems,
            Price.of(source.subTotal(), currency),
            Price.of(source.taxTotal(), currency),
            null,
            Price.of(source.totalAmount(), currency),
            toAddress(source.invoiceAddress()),
            toAddress(source.deliveryAddress()),
            null,
            Map.of(),
            parseTimestamp(source.createdDateTime()),
            parseTimestamp(source.modifiedDateTime())
        );
    }

    static Address toAddress(D365Address source) {
        if (source == null) {
            return null;
        }
        return new Address(
            source.name(),
            null,
            null,
            source.street(),
            null,
            source.city(),
            source.state(),
            source.zipCode(),
            source.countryRegionId(),
            null
        );
    }

    // ============================================================
    // Domain → D365
    // ============================================================

    /**
     * 주문 생성 요청 페이로드.
     *
     * <p>CustomerAccount는 호출 컨텍스트에서 채워지므로 빈 문자열로 보냅니다.
     * 주소는 address1이 있을 때만 포함합니다.</p>
     */
    static Map<String, Object> toOrderPayload(OrderRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("CustomerAccount", "");
        payload.put("CurrencyCode", DEFAULT_CURRENCY);

        List<Map<String, Object>> lines = new ArrayList<>(request.lineItems().size());
        for (OrderLineItem item : request.lineItems()) {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("ItemId", item.sku());
            line.put("ProductName", item.name());
            line.put("Quantity", BigDecimal.valueOf(item.quantity()));
            line.put("SalesPrice", item.unitPrice() == null ? BigDecimal.ZERO : item.unitPrice().amount());
            lines.add(line);
        }
        payload.put("Lines", lines);

        if (request.shippingAddress() != null && request.shippingAddress().hasStreet()) {
            payload.put("DeliveryAddress", toAddressPayload(request.shippingAddress()));
        }
        if (request.billingAddress() != null && request.billingAddress().hasStreet()) {
            payload.put("InvoiceAddress", toAddressPayload(request.billingAddress()));
        }
        return payload;
    }

    private static Map<String, Object> toAddressPayload(Address address) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Street", address.address1());
        payload.put("City", address.city());
        payload.put("State", address.state());
        payload.put("ZipCode", address.postalCode());
        payload.put("CountryRegionId", address.country());
        return payload;
    }

    /**
     * 도메인 주문 상태 → D365 상태 (알 수 없으면 Created).
     */
    static String toD365Status(OrderStatus status) {
        return TO_D365_STATUS.getOrDefault(status, "Created");
    }

    /**
     * D365 상태 → 도메인 주문 상태 (알 수 없으면 PENDING).
     */
    static OrderStatus fromD365Status(String status) {
        if (status == null) {
            return OrderStatus.PENDING;
        }
        return FROM_D365_STATUS.getOrDefault(status, OrderStatus.PENDING);
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable D365 timestamp '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isEmpty()) {
            target.put(key, value);
        }
    }
}
