package com.ryuqq.connector.adapter.d365.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * D365 Commerce OData 상품 엔티티.
 *
 * <p>{@code ItemId}가 SKU, {@code RecId}가 상품 ID에 해당합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record D365Product(
    @JsonProperty("RecId") long recId,
    @JsonProperty("ItemId") String itemId,
    @JsonProperty("Name") String name,
    @JsonProperty("Description") String description,
    @JsonProperty("CategoryName") String categoryName,
    @JsonProperty("Price") BigDecimal price,
    @JsonProperty("CurrencyCode") String currencyCode,
    @JsonProperty("PrimaryImageUrl") String primaryImageUrl,
    @JsonProperty("Images") List<D365ProductImage> images,
    @JsonProperty("Variants") List<D365ProductVariant> variants,
    @JsonProperty("IsAvailable") boolean available,
    @JsonProperty("AvailableQuantity") int availableQuantity
) {

    public D365Product {
        price = price == null ? BigDecimal.ZERO : price;
        images = images == null ? List.of() : List.copyOf(images);
        variants = variants == null ? List.of() : List.copyOf(variants);
    }
}
