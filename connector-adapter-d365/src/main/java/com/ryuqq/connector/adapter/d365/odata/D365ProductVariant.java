package com.ryuqq.connector.adapter.d365.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * D365 상품 변형 (색상/사이즈/스타일).
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record D365ProductVariant(
    @JsonProperty("RecId") long recId,
    @JsonProperty("ItemId") String itemId,
    @JsonProperty("Name") String name,
    @JsonProperty("Price") BigDecimal price,
    @JsonProperty("ColorId") String colorId,
    @JsonProperty("SizeId") String sizeId,
    @JsonProperty("StyleId") String styleId,
    @JsonProperty("ConfigId") String configId,
    @JsonProperty("IsAvailable") boolean available,
    @JsonProperty("AvailableQuantity") int availableQuantity
) {

    public D365ProductVariant {
        price = price == null ? BigDecimal.ZERO : price;
    }
}
