package com.ryuqq.connector.adapter.d365.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * D365 주문 라인.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record D365OrderLine(
    @JsonProperty("RecId") long recId,
    @JsonProperty("ItemId") String itemId,
    @JsonProperty("ProductName") String productName,
    @JsonProperty("Quantity") BigDecimal quantity,
    @JsonProperty("SalesPrice") BigDecimal salesPrice,
    @JsonProperty("LineAmount") BigDecimal lineAmount,
    @JsonProperty("ImageUrl") String imageUrl
) {

    public D365OrderLine {
        quantity = quantity == null ? BigDecimal.ZERO : quantity;
        salesPrice = salesPrice == null ? BigDecimal.ZERO : salesPrice;
        lineAmount = lineAmount == null ? BigDecimal.ZERO : lineAmount;
    }
}
