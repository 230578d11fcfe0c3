package com.ryuqq.connector.adapter.d365.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * D365 Commerce OData 판매 주문 엔티티.
 *
 * <p>{@code CreatedDateTime}/{@code ModifiedDateTime}은 RFC 3339 문자열입니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record D365Order(
    @JsonProperty("RecId") long recId,
    @JsonProperty("SalesId") String salesId,
    @JsonProperty("CustomerAccount") String customerAccount,
    @JsonProperty("SalesStatus") String salesStatus,
    @JsonProperty("Lines") List<D365OrderLine> lines,
    @JsonProperty("SubTotal") BigDecimal subTotal,
    @JsonProperty("TaxTotal") BigDecimal taxTotal,
    @JsonProperty("TotalAmount") BigDecimal totalAmount,
    @JsonProperty("CurrencyCode") String currencyCode,
    @JsonProperty("CreatedDateTime") String createdDateTime,
    @JsonProperty("ModifiedDateTime") String modifiedDateTime,
    @JsonProperty("DeliveryAddress") D365Address deliveryAddress,
    @JsonProperty("InvoiceAddress") D365Address invoiceAddress
) {

    public D365Order {
        lines = lines == null ? List.of() : List.copyOf(lines);
        subTotal = subTotal == null ? BigDecimal.ZERO : subTotal;
        taxTotal = taxTotal == null ? BigDecimal.ZERO : taxTotal;
        totalAmount = totalAmount == null ? BigDecimal.ZERO : totalAmount;
    }
}
