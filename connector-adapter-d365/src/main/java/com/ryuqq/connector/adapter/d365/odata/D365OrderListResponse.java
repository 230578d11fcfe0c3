package com.ryuqq.connector.adapter.d365.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OData 주문 컬렉션 응답.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record D365OrderListResponse(
    @JsonProperty("@odata.context") String context,
    @JsonProperty("@odata.count") int count,
    @JsonProperty("value") List<D365Order> value,
    @JsonProperty("@odata.nextLink") String nextLink
) {

    public D365OrderListResponse {
        value = value == null ? List.of() : List.copyOf(value);
    }

    public boolean hasNextLink() {
        return nextLink != null && !nextLink.isEmpty();
    }
}
