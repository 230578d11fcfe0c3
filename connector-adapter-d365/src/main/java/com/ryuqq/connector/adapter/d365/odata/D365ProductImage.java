package com.ryuqq.connector.adapter.d365.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * D365 상품 이미지.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record D365ProductImage(
    @JsonProperty("Url") String url,
    @JsonProperty("AltText") String altText,
    @JsonProperty("DisplayOrder") int displayOrder
) {
}
