package com.ryuqq.connector.adapter.d365.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * D365 주소.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record D365Address(
    @JsonProperty("Name") String name,
    @JsonProperty("Street") String street,
    @JsonProperty("City") String city,
    @JsonProperty("State") String state,
    @JsonProperty("ZipCode") String zipCode,
    @JsonProperty("CountryRegionId") String countryRegionId
) {
}
