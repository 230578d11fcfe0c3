package com.ryuqq.connector.core.domain.retail;

/**
 * 주소.
 */
public record Address(
    String firstName,
    String lastName,
    String company,
    String address1,
    String address2,
    String city,
    String state,
    String postalCode,
    String country,
    String phone
) {

    /**
     * 도로명 주소(address1)가 입력되었는지 여부.
     */
    public boolean hasStreet() {
        return address1 != null && !address1.isBlank();
    }
}
