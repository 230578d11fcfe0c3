package com.ryuqq.connector.core.domain.retail;

/**
 * 상품 이미지.
 *
 * @param url 이미지 URL
 * @param altText 대체 텍스트
 * @param primary 대표 이미지 여부
 * @param position 표시 순서
 */
public record ProductImage(String url, String altText, boolean primary, int position) {
}
