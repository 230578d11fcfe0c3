package com.ryuqq.connector.adapter.d365;

import com.ryuqq.connector.core.domain.retail.ProductFilters;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * OData 쿼리 문자열 빌더.
 *
 * <p>파라미터는 이름순으로 정렬되어 form 인코딩됩니다.</p>
 *
 * <pre>{@code
 * ODataQuery.forProducts(filters).encode();
 * // %24expand=Variants%2CImages&%24filter=Category+eq+%27furniture%27&%24top=10
 * }</pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
final class ODataQuery {

    private final Map<String, String> params = new TreeMap<>();

    ODataQuery set(String name, String value) {
        params.put(name, value);
        return this;
    }

    /**
     * 상품 조회 쿼리.
     *
     * <ul>
     *   <li>$filter: category, minPrice, maxPrice, searchTerm을 " and "로 결합</li>
     *   <li>$top: limit &gt; 0일 때</li>
     *   <li>$skip: offset &gt; 0일 때</li>
     *   <li>$expand: 항상 Variants,Images</li>
     * </ul>
     */
    static ODataQuery forProducts(ProductFilters filters) {
        ODataQuery query = new ODataQuery();

        List<String> clauses = new ArrayList<>();
        if (filters.category() != null && !filters.category().isEmpty()) {
            clauses.add("Category eq '" + escapeLiteral(filters.category()) + "'");
        }
        if (filters.minPrice() != null) {
            clauses.add(String.format(Locale.ROOT, "Price ge %f", filters.minPrice()));
        }
        if (filters.maxPrice() != null) {
            clauses.add(String.format(Locale.ROOT, "Price le %f", filters.maxPrice()));
        }
        if (filters.searchTerm() != null && !filters.searchTerm().isEmpty()) {
            clauses.add("contains(Name, '" + escapeLiteral(filters.searchTerm()) + "')");
        }
        if (!clauses.isEmpty()) {
            query.set("$filter", String.join(" and ", clauses));
        }

        if (filters.limit() > 0) {
            query.set("$top", Integer.toString(filters.limit()));
        }
        if (filters.offset() > 0) {
            query.set("$skip", Integer.toString(filters.offset()));
        }

        return query.set("$expand", "Variants,Images");
    }

    /**
     * 고객별 주문 조회 쿼리 (최신순).
     */
    static ODataQuery forCustomerOrders(String customerId, int limit, int offset) {
        return new ODataQuery()
            .set("$filter", "CustomerId eq '" + escapeLiteral(customerId) + "'")
            .set("$top", Integer.toString(limit))
            .set("$skip", Integer.toString(offset))
            .set("$expand", "Lines")
            .set("$orderby", "CreatedDateTime desc");
    }

    /**
     * OData 문자열 리터럴의 작은따옴표를 이스케이프 ('' 형태).
     */
    static String escapeLiteral(String value) {
        return value == null ? "" : value.replace("'", "''");
    }

    /**
     * 경로에 넣을 키 세그먼트: {@code ('<id>')}.
     */
    static String keySegment(String id) {
        return "('" + URLEncoder.encode(escapeLiteral(id), StandardCharsets.UTF_8) + "')";
    }

    String encode() {
        return params.entrySet().stream()
            .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    @Override
    public String toString() {
        return encode();
    }
}
