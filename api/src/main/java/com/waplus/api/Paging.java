package com.waplus.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Offset/limit window for catalog listings.
 */
public record Paging(int offset, int limit) {

    public static Paging of(Integer offset, Integer limit, int defaultLimit, int maxLimit) {
        int effectiveOffset = offset != null ? offset : 0;
        int effectiveLimit = limit != null ? limit : defaultLimit;
        if (effectiveOffset < 0) {
            throw new InvalidRequestException("offset must be >= 0");
        }
        if (effectiveLimit < 1 || effectiveLimit > maxLimit) {
            throw new InvalidRequestException("limit must be between 1 and " + maxLimit);
        }
        return new Paging(effectiveOffset, effectiveLimit);
    }

    /**
     * {@code select [WHERE where] ORDER BY orderBy LIMIT ? OFFSET ?}; {@code where} may be null.
     */
    public SqlFragment page(String select, SqlFragment where, String orderBy) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(select);
        if (where != null) {
            sql.append("WHERE ").append(where.sql()).append(" ");
            params.addAll(where.params());
        }
        sql.append("ORDER BY ").append(orderBy).append(" LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        return new SqlFragment(sql.toString(), params);
    }
}
