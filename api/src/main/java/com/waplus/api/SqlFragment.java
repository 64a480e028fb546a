package com.waplus.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A piece of SQL together with the positional parameters its {@code ?} placeholders bind to.
 */
public record SqlFragment(String sql, List<Object> params) {

    public SqlFragment {
        params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static SqlFragment of(String sql, Object... params) {
        return new SqlFragment(sql, Arrays.asList(params));
    }

    public static SqlFragment in(String column, Collection<?> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN list for " + column + " must not be empty");
        }
        String placeholders = values.stream().map(v -> "?").collect(Collectors.joining(", "));
        return new SqlFragment(column + " IN (" + placeholders + ")", new ArrayList<>(values));
    }

    public static SqlFragment anyOf(List<SqlFragment> parts) {
        return join(parts, " OR ", true);
    }

    public static SqlFragment allOf(List<SqlFragment> parts) {
        return join(parts, " AND ", false);
    }

    private static SqlFragment join(List<SqlFragment> parts, String separator, boolean parenthesize) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Cannot join an empty list of SQL fragments");
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder();
        if (parenthesize) sql.append("(");
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sql.append(separator);
            sql.append(parts.get(i).sql());
            params.addAll(parts.get(i).params());
        }
        if (parenthesize) sql.append(")");
        return new SqlFragment(sql.toString(), params);
    }
}
