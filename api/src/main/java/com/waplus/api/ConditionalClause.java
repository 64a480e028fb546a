package com.waplus.api;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * One WHERE condition and whether it takes part in the query.
 * The fragment is built lazily so that a clause whose input is absent never has to be constructed.
 */
public record ConditionalClause(boolean applies, Supplier<SqlFragment> clause) {

    public static ConditionalClause always(String sql, Object... params) {
        SqlFragment fragment = SqlFragment.of(sql, params);
        return new ConditionalClause(true, () -> fragment);
    }

    public static ConditionalClause when(boolean applies, Supplier<SqlFragment> clause) {
        return new ConditionalClause(applies, clause);
    }

    public static ConditionalClause whenPresent(Object value, String sql) {
        return new ConditionalClause(isPresent(value), () -> SqlFragment.of(sql, value));
    }

    /**
     * Folds the applicable clauses into one conjunction. Returns {@code null} if none apply.
     */
    public static SqlFragment fold(List<ConditionalClause> clauses) {
        List<SqlFragment> applied = new ArrayList<>();
        for (ConditionalClause c : clauses) {
            if (c.applies()) {
                applied.add(c.clause().get());
            }
        }
        return applied.isEmpty() ? null : SqlFragment.allOf(applied);
    }

    private static boolean isPresent(Object value) {
        if (value == null) return false;
        if (value instanceof String) return !((String) value).isBlank();
        return true;
    }
}
