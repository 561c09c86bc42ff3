package com.stockbook.infrastructure.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds {@code WHERE 1=1 AND ...} from optional criteria. Null or blank criteria add nothing.
 */
final class SqlWhere {

    private final StringBuilder sql = new StringBuilder(" WHERE 1=1");
    private final List<Object> args = new ArrayList<>();

    SqlWhere eq(String column, Object value) {
        if (value == null) return this;
        sql.append(" AND ").append(column).append(" = ?");
        args.add(value);
        return this;
    }

    /** Case-insensitive substring match. */
    SqlWhere contains(String column, String value) {
        return containsAny(value, column);
    }

    /** Substring match against any of the columns. */
    SqlWhere containsAny(String value, String... columns) {
        if (value == null || value.isBlank()) return this;
        String pattern = "%" + escapeLike(value.trim().toUpperCase(Locale.ROOT)) + "%";
        sql.append(" AND (");
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) sql.append(" OR ");
            sql.append("UPPER(").append(columns[i]).append(") LIKE ? ESCAPE '\\'");
            args.add(pattern);
        }
        sql.append(")");
        return this;
    }

    SqlWhere onOrAfter(String column, LocalDate date) {
        if (date == null) return this;
        sql.append(" AND ").append(column).append(" >= ?");
        args.add(date.toString());
        return this;
    }

    SqlWhere onOrBefore(String column, LocalDate date) {
        if (date == null) return this;
        sql.append(" AND ").append(column).append(" <= ?");
        args.add(date.toString());
        return this;
    }

    /** Appends ORDER BY and, when requested, LIMIT/OFFSET. */
    String finish(String orderBy, Integer limit, Integer offset) {
        StringBuilder out = new StringBuilder(sql).append(" ORDER BY ").append(orderBy);
        boolean hasLimit = limit != null && limit > 0;
        boolean hasOffset = offset != null && offset > 0;
        if (hasLimit || hasOffset) {
            out.append(" LIMIT ?");
            args.add(hasLimit ? limit : -1);
        }
        if (hasOffset) {
            out.append(" OFFSET ?");
            args.add(offset);
        }
        return out.toString();
    }

    void bind(PreparedStatement ps) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            ps.setObject(i + 1, args.get(i));
        }
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
