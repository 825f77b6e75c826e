package net.gridcoord.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isY(String s) { return "Y".equals(s); }

    /** 모델 목록은 쉼표 구분 문자열로 저장 */
    public static String joinList(List<String> values) {
        return values == null || values.isEmpty() ? null : String.join(",", values);
    }

    public static List<String> splitList(String joined) {
        if (joined == null || joined.isBlank()) return List.of();
        return Arrays.stream(joined.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    public static Long millis(Duration d) { return d == null ? null : d.toMillis(); }

    public static Duration duration(ResultSet rs, String column) throws SQLException {
        long ms = rs.getLong(column);
        return rs.wasNull() ? null : Duration.ofMillis(ms);
    }

    public static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    public static void setLong(PreparedStatement ps, int idx, Long v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.NUMERIC);
        else ps.setLong(idx, v);
    }
}
