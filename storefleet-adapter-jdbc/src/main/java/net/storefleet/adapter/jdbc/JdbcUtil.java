package net.storefleet.adapter.jdbc;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** H2: 동시 갱신 충돌 / 락 타임아웃 */
    private static final int H2_CONCURRENT_UPDATE = 90131;
    private static final int H2_LOCK_TIMEOUT = 50200;

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isY(String s) { return "Y".equals(s); }

    public static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    public static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    /** 컬럼 길이 초과로 에러 기록 자체가 실패하지 않도록 */
    public static String clip(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }

    /** 경쟁에서 졌다는 뜻의 예외인가 (unique 위반 / 직렬화 실패) */
    public static boolean isConflict(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (!(t instanceof SQLException s)) continue;
            String state = s.getSQLState();
            if ("23505".equals(state) || "40001".equals(state)) return true;
            if (s.getErrorCode() == H2_CONCURRENT_UPDATE || s.getErrorCode() == H2_LOCK_TIMEOUT) return true;
        }
        return false;
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run() throws SQLException;
    }

    /**
     * savepoint 안에서 실행. 충돌이면 savepoint 로 되돌리고 empty.
     * PostgreSQL 은 실패한 문장 뒤 트랜잭션 전체가 중단되므로 savepoint 가 필요하다.
     */
    public static <T> Optional<T> attempt(Connection c, SqlWork<T> work) throws SQLException {
        Savepoint sp = c.setSavepoint();
        try {
            T r = work.run();
            c.releaseSavepoint(sp);
            return Optional.ofNullable(r);
        } catch (SQLException e) {
            c.rollback(sp);
            if (isConflict(e)) return Optional.empty();
            throw e;
        }
    }
}
