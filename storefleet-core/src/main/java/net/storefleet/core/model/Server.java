package net.storefleet.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public record Server(
        Long id,
        String name,
        String hostname,
        String address,
        Status status,          // 운영자가 선언한 상태. 라우팅은 liveness 로 판단
        int maxTenants,
        int portRangeStart,
        int portRangeEnd,
        Instant lastHeartbeat,
        Instant createdAt,
        Instant updatedAt
) {
    public enum Status {
        ACTIVE, MAINTENANCE, OFFLINE, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    /** 하트비트 나이가 freshness 미만일 때만 live */
    public boolean isLive(Instant now, Duration freshness) {
        if (lastHeartbeat == null) return false;
        return Duration.between(lastHeartbeat, now).compareTo(freshness) < 0;
    }

    public Duration heartbeatAge(Instant now) {
        return lastHeartbeat == null ? null : Duration.between(lastHeartbeat, now);
    }

    public int portCapacity() {
        return portRangeEnd - portRangeStart + 1;
    }

    public boolean inRange(int port) {
        return port >= portRangeStart && port <= portRangeEnd;
    }
}
