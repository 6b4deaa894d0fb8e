package net.storefleet.core.model;

import java.time.Instant;
import java.util.Locale;

public record ResourceAlert(
        Long id,
        long tenantId,
        Kind kind,
        double percent,
        long usageBytes,
        long limitBytes,
        Instant notifiedAt
) {
    public enum Resource { DISK, BANDWIDTH }

    public enum Level { WARNING, CRITICAL }

    public enum Kind {
        DISK_WARNING(Resource.DISK, Level.WARNING),
        DISK_CRITICAL(Resource.DISK, Level.CRITICAL),
        BANDWIDTH_WARNING(Resource.BANDWIDTH, Level.WARNING),
        BANDWIDTH_CRITICAL(Resource.BANDWIDTH, Level.CRITICAL);

        private final Resource resource;
        private final Level level;

        Kind(Resource resource, Level level) { this.resource = resource; this.level = level; }

        public Resource resource() { return resource; }
        public Level level() { return level; }

        public static Kind of(Resource resource, Level level) {
            for (Kind k : values()) {
                if (k.resource == resource && k.level == level) return k;
            }
            throw new IllegalArgumentException(resource + "/" + level);
        }

        public static Kind from(String s) { return Kind.valueOf(s.toUpperCase(Locale.ROOT)); }
        public String code() { return name(); }
    }
}
