package net.storefleet.core.allocator;

import net.storefleet.core.error.TenantValidationException;
import net.storefleet.core.model.PlanTier;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** 플랜 코드 → 자원 한도 */
public final class PlanCatalog {
    private final Map<String, PlanTier> tiers;

    public PlanCatalog(Collection<PlanTier> tiers) {
        var m = new LinkedHashMap<String, PlanTier>();
        for (PlanTier t : tiers) m.put(normalize(t.code()), t);
        this.tiers = Collections.unmodifiableMap(m);
    }

    /** 기본 티어 (디스크/대역폭 GB) */
    public static PlanCatalog defaults() {
        return new PlanCatalog(java.util.List.of(
                new PlanTier("starter", "1g", "1.0", 25, 250),
                new PlanTier("growth", "2g", "1.0", 50, 500),
                new PlanTier("professional", "4g", "2.0", 100, 1000),
                new PlanTier("business", "8g", "4.0", 200, 2000),
                new PlanTier("enterprise", "16g", "8.0", 500, 5000)
        ));
    }

    public Optional<PlanTier> find(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(tiers.get(normalize(code)));
    }

    public PlanTier require(String code) throws TenantValidationException {
        return find(code).orElseThrow(() -> new TenantValidationException("unknown plan: " + code));
    }

    public Collection<PlanTier> all() { return tiers.values(); }

    private static String normalize(String code) { return code.trim().toLowerCase(Locale.ROOT); }
}
