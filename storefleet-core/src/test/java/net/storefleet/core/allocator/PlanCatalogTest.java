package net.storefleet.core.allocator;

import net.storefleet.core.error.TenantValidationException;
import net.storefleet.core.model.PlanTier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanCatalogTest {

    @Test
    void lookup_is_case_insensitive_and_derives_byte_ceilings() throws Exception {
        PlanCatalog catalog = PlanCatalog.defaults();
        PlanTier tier = catalog.require(" Growth ");

        assertEquals("growth", tier.code());
        assertEquals(50L * 1024 * 1024 * 1024, tier.diskBytes());
        assertEquals(500L * 1024 * 1024 * 1024, tier.bandwidthBytes());
        assertEquals(5, catalog.all().size());
    }

    @Test
    void unknown_plan_is_a_validation_error() {
        assertThrows(TenantValidationException.class, () -> PlanCatalog.defaults().require("platinum"));
        assertTrue(PlanCatalog.defaults().find(null).isEmpty());
    }
}
