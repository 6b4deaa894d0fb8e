package net.storefleet.core.pipeline;

import net.storefleet.core.model.Credentials;
import net.storefleet.core.model.PlanTier;
import net.storefleet.core.model.Platform;
import net.storefleet.core.model.Tenant;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class EnvironmentRendererTest {

    private static final PlanTier GROWTH = new PlanTier("growth", "2g", "1.0", 50, 500);
    private static final Credentials CREDS =
            new Credentials("customer_9", "customer_9", "dbP@ss1", "rootP@ss1", "owner", "adm1n-P");

    private static Tenant tenant(Platform platform) {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        return new Tenant(9L, "shop.example.com", "owner@example.com", platform, "growth",
                Tenant.Status.PROVISIONING, 1L, null, false, null, false, null, null, null, null, now, now);
    }

    @Test
    void a1_woocommerce_template_gets_port_and_plan_limits() {
        String yml = new EnvironmentRenderer().render(tenant(Platform.WOOCOMMERCE), GROWTH, CREDS, 8001);

        assertTrue(yml.contains("127.0.0.1:8001:80"), yml);
        assertTrue(yml.contains("mem_limit: 2g"));
        assertTrue(yml.contains("cpus: 1.0"));
        assertTrue(yml.contains("customer-9-db"));
        assertTrue(yml.contains("\"dbP@ss1\""));
        assertFalse(yml.contains("${"), "no placeholder left behind");
    }

    @Test
    void a2_magento_template_renders_completely() {
        String yml = new EnvironmentRenderer().render(tenant(Platform.MAGENTO), GROWTH, CREDS, 8002);
        assertTrue(yml.contains("8002"));
        assertTrue(yml.contains("varnish"));
        assertFalse(yml.contains("${"));
    }

    @Test
    void a3_unknown_placeholder_is_rejected() {
        var renderer = new EnvironmentRenderer(Map.of(Platform.WOOCOMMERCE, "port: ${web_port}\nx: ${nope}\n"));
        var ex = assertThrows(IllegalStateException.class,
                () -> renderer.render(tenant(Platform.WOOCOMMERCE), GROWTH, CREDS, 8001));
        assertTrue(ex.getMessage().contains("nope"));
    }

    @Test
    void a4_replacement_values_are_literal() {
        var creds = new Credentials("d", "u", "a$1\\b", "r", "adm", "p");
        var renderer = new EnvironmentRenderer(Map.of(Platform.WOOCOMMERCE, "pw: ${db_password}"));
        assertEquals("pw: a$1\\b", renderer.render(tenant(Platform.WOOCOMMERCE), GROWTH, creds, 8001));
    }
}
