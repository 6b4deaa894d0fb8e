package net.storefleet.core.model;

import net.storefleet.core.allocator.PlanCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/** 터키어 로캘(i/ı)에서도 코드 변환이 같아야 함 */
class CodeCaseTest {
    private Locale saved;

    @BeforeEach
    void turkish() {
        saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restore() {
        Locale.setDefault(saved);
    }

    @Test
    void script_args_and_keys_stay_ascii() {
        assertEquals("files", BackupJob.Scope.FILES.arg());
        assertEquals(BackupJob.Scope.FILES, BackupJob.Scope.from("files"));
        assertEquals("woocommerce", Platform.WOOCOMMERCE.key());
        assertEquals(Platform.WOOCOMMERCE, Platform.from("woocommerce"));
    }

    @Test
    void status_codes_parse_lowercase_input() {
        assertEquals(Tenant.Status.PROVISIONING, Tenant.Status.from("provisioning"));
        assertEquals(Server.Status.ACTIVE, Server.Status.from("active"));
        assertEquals(ResourceAlert.Kind.DISK_CRITICAL, ResourceAlert.Kind.from("disk_critical"));
    }

    @Test
    void plan_lookup_ignores_locale() throws Exception {
        assertEquals("professional", PlanCatalog.defaults().require("PROFESSIONAL").code());
        assertEquals("business", PlanCatalog.defaults().require("BUSINESS").code());
    }
}
