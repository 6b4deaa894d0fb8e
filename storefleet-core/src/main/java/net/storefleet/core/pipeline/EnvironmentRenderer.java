package net.storefleet.core.pipeline;

import net.storefleet.core.model.Credentials;
import net.storefleet.core.model.PlanTier;
import net.storefleet.core.model.Platform;
import net.storefleet.core.model.Tenant;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 플랫폼별 compose 템플릿(classpath: templates/{platform}-compose.yml)에
 * 테넌트/플랜/자격 증명 값을 채워 넣는다. 정의되지 않은 placeholder 는 오류.
 */
public final class EnvironmentRenderer {
    public static final String DEFINITION_FILE = "docker-compose.yml";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([a-z_]+)}");

    private final Map<Platform, String> templates = new EnumMap<>(Platform.class);

    public EnvironmentRenderer() {
        for (Platform p : Platform.values()) {
            templates.put(p, load("templates/" + p.key() + "-compose.yml"));
        }
    }

    /** 테스트/운영에서 템플릿을 직접 주입 */
    public EnvironmentRenderer(Map<Platform, String> templates) {
        this.templates.putAll(templates);
    }

    public String render(Tenant tenant, PlanTier plan, Credentials creds, int port) {
        String template = templates.get(tenant.platform());
        if (template == null) throw new IllegalStateException("no template for " + tenant.platform());

        Map<String, String> values = new HashMap<>();
        values.put("tenant_id", String.valueOf(tenant.id()));
        values.put("domain", tenant.domain());
        values.put("admin_email", tenant.email());
        values.put("web_port", String.valueOf(port));
        values.put("memory_limit", plan.memoryLimit());
        values.put("cpu_limit", plan.cpuLimit());
        values.put("db_name", creds.dbName());
        values.put("db_user", creds.dbUser());
        values.put("db_password", creds.dbPassword());
        values.put("db_root_password", creds.dbRootPassword());
        values.put("admin_user", creds.adminUser());
        values.put("admin_password", creds.adminPassword());

        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 256);
        while (m.find()) {
            String v = values.get(m.group(1));
            if (v == null) throw new IllegalStateException("undefined template placeholder: " + m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(v));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String load(String resource) {
        try (InputStream in = EnvironmentRenderer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("template not found on classpath: " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("template read failed: " + resource, e);
        }
    }
}
