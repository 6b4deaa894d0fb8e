package net.storefleet.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.storefleet.core.model.Server;
import net.storefleet.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;

/**
 * 인수 테스트 공통 기반. DB 선택 순서:
 * STOREFLEET_JDBC_URL 지정 DB → STOREFLEET_TEST_DB=h2 이면 H2(PostgreSQL 모드) →
 * Testcontainers PostgreSQL (Docker 가 없으면 경고 후 H2).
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    private static final Logger log = LoggerFactory.getLogger(TestSupport.class);

    protected static DataSource ds;
    protected static PostgreSQLContainer<?> postgres;

    /** FK 자식 → 부모 순서 */
    private static final String[] TABLES = {
            "TB_PROVISIONING_LOG", "TB_PROVISIONING_JOB", "TB_BACKUP_JOB", "TB_SUSPENSION_LOG",
            "TB_HEALTH_ALERT", "TB_TENANT_HEALTH",
            "TB_RESOURCE_ALERT", "TB_ALERT_COOLDOWN", "TB_USAGE_SAMPLE", "TB_QUOTA",
            "TB_PORT_ASSIGNMENT", "TB_TENANT", "TB_SERVER"
    };

    @BeforeAll
    void setupDb() {
        String url = System.getenv("STOREFLEET_JDBC_URL");
        String user = System.getenv("STOREFLEET_JDBC_USER");
        String pass = System.getenv("STOREFLEET_JDBC_PASSWORD");

        if (url == null || url.isBlank()) {
            boolean h2 = "h2".equalsIgnoreCase(System.getenv("STOREFLEET_TEST_DB"));
            if (!h2 && !DockerClientFactory.instance().isDockerAvailable()) {
                log.warn("Docker not available, {} runs on H2 instead of PostgreSQL", getClass().getSimpleName());
                h2 = true;
            }
            if (h2) {
                // 클래스마다 독립된 DB
                url = "jdbc:h2:mem:" + getClass().getSimpleName()
                        + ";MODE=PostgreSQL;DATABASE_TO_LOWER=FALSE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
                user = "sa";
                pass = "";
            } else {
                postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:15-alpine"))
                        .withDatabaseName("storefleet")
                        .withStartupTimeout(Duration.ofMinutes(2));
                postgres.start();

                url = postgres.getJdbcUrl();
                user = postgres.getUsername();
                pass = postgres.getPassword();
            }
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(12);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .cleanDisabled(true)
                .load()
                .migrate();
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
        if (postgres != null) {
            postgres.stop();
            postgres = null;
        }
    }

    protected static void deleteAll(TxRunner tx) throws Exception {
        tx.required(() -> {
            try (var st = TxContext.require().createStatement()) {
                for (String t : TABLES) st.execute("DELETE FROM " + t);
            }
        });
    }

    /** 포트 범위/용량을 지정해 서버 등록 + 하트비트 */
    protected static Server seedServer(TxRunner tx, String hostname, int maxTenants,
                                       int portStart, int portEnd, Instant heartbeat) throws Exception {
        var servers = new net.storefleet.adapter.jdbc.repo.JdbcServerRepository();
        Instant at = heartbeat != null ? heartbeat : Instant.now();
        return tx.required(() -> {
            Server s = servers.upsert(hostname, hostname, "10.0.0.1", maxTenants, portStart, portEnd, at);
            if (heartbeat != null) servers.heartbeat(s.id(), heartbeat);
            return servers.findById(s.id()).orElseThrow();
        });
    }
}
