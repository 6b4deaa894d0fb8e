package net.storefleet.integration.spring;

import net.storefleet.adapter.jdbc.repo.*;
import net.storefleet.core.spi.*;
import net.storefleet.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class StorefleetSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public ServerRepository serverRepository() { return new JdbcServerRepository(); }
    @Bean public TenantRepository tenantRepository() { return new JdbcTenantRepository(); }
    @Bean public ProvisioningJobRepository provisioningJobRepository() { return new JdbcProvisioningJobRepository(); }
    @Bean public PortAssignmentRepository portAssignmentRepository() { return new JdbcPortAssignmentRepository(); }
    @Bean public QuotaRepository quotaRepository() { return new JdbcQuotaRepository(); }
    @Bean public UsageRepository usageRepository() { return new JdbcUsageRepository(); }
    @Bean public ResourceAlertRepository resourceAlertRepository() { return new JdbcResourceAlertRepository(); }
    @Bean public ProvisioningLogRepository provisioningLogRepository() { return new JdbcProvisioningLogRepository(); }
    @Bean public SuspensionLogRepository suspensionLogRepository() { return new JdbcSuspensionLogRepository(); }
    @Bean public BackupJobRepository backupJobRepository() { return new JdbcBackupJobRepository(); }
    @Bean public TenantHealthRepository tenantHealthRepository() { return new JdbcTenantHealthRepository(); }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}
