package net.storefleet.app.api;

import jakarta.validation.Valid;
import net.storefleet.app.api.dto.IntakeBody;
import net.storefleet.app.api.dto.RestoreBody;
import net.storefleet.app.api.dto.SuspendBody;
import net.storefleet.app.api.dto.TenantView;
import net.storefleet.app.api.error.ErrorCode;
import net.storefleet.app.api.error.NotFoundException;
import net.storefleet.core.backup.BackupService;
import net.storefleet.core.lifecycle.IntakeReceipt;
import net.storefleet.core.lifecycle.TenantLifecycleService;
import net.storefleet.core.model.BackupJob;
import net.storefleet.core.model.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tenants")
public class TenantController {
    private static final Logger log = LoggerFactory.getLogger(TenantController.class);

    private final TenantLifecycleService lifecycle;
    private final BackupService backups;

    public TenantController(TenantLifecycleService lifecycle, BackupService backups) {
        this.lifecycle = lifecycle;
        this.backups = backups;
    }

    @PostMapping
    public ResponseEntity<IntakeReceipt> submit(@Valid @RequestBody IntakeBody body) throws Exception {
        log.info("intake: domain={} platform={} plan={}", body.domain(), body.platform(), body.plan());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(lifecycle.submit(body.toRequest()));
    }

    @GetMapping("/{id}")
    public TenantView get(@PathVariable long id) throws Exception {
        return TenantView.of(require(id));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<Map<String, Long>> retry(@PathVariable long id) throws Exception {
        require(id);
        long jobId = lifecycle.retry(id);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("tenantId", id, "jobId", jobId));
    }

    @PostMapping("/{id}/suspend")
    public TenantView suspend(@PathVariable long id, @Valid @RequestBody SuspendBody body) throws Exception {
        require(id);
        return TenantView.of(lifecycle.suspend(id, body.reason(), body.automatic()));
    }

    @PostMapping("/{id}/reactivate")
    public TenantView reactivate(@PathVariable long id) throws Exception {
        require(id);
        return TenantView.of(lifecycle.reactivate(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> decommission(@PathVariable long id) throws Exception {
        require(id);
        lifecycle.decommission(id);
        return ResponseEntity.noContent().build();
    }

    // --- backup / restore ---

    @PostMapping("/{id}/backups")
    public ResponseEntity<Map<String, String>> backup(@PathVariable long id,
                                                      @RequestParam(required = false) String scope) throws Exception {
        require(id);
        String snapshot = backups.backup(id, BackupJob.Scope.from(scope));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("snapshotId", snapshot));
    }

    @PostMapping("/{id}/restore")
    public ResponseEntity<Void> restore(@PathVariable long id, @Valid @RequestBody RestoreBody body) throws Exception {
        require(id);
        backups.restore(id, body.snapshotId(), BackupJob.Scope.from(body.scope()));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/backups")
    public List<BackupJob> backupHistory(@PathVariable long id) throws Exception {
        require(id);
        return backups.history(id);
    }

    private Tenant require(long id) throws Exception {
        return lifecycle.find(id)
                .orElseThrow(() -> new NotFoundException(ErrorCode.TENANT_NOT_FOUND, "unknown tenant: " + id));
    }
}
