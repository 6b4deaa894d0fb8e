package net.storefleet.app.api;

import net.storefleet.app.api.dto.JobLogView;
import net.storefleet.app.api.error.ErrorCode;
import net.storefleet.app.api.error.NotFoundException;
import net.storefleet.core.queue.JobDispatchService;
import net.storefleet.core.spi.ProvisioningLogRepository;
import net.storefleet.core.spi.TxRunner;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 로그 접근 권한 없이 잡 단계 이력을 본다 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private final JobDispatchService dispatch;
    private final ProvisioningLogRepository logs;
    private final TxRunner tx;

    public JobController(JobDispatchService dispatch, ProvisioningLogRepository logs, TxRunner tx) {
        this.dispatch = dispatch;
        this.logs = logs;
        this.tx = tx;
    }

    @GetMapping("/{id}/log")
    public JobLogView log(@PathVariable long id) throws Exception {
        var job = dispatch.find(id)
                .orElseThrow(() -> new NotFoundException(ErrorCode.JOB_NOT_FOUND, "unknown job: " + id));
        return JobLogView.of(job, tx.required(() -> logs.findByJob(id)));
    }
}
