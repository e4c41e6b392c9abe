package com.example.cronhooks.web;

import com.example.cronhooks.domain.ScheduleKind;
import com.example.cronhooks.domain.WebhookJob;
import com.example.cronhooks.service.WebhookJobService;
import com.example.cronhooks.web.dto.AttemptView;
import com.example.cronhooks.web.dto.JobRequest;
import com.example.cronhooks.web.dto.JobView;
import com.example.cronhooks.web.dto.PagedResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class WebhookJobController {

    private static final int MAX_PAGE_SIZE = 200;

    private final WebhookJobService jobService;

    @PostMapping
    public ResponseEntity<JobView> create(@Valid @RequestBody JobRequest req) {
        WebhookJob job = jobService.createJob(req);
        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.toView(job));
    }

    @GetMapping
    public PagedResponse<JobView> list(@RequestParam(required = false) String tenantId,
                                       @RequestParam(required = false) ScheduleKind kind,
                                       @RequestParam(required = false) Boolean active,
                                       @RequestParam(defaultValue = "1") int page,
                                       @RequestParam(defaultValue = "20") int pageSize) {
        PageRequest pageable = PageRequest.of(Math.max(0, page - 1), clamp(pageSize), Sort.by(Sort.Direction.DESC, "id"));
        return PagedResponse.of(jobService.listJobs(tenantId, kind, active, pageable));
    }

    @GetMapping("/{id}")
    public JobView get(@PathVariable Long id) {
        return jobService.getJob(id);
    }

    @PutMapping("/{id}")
    public JobView update(@PathVariable Long id, @Valid @RequestBody JobRequest req) {
        return jobService.toView(jobService.updateJob(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        jobService.deleteJob(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/cancel")
    public Map<String, Object> cancel(@PathVariable Long id) {
        WebhookJob job = jobService.cancelJob(id);
        return detail("Webhook \"" + job.getName() + "\" has been canceled");
    }

    @PostMapping("/{id}/activate")
    public Map<String, Object> activate(@PathVariable Long id) {
        WebhookJob job = jobService.reactivateJob(id);
        return detail("Webhook \"" + job.getName() + "\" has been activated");
    }

    @PostMapping("/{id}/run")
    public ResponseEntity<Map<String, Object>> runNow(@PathVariable Long id) {
        String ticket = jobService.triggerNow(id);
        Map<String, Object> body = detail("Webhook run queued");
        body.put("ticket", ticket);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/{id}/executions")
    public PagedResponse<AttemptView> executions(@PathVariable Long id,
                                                 @RequestParam(defaultValue = "1") int page,
                                                 @RequestParam(defaultValue = "20") int pageSize) {
        return PagedResponse.of(jobService.listExecutions(id, PageRequest.of(Math.max(0, page - 1), clamp(pageSize))));
    }

    private static int clamp(int pageSize) {
        return Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));
    }

    private static Map<String, Object> detail(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", message);
        return body;
    }
}
