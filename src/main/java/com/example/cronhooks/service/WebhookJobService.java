package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.ExecutionAttempt;
import com.example.cronhooks.domain.ScheduleKind;
import com.example.cronhooks.domain.TargetMethod;
import com.example.cronhooks.domain.WebhookJob;
import com.example.cronhooks.error.AlreadyInactiveException;
import com.example.cronhooks.error.InvalidJobDefinitionException;
import com.example.cronhooks.error.JobNotFoundException;
import com.example.cronhooks.repo.ExecutionAttemptRepo;
import com.example.cronhooks.repo.PeriodicDispatchRepo;
import com.example.cronhooks.repo.WebhookJobRepo;
import com.example.cronhooks.web.dto.AttemptView;
import com.example.cronhooks.web.dto.JobRequest;
import com.example.cronhooks.web.dto.JobView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Management operations on jobs. Definition checks happen here, synchronously; queue state is delegated to
 * {@link SchedulePlanner} and {@link JobLifecycleService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookJobService {

    static final int MAX_RETRIES = 20;
    static final int MAX_RETRY_BASE_DELAY_SECONDS = 86_400;
    static final int MAX_TIMEOUT_SECONDS = 300;

    private final WebhookJobRepo jobRepo;
    private final ExecutionAttemptRepo attemptRepo;
    private final PeriodicDispatchRepo periodicRepo;
    private final SchedulePlanner planner;
    private final JobLifecycleService lifecycle;
    private final DispatchGateway gateway;
    private final ObjectMapper mapper;

    @Transactional
    public WebhookJob createJob(JobRequest req) {
        WebhookJob job = new WebhookJob();
        job.setScheduleKind(req.getScheduleKind());
        apply(job, req);
        validateDefinition(job);
        validateSchedule(job);

        jobRepo.saveAndFlush(job);
        if (job.isActive()) {
            planner.schedule(job);
        }
        log.info("Created {} job id={}, name='{}'", job.getScheduleKind(), job.getId(), job.getName());
        return job;
    }

    /**
     * Validates the new definition first, then cancels the current schedule, applies the change and
     * reschedules if the job ends up active.
     */
    @Transactional
    public WebhookJob updateJob(Long id, JobRequest req) {
        WebhookJob existing = findJob(id);
        if (req.getScheduleKind() != null && req.getScheduleKind() != existing.getScheduleKind()) {
            throw new InvalidJobDefinitionException("scheduleKind", "cannot be changed after creation");
        }

        WebhookJob candidate = copyOf(existing);
        apply(candidate, req);
        validateDefinition(candidate);
        validateSchedule(candidate);

        lifecycle.cancel(id);

        WebhookJob job = findJob(id);
        apply(job, req);
        job.setActive(candidate.isActive());
        jobRepo.saveAndFlush(job);
        if (job.isActive()) {
            planner.schedule(job);
        }
        log.info("Updated job id={}, active={}", id, job.isActive());
        return job;
    }

    @Transactional
    public void deleteJob(Long id) {
        lifecycle.cancel(id);
        attemptRepo.deleteByJobId(id);
        periodicRepo.deleteByJobId(id);
        jobRepo.deleteById(id);
        log.info("Deleted job id={}", id);
    }

    @Transactional
    public WebhookJob cancelJob(Long id) {
        WebhookJob job = findJob(id);
        if (!job.isActive()) {
            throw new AlreadyInactiveException(id);
        }
        return lifecycle.cancel(id);
    }

    @Transactional
    public WebhookJob reactivateJob(Long id) {
        return lifecycle.reactivate(id);
    }

    /**
     * Enqueues attempt 1 for immediate delivery. For a ONCE job this replaces its pending dispatch.
     */
    @Transactional
    public String triggerNow(Long id) {
        WebhookJob job = findJob(id);
        if (!job.isActive()) {
            throw new InvalidJobDefinitionException("active", "job is inactive, activate it first");
        }
        String ticket = gateway.enqueueNow(id, 1);
        if (job.isOnce()) {
            String previous = job.getDispatchHandle();
            jobRepo.updateDispatchHandle(id, ticket);
            if (previous != null) {
                gateway.revoke(previous);
            }
        }
        log.info("Manual run requested for job {}, ticket={}", id, ticket);
        return ticket;
    }

    @Transactional(readOnly = true)
    public JobView getJob(Long id) {
        return toView(findJob(id));
    }

    @Transactional(readOnly = true)
    public Page<JobView> listJobs(String tenantId, ScheduleKind kind, Boolean active, Pageable pageable) {
        return jobRepo.search(tenantId, kind, active, pageable).map(this::toView);
    }

    @Transactional(readOnly = true)
    public Page<AttemptView> listExecutions(Long id, Pageable pageable) {
        if (!jobRepo.existsById(id)) {
            throw new JobNotFoundException(id);
        }
        return attemptRepo.findByJobIdOrderByExecutedAtDescIdDesc(id, pageable).map(AttemptView::of);
    }

    public JobView toView(WebhookJob j) {
        Optional<ExecutionAttempt> last = attemptRepo.findFirstByJobIdOrderByExecutedAtDescIdDesc(j.getId());
        return JobView.builder()
                .id(j.getId())
                .tenantId(j.getTenantId())
                .name(j.getName())
                .scheduleKind(j.getScheduleKind())
                .fireAt(j.getFireAt())
                .cronExpression(j.getCronExpression())
                .timezone(j.getTimezone())
                .httpMethod(j.getHttpMethod())
                .url(j.getUrl())
                .headers(j.getHeaders())
                .body(j.getBody())
                .active(j.isActive())
                .maxRetries(j.getMaxRetries())
                .retryBaseDelaySeconds(j.getRetryBaseDelaySeconds())
                .timeoutSeconds(j.getTimeoutSeconds())
                .lastExecutionAt(j.getLastExecutionAt())
                .createdAt(j.getCreatedAt())
                .updatedAt(j.getUpdatedAt())
                .executionCount(attemptRepo.countByJobId(j.getId()))
                .lastExecutionStatus(last.map(ExecutionAttempt::getStatus).orElse(null))
                .build();
    }

    private WebhookJob findJob(Long id) {
        return jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    /**
     * Copies request fields onto the job. Null request fields keep the job's current value.
     */
    private void apply(WebhookJob job, JobRequest req) {
        if (req.getName() != null) job.setName(req.getName().trim());
        if (req.getTenantId() != null) job.setTenantId(req.getTenantId());
        if (req.getFireAt() != null) job.setFireAt(parseFireAt(req.getFireAt()));
        if (req.getCronExpression() != null) job.setCronExpression(req.getCronExpression().trim());
        if (req.getTimezone() != null) {
            job.setTimezone(StringUtils.hasText(req.getTimezone()) ? req.getTimezone().trim() : WebhookJob.DEFAULT_TIMEZONE);
        }
        if (req.getHttpMethod() != null) job.setHttpMethod(req.getHttpMethod());
        if (req.getUrl() != null) job.setUrl(req.getUrl().trim());
        if (req.getHeaders() != null) job.setHeaders(new LinkedHashMap<>(req.getHeaders()));
        if (req.getBody() != null) job.setBody(bodyText(req.getBody()));
        if (req.getActive() != null) job.setActive(req.getActive());
        if (req.getMaxRetries() != null) job.setMaxRetries(req.getMaxRetries());
        if (req.getRetryBaseDelaySeconds() != null) job.setRetryBaseDelaySeconds(req.getRetryBaseDelaySeconds());
        if (req.getTimeoutSeconds() != null) job.setTimeoutSeconds(req.getTimeoutSeconds());
        if (job.getHttpMethod() == null) job.setHttpMethod(TargetMethod.POST);
    }

    void validateDefinition(WebhookJob job) {
        if (job.getScheduleKind() == null) {
            throw new InvalidJobDefinitionException("scheduleKind", "is required");
        }
        if (!StringUtils.hasText(job.getName())) {
            throw new InvalidJobDefinitionException("name", "is required");
        }
        if (job.isOnce()) {
            if (job.getFireAt() == null) {
                throw new InvalidJobDefinitionException("fireAt", "is required for ONCE jobs");
            }
            if (StringUtils.hasText(job.getCronExpression())) {
                throw new InvalidJobDefinitionException("cronExpression", "must not be set for ONCE jobs");
            }
        } else {
            if (!StringUtils.hasText(job.getCronExpression())) {
                throw new InvalidJobDefinitionException("cronExpression", "is required for RECURRING jobs");
            }
            if (job.getFireAt() != null) {
                throw new InvalidJobDefinitionException("fireAt", "must not be set for RECURRING jobs");
            }
        }
        if (job.getMaxRetries() < 0 || job.getMaxRetries() > MAX_RETRIES) {
            throw new InvalidJobDefinitionException("maxRetries", "must be between 0 and " + MAX_RETRIES);
        }
        if (job.getRetryBaseDelaySeconds() < 0 || job.getRetryBaseDelaySeconds() > MAX_RETRY_BASE_DELAY_SECONDS) {
            throw new InvalidJobDefinitionException("retryBaseDelaySeconds",
                    "must be between 0 and " + MAX_RETRY_BASE_DELAY_SECONDS);
        }
        // 上限必须小于 cronhooks.queue.stale-after-seconds，否则执行中的任务会被当作卡死重新投递
        if (job.getTimeoutSeconds() < 1 || job.getTimeoutSeconds() > MAX_TIMEOUT_SECONDS) {
            throw new InvalidJobDefinitionException("timeoutSeconds", "must be between 1 and " + MAX_TIMEOUT_SECONDS);
        }
        validateUrl(job.getUrl());
    }

    /**
     * Past-time check only matters for a job that is about to be scheduled.
     */
    private void validateSchedule(WebhookJob job) {
        if (job.isActive()) {
            planner.validate(job);
        } else if (job.isOnce()) {
            FireTimeResolver.zoneOf(job.getTimezone());
        } else {
            CronFields.parse(job.getCronExpression());
            FireTimeResolver.zoneOf(job.getTimezone());
        }
    }

    private static void validateUrl(String url) {
        if (!StringUtils.hasText(url)) {
            throw new InvalidJobDefinitionException("url", "is required");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
                throw new InvalidJobDefinitionException("url", "must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw new InvalidJobDefinitionException("url", "is not a valid URL: " + e.getReason());
        }
    }

    private static LocalDateTime parseFireAt(String text) {
        if (!StringUtils.hasText(text)) return null;
        try {
            return FireTimeResolver.parseWallClock(text);
        } catch (DateTimeException e) {
            throw new InvalidJobDefinitionException("fireAt", "must be an ISO-8601 date-time, got '" + text + "'");
        }
    }

    /**
     * Empty JSON objects/arrays and JSON null mean "no body".
     */
    private String bodyText(JsonNode body) {
        if (body.isNull() || body.isMissingNode() || (body.isContainerNode() && body.size() == 0)) {
            return null;
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new InvalidJobDefinitionException("body", "is not serializable JSON: " + e.getOriginalMessage());
        }
    }

    private static WebhookJob copyOf(WebhookJob src) {
        WebhookJob c = new WebhookJob();
        c.setId(src.getId());
        c.setTenantId(src.getTenantId());
        c.setName(src.getName());
        c.setScheduleKind(src.getScheduleKind());
        c.setFireAt(src.getFireAt());
        c.setCronExpression(src.getCronExpression());
        c.setTimezone(src.getTimezone());
        c.setHttpMethod(src.getHttpMethod());
        c.setUrl(src.getUrl());
        c.setHeaders(src.getHeaders() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(src.getHeaders()));
        c.setBody(src.getBody());
        c.setActive(src.isActive());
        c.setMaxRetries(src.getMaxRetries());
        c.setRetryBaseDelaySeconds(src.getRetryBaseDelaySeconds());
        c.setTimeoutSeconds(src.getTimeoutSeconds());
        return c;
    }
}
