package com.example.cronhooks.service;

import com.example.cronhooks.domain.WebhookJob;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Performs a job's HTTP call on the calling thread, bounded by the job's timeout. Redirects are not followed.
 */
@Slf4j
@Service
public class WebhookCaller {

    static final String DEFAULT_USER_AGENT = "CronHooks/1.0";

    private final WebClient webClient;
    private final int maxResponseBytes;

    public WebhookCaller(WebClient.Builder webClientBuilder,
                         @Value("${cronhooks.http.max-response-bytes:262144}") int maxResponseBytes) {
        this.maxResponseBytes = maxResponseBytes;
        this.webClient = webClientBuilder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
    }

    public CallOutcome call(WebhookJob job) {
        long started = System.nanoTime();
        try {
            WebClient.RequestBodySpec spec = webClient
                    .method(HttpMethod.valueOf(job.getHttpMethod().name()))
                    .uri(URI.create(job.getUrl()))
                    .headers(h -> h.addAll(mergeHeaders(job.getHeaders())));

            WebClient.RequestHeadersSpec<?> request = StringUtils.hasText(job.getBody())
                    ? spec.bodyValue(job.getBody())
                    : spec;

            ResponseEntity<String> resp = request
                    .exchangeToMono(r -> r.bodyToMono(String.class)
                            .onErrorResume(DataBufferLimitException.class,
                                    e -> Mono.just("[response body exceeded " + maxResponseBytes + " bytes]"))
                            .defaultIfEmpty("")
                            .map(body -> ResponseEntity.status(r.rawStatusCode()).body(body)))
                    .timeout(Duration.ofSeconds(job.getTimeoutSeconds()))
                    .block();

            if (resp == null) {
                return CallOutcome.transportError("No response", elapsed(started));
            }
            return CallOutcome.response(resp.getStatusCodeValue(), resp.getBody(), elapsed(started));

        } catch (Exception e) {
            long took = elapsed(started);
            if (isTimeout(e)) {
                log.warn("Webhook call timed out: job={}, url={}, timeout={}s", job.getId(), job.getUrl(), job.getTimeoutSeconds());
                return CallOutcome.timeout(job.getTimeoutSeconds(), took);
            }
            log.warn("Webhook call failed: job={}, url={}, err={}", job.getId(), job.getUrl(), e.toString());
            return CallOutcome.transportError(describe(e), took);
        }
    }

    /**
     * Caller headers win; defaults fill in only what is missing (names compared case-insensitively).
     */
    static HttpHeaders mergeHeaders(Map<String, String> custom) {
        HttpHeaders h = new HttpHeaders();
        if (custom != null) {
            custom.forEach((k, v) -> {
                if (StringUtils.hasText(k) && v != null) h.set(k, v);
            });
        }
        if (!h.containsKey(HttpHeaders.CONTENT_TYPE)) {
            h.setContentType(MediaType.APPLICATION_JSON);
        }
        if (!h.containsKey(HttpHeaders.USER_AGENT)) {
            h.set(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT);
        }
        return h;
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = root.getMessage();
        return StringUtils.hasText(msg) ? root.getClass().getSimpleName() + ": " + msg : root.toString();
    }

    private static long elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
