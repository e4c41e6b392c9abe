package com.example.cronhooks.service;

import com.example.cronhooks.domain.FailureKind;
import lombok.Getter;
import lombok.ToString;

/**
 * Classified result of one outbound call. Transport problems are values here, never exceptions.
 */
@Getter
@ToString
public final class CallOutcome {
    private final boolean success;
    private final Integer responseCode;
    @ToString.Exclude
    private final String responseBody;
    private final String errorMessage;
    private final FailureKind failureKind;
    private final long durationMillis;

    private CallOutcome(boolean success, Integer responseCode, String responseBody,
                        String errorMessage, FailureKind failureKind, long durationMillis) {
        this.success = success;
        this.responseCode = responseCode;
        this.responseBody = responseBody;
        this.errorMessage = errorMessage;
        this.failureKind = failureKind;
        this.durationMillis = durationMillis;
    }

    /**
     * 2xx and 3xx count as delivered; anything else is a non-success response.
     */
    public static CallOutcome response(int code, String body, long durationMillis) {
        boolean ok = code >= 200 && code < 400;
        return new CallOutcome(ok, code, body, null, ok ? null : FailureKind.NON_SUCCESS_RESPONSE, durationMillis);
    }

    public static CallOutcome timeout(int timeoutSeconds, long durationMillis) {
        return new CallOutcome(false, null, null,
                "Request timed out after " + timeoutSeconds + " seconds", FailureKind.TRANSPORT_TIMEOUT, durationMillis);
    }

    public static CallOutcome transportError(String message, long durationMillis) {
        return new CallOutcome(false, null, null, message, FailureKind.TRANSPORT_ERROR, durationMillis);
    }

    /**
     * Outcome for an attempt whose worker disappeared mid-call; whether the endpoint received it is unknown.
     */
    public static CallOutcome workerLost() {
        return transportError("Worker lost during call, outcome unknown", 0);
    }
}
