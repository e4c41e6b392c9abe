package com.example.cronhooks.error;

/**
 * Base of every synchronous scheduling failure surfaced to callers.
 * These are never retried; execution-time failures are recorded on the attempt instead.
 */
public abstract class CronhooksException extends RuntimeException {

    protected CronhooksException(String message) {
        super(message);
    }

    protected CronhooksException(String message, Throwable cause) {
        super(message, cause);
    }
}
