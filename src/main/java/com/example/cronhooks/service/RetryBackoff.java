package com.example.cronhooks.service;

/**
 * Exponential retry delay: {@code base * 2^(attempt-1)} seconds, saturating at {@link Long#MAX_VALUE}.
 */
public final class RetryBackoff {

    private RetryBackoff() {
    }

    public static long delaySeconds(int retryBaseDelaySeconds, int attemptNumber) {
        if (retryBaseDelaySeconds <= 0) return 0L;
        int shift = Math.max(0, attemptNumber - 1);
        if (shift >= 62) return Long.MAX_VALUE;
        long factor = 1L << shift;
        long base = retryBaseDelaySeconds;
        if (base > Long.MAX_VALUE / factor) return Long.MAX_VALUE;
        return base * factor;
    }
}
