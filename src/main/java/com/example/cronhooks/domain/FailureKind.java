package com.example.cronhooks.domain;

/**
 * Why an outbound call did not succeed. Every kind is retried the same way.
 */
public enum FailureKind {
    TRANSPORT_TIMEOUT,
    TRANSPORT_ERROR,
    NON_SUCCESS_RESPONSE
}
