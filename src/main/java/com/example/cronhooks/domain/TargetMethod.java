package com.example.cronhooks.domain;

/**
 * HTTP methods a webhook target may use.
 */
public enum TargetMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
