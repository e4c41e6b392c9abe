package com.example.cronhooks.domain;

public enum AttemptStatus {
    PENDING,   // 已创建，调用进行中
    SUCCESS,   // 2xx / 3xx
    FAILED,    // 终态失败
    RETRYING   // 失败，且下一次 attempt 已入队
}
