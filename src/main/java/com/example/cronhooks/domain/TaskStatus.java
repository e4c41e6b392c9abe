package com.example.cronhooks.domain;

public enum TaskStatus {
    PENDING,   // 待投递（可领取）
    RUNNING,   // 已被某个 worker 领取
    DONE,      // 执行器已处理完（无论 attempt 成败）
    FAILED,    // 执行器自身异常
    REVOKED    // 已撤销（取消/重排期），不再投递
}
