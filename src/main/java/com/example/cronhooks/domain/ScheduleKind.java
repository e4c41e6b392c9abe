package com.example.cronhooks.domain;

public enum ScheduleKind {
    ONCE,
    RECURRING
}
