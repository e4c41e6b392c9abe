package com.example.cronhooks.error;

public class AlreadyInactiveException extends CronhooksException {

    public AlreadyInactiveException(Long jobId) {
        super("Webhook job is already inactive: id=" + jobId);
    }
}
