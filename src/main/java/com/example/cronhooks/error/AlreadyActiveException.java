package com.example.cronhooks.error;

public class AlreadyActiveException extends CronhooksException {

    public AlreadyActiveException(Long jobId) {
        super("Webhook job is already active: id=" + jobId);
    }
}
