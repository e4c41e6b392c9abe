package com.example.cronhooks.error;

public class JobNotFoundException extends CronhooksException {

    public JobNotFoundException(Long jobId) {
        super("Webhook job not found: id=" + jobId);
    }
}
