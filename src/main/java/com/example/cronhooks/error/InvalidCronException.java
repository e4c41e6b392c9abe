package com.example.cronhooks.error;

public class InvalidCronException extends CronhooksException {

    public InvalidCronException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
    }

    public InvalidCronException(String expression, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + cause.getMessage(), cause);
    }
}
