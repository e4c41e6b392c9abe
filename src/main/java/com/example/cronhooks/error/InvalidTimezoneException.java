package com.example.cronhooks.error;

public class InvalidTimezoneException extends CronhooksException {

    public InvalidTimezoneException(String timezone, Throwable cause) {
        super("Invalid timezone: " + timezone, cause);
    }
}
