package com.example.cronhooks.error;

/**
 * Cross-field problems in a job definition (wrong schedule fields for the kind, bad bounds, bad url).
 */
public class InvalidJobDefinitionException extends CronhooksException {

    private final String field;

    public InvalidJobDefinitionException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
