package com.example.cronhooks.web;

import com.example.cronhooks.error.AlreadyActiveException;
import com.example.cronhooks.error.AlreadyInactiveException;
import com.example.cronhooks.error.InvalidCronException;
import com.example.cronhooks.error.InvalidJobDefinitionException;
import com.example.cronhooks.error.InvalidTimezoneException;
import com.example.cronhooks.error.JobNotFoundException;
import com.example.cronhooks.error.ScheduleInPastException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps scheduling errors to {@code {"detail": ...}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(JobNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(JobNotFoundException ex) {
        return detail(ex.getMessage());
    }

    @ExceptionHandler({ScheduleInPastException.class, InvalidCronException.class, InvalidTimezoneException.class,
            AlreadyActiveException.class, AlreadyInactiveException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleScheduling(RuntimeException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        return detail(ex.getMessage());
    }

    @ExceptionHandler(InvalidJobDefinitionException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidDefinition(InvalidJobDefinitionException ex) {
        Map<String, Object> body = detail(ex.getMessage());
        body.put("field", ex.getField());
        return body;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        Map<String, Object> body = detail("Invalid request");
        body.put("errors", fields);
        return body;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return detail("Malformed request body");
    }

    private static Map<String, Object> detail(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("detail", message);
        return body;
    }
}
