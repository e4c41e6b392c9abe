package com.example.cronhooks.web.dto;

import com.example.cronhooks.domain.AttemptStatus;
import com.example.cronhooks.domain.ExecutionAttempt;
import com.example.cronhooks.domain.FailureKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttemptView {
    private Long id;
    private Long jobId;
    private int attemptNumber;
    private AttemptStatus status;
    private Integer responseCode;
    private String responseBody;
    private String errorMessage;
    private FailureKind failureKind;
    private Long durationMillis;
    private Instant executedAt;

    public static AttemptView of(ExecutionAttempt a) {
        return AttemptView.builder()
                .id(a.getId())
                .jobId(a.getJobId())
                .attemptNumber(a.getAttemptNumber())
                .status(a.getStatus())
                .responseCode(a.getResponseCode())
                .responseBody(a.getResponseBody())
                .errorMessage(a.getErrorMessage())
                .failureKind(a.getFailureKind())
                .durationMillis(a.getDurationMillis())
                .executedAt(a.getExecutedAt())
                .build();
    }
}
