package com.avf.riskengine.api.dto;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class ApiError {

    private final Instant timestamp;
    private final String path;
    private final int status;
    private final String error;
    private final String message;
    private final List<FieldIssue> details;

    @Getter
    @Builder
    public static class FieldIssue {
        private final String field;
        private final String issue;
    }
}
