package com.samt.configservice.dto.response;

import lombok.Builder;

/**
 * Error envelope shared by all SAMT services.
 */
@Builder
public record ErrorResponse(
    Error error,
    String timestamp
) {

    @Builder
    public record Error(
        String code,
        String message,
        String field,
        Object details
    ) {}
}
