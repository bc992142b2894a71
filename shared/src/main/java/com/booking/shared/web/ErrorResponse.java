package com.booking.shared.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * JSON error body: {@code {"code": "NOT_FOUND", "message": "...", "internalCode": "ORGANIZATION_NOT_FOUND"}}.
 */
@Getter
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final String code;
    private final String message;
    private final String internalCode;
}
