package com.userapi.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String error,
        String message,
        String path
) {
    public ApiErrorResponse(String error) {
        this(error, null, null);
    }
}
