package com.callintake.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String status, String message, String field) {

    public static ErrorResponse of(String message) {
        return new ErrorResponse("error", message, null);
    }

    public static ErrorResponse forField(String field, String message) {
        return new ErrorResponse("error", message, field);
    }
}
