package com.assessval.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body returned by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String code,
    List<String> details
) {

    public static ErrorResponse of(String error, String code) {
        return new ErrorResponse(error, code, null);
    }
}
