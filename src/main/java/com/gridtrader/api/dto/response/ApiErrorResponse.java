package com.gridtrader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gridtrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * Failure envelope written by {@link com.gridtrader.exception.GlobalExceptionHandler}.
 * Same top-level shape as {@link ApiResponse}, with {@code error} in place of {@code data}.
 */
@Getter
@JsonPropertyOrder({"success", "error", "timestamp"})
public class ApiErrorResponse {

    private final boolean success = false;
    private final Error error;
    private final Instant timestamp = Instant.now();

    private ApiErrorResponse(Error error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> safeDetails = details == null ? Map.of() : details;
        return new ApiErrorResponse(
                new Error(errorCode.getCode(), errorCode.getHttpStatus(), message, safeDetails, path));
    }

    /** Error body; empty details are left out of the JSON. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Error(String code, int status, String message, Map<String, Object> details, String path) {}
}
