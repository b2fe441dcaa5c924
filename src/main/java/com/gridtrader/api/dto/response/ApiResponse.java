package com.gridtrader.api.dto.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import lombok.Getter;

/** Success envelope; {@link ApiErrorResponse} is its failure counterpart. */
@Getter
@JsonPropertyOrder({"success", "data", "timestamp"})
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp = Instant.now();

    private ApiResponse(T data) {
        this.data = data;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
