package com.resourcex.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.resourcex.aspect.TimingAspect;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standardized API response wrapper
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private Boolean ok;
    private T data;
    private String error;
    private String elapsed;

    /**
     * Create successful response with the elapsed time of the service call
     * measured on this thread
     */
    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .ok(true)
                .data(data)
                .elapsed(TimingAspect.getAndClearExecutionTime())
                .build();
    }

    /**
     * Create error response
     */
    public static <T> ApiResponse<T> error(String error) {
        return ApiResponse.<T>builder()
                .ok(false)
                .error(error)
                .elapsed(TimingAspect.getAndClearExecutionTime())
                .build();
    }
}
