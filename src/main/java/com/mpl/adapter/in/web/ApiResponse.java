package com.mpl.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mpl.domain.model.CaseWarning;

import java.util.List;

/**
 * Response envelope shared by every endpoint
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        Object data,
        List<String> errors,
        List<CaseWarning> warnings
) {
    public static ApiResponse success(String message, Object data) {
        return new ApiResponse("success", message, data, null, null);
    }

    public static ApiResponse success(String message, Object data, List<CaseWarning> warnings) {
        return new ApiResponse("success", message, data, null, warnings == null || warnings.isEmpty() ? null : warnings);
    }

    public static ApiResponse error(String message, List<String> errors) {
        return new ApiResponse("error", message, null, errors, null);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null, null, null);
    }
}
