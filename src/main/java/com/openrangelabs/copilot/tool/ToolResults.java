package com.openrangelabs.copilot.tool;

import com.openrangelabs.copilot.model.ErrorInfo;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for the status maps returned by tools.
 */
public final class ToolResults {

    public static final String STATUS = "status";
    public static final String SUCCESS = "success";
    public static final String NOT_FOUND = "not_found";
    public static final String ERROR = "error";

    private ToolResults() {
    }

    public static Map<String, Object> success() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(STATUS, SUCCESS);
        return result;
    }

    public static Map<String, Object> error(String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(STATUS, ERROR);
        result.put("message", message);
        return result;
    }

    /**
     * Maps a connector error to {@code not_found} or {@code error}, keeping its code and HTTP status.
     */
    public static Map<String, Object> failure(ErrorInfo error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(STATUS, error.isNotFound() ? NOT_FOUND : ERROR);
        result.put("message", error.getMessage());
        result.put("error_kind", error.getKind().name());
        if (error.getCode() != null) {
            result.put("error_code", error.getCode());
        }
        if (error.getHttpStatus() != null) {
            result.put("http_status", error.getHttpStatus());
        }
        return result;
    }
}
