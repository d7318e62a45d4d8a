package com.tsl.tripsearch.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    static final String TRACE_HEADER = "x-trace-id";
    static final String REQUEST_HEADER = "x-request-id";

    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value;
        }
        return UUID.randomUUID().toString();
    }

    public static String resolveOrGenerate(HttpServletRequest request, String headerName) {
        return resolveOrGenerate(request.getHeader(headerName));
    }
}
