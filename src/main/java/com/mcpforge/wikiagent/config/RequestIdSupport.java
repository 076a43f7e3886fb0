package com.mcpforge.wikiagent.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";

    private static final int MAX_INBOUND_LENGTH = 128;

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * 取客户端传入的 X-Request-Id；缺失、为空或过长时生成新的。
     */
    public static String fromHeader(HttpServletRequest request) {
        String headerValue = request.getHeader(HEADER_REQUEST_ID);
        if (headerValue == null || headerValue.isBlank() || headerValue.length() > MAX_INBOUND_LENGTH) {
            return newRequestId();
        }
        return headerValue.trim();
    }
}
