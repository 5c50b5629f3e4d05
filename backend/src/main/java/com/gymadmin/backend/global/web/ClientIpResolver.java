package com.gymadmin.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;

/**
 * Client address for security events and audit records: first {@code X-Forwarded-For} hop, then
 * {@code X-Real-IP}, then the socket peer.
 */
public final class ClientIpResolver {

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final String X_REAL_IP = "X-Real-IP";
    private static final String UNKNOWN = "unknown";

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(X_FORWARDED_FOR);
        if (StringUtils.hasText(forwarded)) {
            String firstHop = forwarded.split(",")[0].trim();
            if (isUsable(firstHop)) {
                return firstHop;
            }
        }
        String realIp = request.getHeader(X_REAL_IP);
        if (isUsable(realIp)) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }

    private static boolean isUsable(String value) {
        return StringUtils.hasText(value) && !UNKNOWN.equalsIgnoreCase(value.trim());
    }
}
