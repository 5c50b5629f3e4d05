package com.gymadmin.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:gymadmin:";

    private final String code;
    private final String detail;
    private final String type;
    private final Map<String, Object> properties;

    public ProblemException(ErrorCode errorCode, String detail) {
        this(errorCode.status(), errorCode.name(), detail, Map.of());
    }

    public ProblemException(ErrorCode errorCode, String detail, Map<String, ?> properties) {
        this(errorCode.status(), errorCode.name(), detail, properties);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, Map.of());
    }

    public ProblemException(HttpStatus status, String code, String detail, Map<String, ?> properties) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
        this.properties = properties == null || properties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(properties));
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }
}
