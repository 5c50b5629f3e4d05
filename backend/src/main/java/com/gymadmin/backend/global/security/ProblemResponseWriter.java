package com.gymadmin.backend.global.security;

import java.io.IOException;

import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.global.error.ProblemResponse;
import com.gymadmin.backend.global.error.RetryableProblemException;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes problem bodies from filters and Spring Security handlers, where {@code RestExceptionHandler} is not
 * reached.
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;

    public ProblemResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletRequest request, HttpServletResponse response, ProblemException ex)
            throws IOException {
        if (ex instanceof RetryableProblemException retryable) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryable.getRetryAfterSeconds()));
        }
        write(response, ProblemResponse.from(ex, request.getRequestURI()));
    }

    public void write(HttpServletRequest request, HttpServletResponse response, HttpStatus status, String code,
                      String detail) throws IOException {
        write(response, ProblemResponse.of(status, code, detail, request.getRequestURI()));
    }

    private void write(HttpServletResponse response, ProblemResponse body) throws IOException {
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
