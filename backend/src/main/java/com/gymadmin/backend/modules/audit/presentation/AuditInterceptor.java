package com.gymadmin.backend.modules.audit.presentation;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.gymadmin.backend.global.security.SecurityUtils;
import com.gymadmin.backend.global.web.ClientIpResolver;
import com.gymadmin.backend.global.web.RequestIdFilter;
import com.gymadmin.backend.modules.access.presentation.AccessControlInterceptor;
import com.gymadmin.backend.modules.audit.application.AuditLogService;
import com.gymadmin.backend.modules.audit.application.AuditPayloadSanitizer;
import com.gymadmin.backend.modules.audit.domain.AuditOutcome;
import com.gymadmin.backend.modules.audit.presentation.annotation.Audited;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.staff.domain.StaffIdentity;
import com.gymadmin.backend.modules.staff.presentation.PinStepUpRequestBodyAdvice;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Completion hook for {@link Audited} handlers. Only exchanges that finished with a status below 400 are recorded;
 * rejections by the access layer never reach this point with a success status.
 * <p>
 * The actor is the PIN-verified staff member when step-up ran, otherwise the request principal. Exchanges with
 * no actor carrying both an id and an email are not recorded.
 */
@Component
public class AuditInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuditInterceptor.class);

    private final AuditLogService auditLogService;
    private final AuditPayloadSanitizer sanitizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditInterceptor(AuditLogService auditLogService, AuditPayloadSanitizer sanitizer,
                            ObjectMapper objectMapper, Clock clock) {
        this.auditLogService = auditLogService;
        this.sanitizer = sanitizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return;
        }
        Audited audited = handlerMethod.getMethodAnnotation(Audited.class);
        if (audited == null) {
            return;
        }
        int status = response.getStatus();
        if (ex != null || status >= 400) {
            log.debug("No audit record for {}: status {}", audited.action(), status);
            return;
        }

        try {
            buildOutcome(request, status, audited).ifPresent(auditLogService::record);
        } catch (RuntimeException buildFailure) {
            log.warn("Could not prepare audit record for {}", audited.action(), buildFailure);
        }
    }

    Optional<AuditOutcome> buildOutcome(HttpServletRequest request, int status, Audited audited) {
        Optional<Actor> actor = resolveActor(request);
        if (actor.isEmpty()) {
            log.warn("Audit record for {} skipped: no identifiable actor", audited.action());
            return Optional.empty();
        }

        Map<String, String> pathVariables = pathVariables(request);
        Object requestBody = toTree(request.getAttribute(AuditCaptureAdvice.REQUEST_BODY_ATTRIBUTE));
        Object responseBody = toTree(request.getAttribute(AuditCaptureAdvice.RESPONSE_BODY_ATTRIBUTE));

        Map<String, Object> requestData = sanitizer.requestSnapshot(
                audited.action(),
                request.getMethod(),
                request.getRequestURI(),
                pathVariables,
                queryParameters(request),
                requestBody,
                request.getContentType(),
                request.getHeader(HttpHeaders.USER_AGENT)
        );
        Map<String, Object> responseData = sanitizer.responseSnapshot(audited.action(), status, responseBody);

        return Optional.of(new AuditOutcome(
                actor.get().id(),
                actor.get().email(),
                audited.action(),
                audited.resourceType(),
                resourceId(audited, pathVariables, requestBody, responseBody),
                branchId(request, pathVariables, requestBody),
                ClientIpResolver.resolve(request),
                request.getHeader(HttpHeaders.USER_AGENT),
                OffsetDateTime.now(clock),
                true,
                status,
                correlationId(request),
                requestData,
                responseData
        ));
    }

    private Optional<Actor> resolveActor(HttpServletRequest request) {
        if (request.getAttribute(PinStepUpRequestBodyAdvice.VERIFIED_STAFF_ATTRIBUTE) instanceof StaffIdentity staff
                && staff.hasIdentifiableActor()) {
            return Optional.of(new Actor(staff.staffId().toString(), staff.email()));
        }
        return SecurityUtils.findCurrentPrincipal()
                .filter(AuthenticatedPrincipal::hasIdentifiableActor)
                .map(principal -> new Actor(principal.id(), principal.email()));
    }

    private Object toTree(Object body) {
        if (body == null) {
            return null;
        }
        return objectMapper.convertValue(body, Object.class);
    }

    private static Map<String, String> pathVariables(HttpServletRequest request) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE) instanceof Map<?, ?> map) {
            map.forEach((key, value) -> variables.put(String.valueOf(key), String.valueOf(value)));
        }
        return variables;
    }

    private static Map<String, String> queryParameters(HttpServletRequest request) {
        Map<String, String> query = new LinkedHashMap<>();
        request.getParameterMap().forEach((key, values) -> query.put(key, values.length > 0 ? values[0] : null));
        return query;
    }

    private static String resourceId(Audited audited, Map<String, String> pathVariables, Object requestBody,
                                     Object responseBody) {
        String fromPath = pathVariables.get(audited.resourceIdVariable());
        if (fromPath != null) {
            return fromPath;
        }
        Object fromBody = field(requestBody, "id");
        if (fromBody == null) {
            fromBody = field(responseBody, "id");
        }
        if (fromBody == null) {
            fromBody = field(field(responseBody, "data"), "id");
        }
        return fromBody != null ? fromBody.toString() : null;
    }

    private static String branchId(HttpServletRequest request, Map<String, String> pathVariables, Object requestBody) {
        if (request.getAttribute(AccessControlInterceptor.BRANCH_ID_ATTRIBUTE) instanceof String resolved) {
            return resolved;
        }
        if (pathVariables.containsKey("branchId")) {
            return pathVariables.get("branchId");
        }
        Object fromBody = field(requestBody, "branchId");
        if (fromBody == null) {
            fromBody = field(requestBody, "branch_id");
        }
        return fromBody != null ? fromBody.toString() : null;
    }

    private static Object field(Object tree, String name) {
        return tree instanceof Map<?, ?> map ? map.get(name) : null;
    }

    private static String correlationId(HttpServletRequest request) {
        Object requestId = request.getAttribute(RequestIdFilter.REQUEST_ID_HEADER);
        return requestId != null ? requestId.toString() : null;
    }

    private record Actor(String id, String email) {
    }
}
