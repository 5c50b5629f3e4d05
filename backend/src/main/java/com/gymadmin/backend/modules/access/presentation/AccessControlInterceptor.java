package com.gymadmin.backend.modules.access.presentation;

import java.util.Map;

import com.gymadmin.backend.global.security.SecurityUtils;
import com.gymadmin.backend.modules.access.application.AccessPolicyEnforcer;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Enforces {@code @RequireBranchAccess}, {@code @RequirePermission} and {@code @RequireAnyPermission} before the
 * handler runs. When the branch id only travels in a {@link BranchScopedRequest} body, the whole check is handed
 * to {@link BranchScopedRequestBodyAdvice} so the evaluation order stays the same.
 */
@Component
public class AccessControlInterceptor implements HandlerInterceptor {

    public static final String BRANCH_ID_ATTRIBUTE = AccessControlInterceptor.class.getName() + ".branchId";
    static final String PENDING_REQUIREMENTS_ATTRIBUTE = AccessControlInterceptor.class.getName() + ".pending";
    static final String BRANCH_ID_PARAMETER = "branchId";

    private final AccessPolicyEnforcer accessPolicyEnforcer;

    public AccessControlInterceptor(AccessPolicyEnforcer accessPolicyEnforcer) {
        this.accessPolicyEnforcer = accessPolicyEnforcer;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        AccessRequirements requirements = AccessRequirements.of(handlerMethod);
        if (requirements.isEmpty()) {
            return true;
        }

        AuthenticatedPrincipal principal = SecurityUtils.getCurrentPrincipal();
        if (requirements.branchScoped()) {
            String branchId = resolveBranchId(request);
            if (branchId == null && acceptsBranchScopedBody(handlerMethod)) {
                request.setAttribute(PENDING_REQUIREMENTS_ATTRIBUTE, requirements);
                return true;
            }
            enforce(request, principal, requirements, branchId);
            return true;
        }
        enforce(request, principal, requirements, null);
        return true;
    }

    void enforce(HttpServletRequest request, AuthenticatedPrincipal principal, AccessRequirements requirements,
                 String branchId) {
        if (requirements.branchScoped()) {
            accessPolicyEnforcer.requireBranchAccess(principal, branchId, requirements.branchPermissions());
            request.setAttribute(BRANCH_ID_ATTRIBUTE, branchId);
        }
        if (requirements.requiredPermission() != null) {
            accessPolicyEnforcer.requirePermission(principal, requirements.requiredPermission());
        }
        if (!requirements.anyOfPermissions().isEmpty()) {
            accessPolicyEnforcer.requireAnyPermission(principal, requirements.anyOfPermissions());
        }
    }

    private String resolveBranchId(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            Object fromPath = map.get(BRANCH_ID_PARAMETER);
            if (fromPath instanceof String value && StringUtils.hasText(value)) {
                return value;
            }
        }
        String fromQuery = request.getParameter(BRANCH_ID_PARAMETER);
        return StringUtils.hasText(fromQuery) ? fromQuery : null;
    }

    private boolean acceptsBranchScopedBody(HandlerMethod handlerMethod) {
        for (MethodParameter parameter : handlerMethod.getMethodParameters()) {
            if (parameter.hasParameterAnnotation(RequestBody.class)
                    && BranchScopedRequest.class.isAssignableFrom(parameter.getParameterType())) {
                return true;
            }
        }
        return false;
    }
}
