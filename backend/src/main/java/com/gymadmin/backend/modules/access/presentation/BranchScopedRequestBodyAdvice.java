package com.gymadmin.backend.modules.access.presentation;

import java.lang.reflect.Type;

import com.gymadmin.backend.global.security.SecurityUtils;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.core.MethodParameter;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.mvc.method.annotation.RequestBodyAdviceAdapter;

/**
 * Finishes access checks that {@link AccessControlInterceptor} deferred because the branch id is in the body.
 * Runs before PIN step-up so a branch mismatch never consumes a PIN attempt.
 */
@ControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BranchScopedRequestBodyAdvice extends RequestBodyAdviceAdapter {

    private final AccessControlInterceptor accessControlInterceptor;

    public BranchScopedRequestBodyAdvice(AccessControlInterceptor accessControlInterceptor) {
        this.accessControlInterceptor = accessControlInterceptor;
    }

    @Override
    public boolean supports(MethodParameter methodParameter, Type targetType,
                            Class<? extends HttpMessageConverter<?>> converterType) {
        return BranchScopedRequest.class.isAssignableFrom(methodParameter.getParameterType());
    }

    @Override
    public Object afterBodyRead(Object body, HttpInputMessage inputMessage, MethodParameter parameter, Type targetType,
                                Class<? extends HttpMessageConverter<?>> converterType) {
        HttpServletRequest request = currentRequest();
        if (request == null) {
            return body;
        }
        Object pending = request.getAttribute(AccessControlInterceptor.PENDING_REQUIREMENTS_ATTRIBUTE);
        if (pending instanceof AccessRequirements requirements) {
            request.removeAttribute(AccessControlInterceptor.PENDING_REQUIREMENTS_ATTRIBUTE);
            String branchId = ((BranchScopedRequest) body).branchId();
            accessControlInterceptor.enforce(request, SecurityUtils.getCurrentPrincipal(), requirements, branchId);
        }
        return body;
    }

    static HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return attributes.getRequest();
        }
        return null;
    }
}
