package com.gymadmin.backend.modules.staff.presentation;

import com.gymadmin.backend.modules.access.presentation.annotation.RequirePinStepUp;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Refuses {@link RequirePinStepUp} handlers without a required {@link PinConfirmedRequest} body. The PIN itself is
 * checked by {@link PinStepUpRequestBodyAdvice}, which only sees such bodies.
 */
@Component
public class PinStepUpInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(PinStepUpInterceptor.class);

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)
                || !handlerMethod.hasMethodAnnotation(RequirePinStepUp.class)) {
            return true;
        }
        if (!acceptsPinConfirmation(handlerMethod)) {
            log.error("Handler {} requires PIN step-up but has no required PinConfirmedRequest body; request refused",
                    handlerMethod.getShortLogMessage());
            throw new IllegalStateException(
                    "PIN step-up route without a PinConfirmedRequest body: " + handlerMethod.getShortLogMessage());
        }
        return true;
    }

    static boolean acceptsPinConfirmation(HandlerMethod handlerMethod) {
        for (MethodParameter parameter : handlerMethod.getMethodParameters()) {
            RequestBody requestBody = parameter.getParameterAnnotation(RequestBody.class);
            if (requestBody != null && requestBody.required()
                    && PinConfirmedRequest.class.isAssignableFrom(parameter.getParameterType())) {
                return true;
            }
        }
        return false;
    }
}
