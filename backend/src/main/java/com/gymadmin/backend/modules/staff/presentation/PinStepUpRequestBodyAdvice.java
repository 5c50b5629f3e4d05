package com.gymadmin.backend.modules.staff.presentation;

import java.lang.reflect.Type;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.access.presentation.annotation.RequirePinStepUp;
import com.gymadmin.backend.modules.staff.application.PinStepUpAuthenticator;
import com.gymadmin.backend.modules.staff.domain.StaffIdentity;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.core.MethodParameter;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.mvc.method.annotation.RequestBodyAdviceAdapter;

/**
 * Re-verifies the staff PIN in the body of {@link RequirePinStepUp} routes before the handler runs and leaves the
 * verified staff on the request for the audit recorder.
 */
@ControllerAdvice
@Order(10)
public class PinStepUpRequestBodyAdvice extends RequestBodyAdviceAdapter {

    public static final String VERIFIED_STAFF_ATTRIBUTE = PinStepUpRequestBodyAdvice.class.getName() + ".staff";

    private final PinStepUpAuthenticator pinStepUpAuthenticator;

    public PinStepUpRequestBodyAdvice(PinStepUpAuthenticator pinStepUpAuthenticator) {
        this.pinStepUpAuthenticator = pinStepUpAuthenticator;
    }

    @Override
    public boolean supports(MethodParameter methodParameter, Type targetType,
                            Class<? extends HttpMessageConverter<?>> converterType) {
        return methodParameter.hasMethodAnnotation(RequirePinStepUp.class)
                && PinConfirmedRequest.class.isAssignableFrom(methodParameter.getParameterType());
    }

    @Override
    public Object handleEmptyBody(Object body, HttpInputMessage inputMessage, MethodParameter parameter,
                                  Type targetType, Class<? extends HttpMessageConverter<?>> converterType) {
        throw new ProblemException(ErrorCode.INVALID_PIN, "Staff PIN confirmation is required");
    }

    @Override
    public Object afterBodyRead(Object body, HttpInputMessage inputMessage, MethodParameter parameter, Type targetType,
                                Class<? extends HttpMessageConverter<?>> converterType) {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes)) {
            return body;
        }
        HttpServletRequest request = attributes.getRequest();
        PinConfirmedRequest confirmation = (PinConfirmedRequest) body;
        if (confirmation.staffId() == null) {
            throw new ProblemException(ErrorCode.INVALID_PIN, "Staff PIN confirmation is required");
        }
        StaffIdentity staff = pinStepUpAuthenticator.verifyOrThrow(
                confirmation.staffId(), confirmation.staffPin(), ClientContexts.from(request));
        request.setAttribute(VERIFIED_STAFF_ATTRIBUTE, staff);
        return body;
    }
}
