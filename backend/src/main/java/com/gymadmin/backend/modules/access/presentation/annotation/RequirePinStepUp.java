package com.gymadmin.backend.modules.access.presentation.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The request body must implement {@link com.gymadmin.backend.modules.staff.presentation.PinConfirmedRequest}; its
 * staff PIN is re-verified before the handler runs. Handlers without such a body are refused.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequirePinStepUp {
}
