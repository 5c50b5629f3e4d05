package com.gymadmin.backend.modules.audit.presentation.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Records an audit entry after the handler has responded with a non-error status.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Audited {

    /**
     * Action taxonomy string, e.g. {@code CREATE_MEMBER}.
     */
    String action();

    String resourceType();

    /**
     * Path variable holding the resource id. Falls back to an {@code id} field in the request body, then the response body or its {@code data} envelope.
     */
    String resourceIdVariable() default "id";
}
