package com.gymadmin.backend.modules.access.presentation.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.gymadmin.backend.modules.access.domain.Permission;

/**
 * Requires one permission. Rejected with 403 {@code PERMISSION_DENIED} when absent.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequirePermission {

    Permission value();
}
