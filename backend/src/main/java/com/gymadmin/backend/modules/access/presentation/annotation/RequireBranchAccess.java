package com.gymadmin.backend.modules.access.presentation.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.gymadmin.backend.modules.access.domain.Permission;

/**
 * Marks a branch-parameterized route. The branch id is read from the {@code branchId} path variable, then the
 * {@code branchId} query parameter, then a {@link com.gymadmin.backend.modules.access.presentation.BranchScopedRequest}
 * body. Branch isolation is checked before {@link #value()} and before any other permission annotation.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireBranchAccess {

    /**
     * Permissions required on top of branch access, all of them.
     */
    Permission[] value() default {};
}
