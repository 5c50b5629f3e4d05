package com.gymadmin.backend.modules.access.presentation;

import java.lang.annotation.Annotation;
import java.util.List;

import com.gymadmin.backend.modules.access.domain.Permission;
import com.gymadmin.backend.modules.access.presentation.annotation.RequireAnyPermission;
import com.gymadmin.backend.modules.access.presentation.annotation.RequireBranchAccess;
import com.gymadmin.backend.modules.access.presentation.annotation.RequirePermission;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;

/**
 * Access annotations collected from a handler method, falling back to its controller class.
 */
public record AccessRequirements(
        boolean branchScoped,
        List<Permission> branchPermissions,
        Permission requiredPermission,
        List<Permission> anyOfPermissions
) {

    public static AccessRequirements of(HandlerMethod handlerMethod) {
        RequireBranchAccess branchAccess = find(handlerMethod, RequireBranchAccess.class);
        RequirePermission permission = find(handlerMethod, RequirePermission.class);
        RequireAnyPermission anyPermission = find(handlerMethod, RequireAnyPermission.class);
        return new AccessRequirements(
                branchAccess != null,
                branchAccess != null ? List.of(branchAccess.value()) : List.of(),
                permission != null ? permission.value() : null,
                anyPermission != null ? List.of(anyPermission.value()) : List.of()
        );
    }

    public boolean isEmpty() {
        return !branchScoped && requiredPermission == null && anyOfPermissions.isEmpty();
    }

    private static <A extends Annotation> A find(HandlerMethod handlerMethod, Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), type);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), type);
    }
}
