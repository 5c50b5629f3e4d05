package com.gymadmin.backend.modules.access.application;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.gymadmin.backend.modules.access.domain.Permission;

import org.springframework.stereotype.Component;

/**
 * Static role to permission table. Built once; every returned set is unmodifiable.
 * Unknown roles get no permissions.
 */
@Component
public class PermissionRegistry {

    public static final String SUPER_ADMIN = "super_admin";
    public static final String ADMIN = "admin";
    public static final String MANAGER = "manager";
    public static final String SENIOR_STAFF = "senior_staff";
    public static final String ASSOCIATE = "associate";
    public static final String MEMBER = "member";

    private final Map<String, Set<Permission>> rolePermissions;

    public PermissionRegistry() {
        Set<Permission> all = frozen(EnumSet.allOf(Permission.class));
        this.rolePermissions = Map.of(
                SUPER_ADMIN, all,
                ADMIN, all,
                MANAGER, frozen(EnumSet.of(
                        Permission.MEMBERS_READ,
                        Permission.MEMBERS_WRITE,
                        Permission.MEMBERS_DELETE,
                        Permission.MEMBERS_SEARCH,
                        Permission.STAFF_READ,
                        Permission.STAFF_WRITE,
                        Permission.STAFF_DELETE,
                        Permission.STAFF_MANAGE_PINS,
                        Permission.PACKAGES_READ,
                        Permission.PACKAGES_WRITE,
                        Permission.PACKAGES_DELETE,
                        Permission.PACKAGES_PRICING,
                        Permission.BRANCHES_READ,
                        Permission.ANALYTICS_READ,
                        Permission.ANALYTICS_FINANCIAL,
                        Permission.RENEWALS_PROCESS,
                        Permission.RENEWALS_READ,
                        Permission.PAYMENTS_READ,
                        Permission.PAYMENTS_PROCESS
                )),
                SENIOR_STAFF, frozen(EnumSet.of(
                        Permission.MEMBERS_READ,
                        Permission.MEMBERS_WRITE,
                        Permission.MEMBERS_SEARCH,
                        Permission.STAFF_READ,
                        Permission.PACKAGES_READ,
                        Permission.PACKAGES_WRITE,
                        Permission.PACKAGES_DELETE,
                        Permission.PACKAGES_PRICING,
                        Permission.BRANCHES_READ,
                        Permission.ANALYTICS_READ,
                        Permission.RENEWALS_PROCESS,
                        Permission.RENEWALS_READ,
                        Permission.PAYMENTS_READ
                )),
                ASSOCIATE, frozen(EnumSet.of(
                        Permission.MEMBERS_READ,
                        Permission.MEMBERS_SEARCH,
                        Permission.STAFF_READ,
                        Permission.PACKAGES_READ,
                        Permission.PACKAGES_WRITE,
                        Permission.PACKAGES_DELETE,
                        Permission.PACKAGES_PRICING,
                        Permission.BRANCHES_READ,
                        Permission.RENEWALS_READ
                )),
                MEMBER, frozen(EnumSet.of(
                        Permission.BRANCHES_READ,
                        Permission.PACKAGES_READ
                ))
        );
    }

    public Set<Permission> permissionsFor(String role) {
        if (role == null) {
            return Set.of();
        }
        return rolePermissions.getOrDefault(role.toLowerCase(Locale.ROOT), Set.of());
    }

    public boolean isKnownRole(String role) {
        return role != null && rolePermissions.containsKey(role.toLowerCase(Locale.ROOT));
    }

    /**
     * {@code system:admin} satisfies every check.
     */
    public boolean has(Set<Permission> granted, Permission required) {
        return granted.contains(required) || granted.contains(Permission.SYSTEM_ADMIN);
    }

    public boolean hasAny(Set<Permission> granted, Collection<Permission> required) {
        return required.stream().anyMatch(permission -> has(granted, permission));
    }

    private static Set<Permission> frozen(EnumSet<Permission> permissions) {
        return Collections.unmodifiableSet(permissions);
    }
}
