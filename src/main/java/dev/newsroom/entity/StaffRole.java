package dev.newsroom.entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Staff roles ordered by seniority. Entity fields keep the role as a String;
 * use these constants for comparisons.
 */
public enum StaffRole {
    INTERN,
    JOURNALIST,
    SUB_EDITOR,
    EDITOR,
    ADMIN,
    SUPERADMIN;

    public static final Set<StaffRole> APPROVERS =
            Collections.unmodifiableSet(EnumSet.of(SUB_EDITOR, EDITOR, ADMIN, SUPERADMIN));

    public boolean matches(String role) {
        return this.name().equals(role);
    }

    public boolean isAtLeast(StaffRole other) {
        return this.ordinal() >= other.ordinal();
    }

    /**
     * Parses a stored role string, returning {@code null} for unknown values.
     */
    public static StaffRole from(String role) {
        if (role == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(r -> r.matches(role))
                .findFirst()
                .orElse(null);
    }

    public static List<String> names(Set<StaffRole> roles) {
        return roles.stream().map(Enum::name).sorted().toList();
    }
}
