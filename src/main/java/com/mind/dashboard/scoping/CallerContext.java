package com.mind.dashboard.scoping;

import com.mind.dashboard.domain.Role;

public record CallerContext(String identity, Role role) {
    public static CallerContext of(String identity, Role role) {
        return new CallerContext(identity, role);
    }
}
