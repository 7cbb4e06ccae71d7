package com.storefront.backend.modules.access.domain;

import java.util.Objects;

/**
 * Outcome of a policy evaluation. A denial always carries a reason.
 */
public record AccessDecision(boolean allowed, DenyReason reason) {

    private static final AccessDecision ALLOW = new AccessDecision(true, null);

    public AccessDecision {
        if (allowed && reason != null) {
            throw new IllegalArgumentException("an allow decision has no reason");
        }
        if (!allowed) {
            Objects.requireNonNull(reason, "a deny decision needs a reason");
        }
    }

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(DenyReason reason) {
        return new AccessDecision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
