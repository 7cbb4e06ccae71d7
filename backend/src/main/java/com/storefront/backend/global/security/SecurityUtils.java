package com.storefront.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.modules.access.domain.Caller;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "NOT_AUTHENTICATED"));
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * Resolves the request's caller for policy evaluation; no authentication means anonymous.
     */
    public static Caller currentCaller() {
        return findCurrentPrincipal()
                .map(principal -> Caller.authenticated(principal.userId(), principal.isSeller()))
                .orElseGet(Caller::anonymous);
    }
}
