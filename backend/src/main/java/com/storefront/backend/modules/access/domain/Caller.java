package com.storefront.backend.modules.access.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity context of an incoming request.
 */
public interface Caller {

    static Caller anonymous() {
        return Anonymous.INSTANCE;
    }

    static Caller authenticated(UUID userId, boolean seller) {
        return new AuthenticatedUser(userId, seller);
    }

    boolean isAuthenticated();

    final class Anonymous implements Caller {

        private static final Anonymous INSTANCE = new Anonymous();

        private Anonymous() {
        }

        @Override
        public boolean isAuthenticated() {
            return false;
        }

        @Override
        public String toString() {
            return "Anonymous";
        }
    }

    record AuthenticatedUser(UUID userId, boolean seller) implements Caller {

        public AuthenticatedUser {
            Objects.requireNonNull(userId, "userId must not be null");
        }

        @Override
        public boolean isAuthenticated() {
            return true;
        }

        public boolean owns(OwnedResource resource) {
            return resource != null && userId.equals(resource.ownerId());
        }
    }
}
