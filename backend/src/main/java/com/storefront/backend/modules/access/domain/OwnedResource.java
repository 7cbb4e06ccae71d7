package com.storefront.backend.modules.access.domain;

import java.util.UUID;

/**
 * A concrete resource instance whose ownership can be checked against the caller.
 * Returns {@code null} while the owner is not assigned yet.
 */
public interface OwnedResource {

    UUID ownerId();
}
