package com.storefront.backend.modules.access.application;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.AccessDecision;
import com.storefront.backend.modules.access.domain.AccessRequirement;
import com.storefront.backend.modules.access.domain.Caller;
import com.storefront.backend.modules.access.domain.Caller.AuthenticatedUser;
import com.storefront.backend.modules.access.domain.DenyReason;
import com.storefront.backend.modules.access.domain.OwnedResource;
import com.storefront.backend.modules.access.domain.ResourceType;

import org.springframework.stereotype.Component;

/**
 * Central authorization decision for every exposed endpoint.
 *
 * <p>Evaluation order is fixed: unsupported combinations first, then the
 * authentication requirement, then the seller role, then ownership. Ownership
 * is checked only when the rule asks for it, so a buyer never reaches the
 * ownership check of a seller-only rule.
 *
 * <p>The engine holds an immutable rule table and no other state; it is safe to
 * share across request threads.
 */
@Component
public class AccessPolicyEngine {

    private final Map<ResourceType, Map<AccessAction, AccessRequirement>> rules;

    public AccessPolicyEngine() {
        this.rules = defaultRules();
    }

    public AccessDecision evaluate(Caller caller, AccessAction action, ResourceType resourceType) {
        return evaluate(caller, action, resourceType, null);
    }

    public AccessDecision evaluate(
            Caller caller,
            AccessAction action,
            ResourceType resourceType,
            OwnedResource resource
    ) {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(resourceType, "resourceType must not be null");

        AccessDecision tier = evaluateTier(caller, action, resourceType);
        if (tier.denied()) {
            return tier;
        }

        AccessRequirement rule = requirementFor(resourceType, action).orElseThrow();
        if (!rule.authenticationRequired()) {
            return tier;
        }
        AuthenticatedUser user = (AuthenticatedUser) caller;
        if (rule.ownershipRequired()) {
            return user.owns(resource) ? AccessDecision.allow() : AccessDecision.deny(DenyReason.NOT_OWNER);
        }
        if (resource != null && !user.owns(resource)) {
            // SELF rules restrict to the caller's own resource only when one is supplied
            return AccessDecision.deny(DenyReason.NOT_OWNER);
        }
        return AccessDecision.allow();
    }

    /**
     * Checks everything except ownership. Lets a caller be rejected for its tier before the
     * resource is looked up, so unauthorized callers cannot probe which resources exist.
     */
    public AccessDecision evaluateTier(Caller caller, AccessAction action, ResourceType resourceType) {
        Objects.requireNonNull(caller, "caller must not be null");
        Optional<AccessRequirement> requirement = requirementFor(resourceType, action);
        if (requirement.isEmpty()) {
            return AccessDecision.deny(DenyReason.UNSUPPORTED);
        }
        AccessRequirement rule = requirement.get();
        if (!rule.authenticationRequired()) {
            return AccessDecision.allow();
        }
        if (!(caller instanceof AuthenticatedUser user)) {
            return AccessDecision.deny(DenyReason.NOT_AUTHENTICATED);
        }
        if (rule.sellerRequired() && !user.seller()) {
            return AccessDecision.deny(DenyReason.NOT_SELLER);
        }
        return AccessDecision.allow();
    }

    public Optional<AccessRequirement> requirementFor(ResourceType resourceType, AccessAction action) {
        return Optional.ofNullable(rules.getOrDefault(resourceType, Map.of()).get(action));
    }

    private static Map<ResourceType, Map<AccessAction, AccessRequirement>> defaultRules() {
        Map<ResourceType, Map<AccessAction, AccessRequirement>> table = new EnumMap<>(ResourceType.class);

        rule(table, ResourceType.SESSION, AccessAction.CREATE, AccessRequirement.PUBLIC);
        rule(table, ResourceType.SESSION, AccessAction.UPDATE, AccessRequirement.SELF);
        rule(table, ResourceType.SESSION, AccessAction.DELETE, AccessRequirement.SELF);

        rule(table, ResourceType.USER, AccessAction.CREATE, AccessRequirement.PUBLIC);
        rule(table, ResourceType.USER, AccessAction.READ, AccessRequirement.SELF);

        rule(table, ResourceType.CATEGORY, AccessAction.READ, AccessRequirement.PUBLIC);
        rule(table, ResourceType.CATEGORY_PRODUCTS, AccessAction.READ, AccessRequirement.PUBLIC);
        rule(table, ResourceType.PRODUCT_REVIEWS, AccessAction.READ, AccessRequirement.PUBLIC);

        rule(table, ResourceType.PRODUCT, AccessAction.READ, AccessRequirement.PUBLIC);
        rule(table, ResourceType.PRODUCT, AccessAction.CREATE, AccessRequirement.SELLER);
        rule(table, ResourceType.PRODUCT, AccessAction.UPDATE, AccessRequirement.OWNING_SELLER);

        table.replaceAll((type, actions) -> Collections.unmodifiableMap(actions));
        return Collections.unmodifiableMap(table);
    }

    private static void rule(
            Map<ResourceType, Map<AccessAction, AccessRequirement>> table,
            ResourceType resourceType,
            AccessAction action,
            AccessRequirement requirement
    ) {
        table.computeIfAbsent(resourceType, type -> new EnumMap<>(AccessAction.class)).put(action, requirement);
    }
}
