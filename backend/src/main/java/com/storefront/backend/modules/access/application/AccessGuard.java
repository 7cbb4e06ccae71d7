package com.storefront.backend.modules.access.application;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.global.security.SecurityUtils;
import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.AccessDecision;
import com.storefront.backend.modules.access.domain.Caller;
import com.storefront.backend.modules.access.domain.DenyReason;
import com.storefront.backend.modules.access.domain.OwnedResource;
import com.storefront.backend.modules.access.domain.ResourceType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Applies {@link AccessPolicyEngine} to the current request and turns a denial into a problem response.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final AccessPolicyEngine accessPolicyEngine;

    public AccessGuard(AccessPolicyEngine accessPolicyEngine) {
        this.accessPolicyEngine = accessPolicyEngine;
    }

    /**
     * Checks authentication and role only; ownership is checked once the resource is loaded.
     */
    public Caller requireTier(AccessAction action, ResourceType resourceType) {
        Caller caller = SecurityUtils.currentCaller();
        AccessDecision decision = accessPolicyEngine.evaluateTier(caller, action, resourceType);
        if (decision.denied()) {
            log.debug("Denied {} {} for {}: {}", action, resourceType, caller, decision.reason());
            throw toProblem(decision.reason());
        }
        return caller;
    }

    public Caller require(AccessAction action, ResourceType resourceType) {
        return require(action, resourceType, null);
    }

    /**
     * Evaluates the policy for the current caller.
     *
     * @return the caller the decision was made for
     * @throws ProblemException when the policy denies the action
     */
    public Caller require(AccessAction action, ResourceType resourceType, OwnedResource resource) {
        Caller caller = SecurityUtils.currentCaller();
        AccessDecision decision = accessPolicyEngine.evaluate(caller, action, resourceType, resource);
        if (decision.denied()) {
            log.debug("Denied {} {} for {}: {}", action, resourceType, caller, decision.reason());
            throw toProblem(decision.reason());
        }
        return caller;
    }

    static ProblemException toProblem(DenyReason reason) {
        return switch (reason) {
            case NOT_AUTHENTICATED -> new ProblemException(HttpStatus.UNAUTHORIZED, "NOT_AUTHENTICATED");
            case NOT_SELLER -> new ProblemException(HttpStatus.FORBIDDEN, "NOT_SELLER");
            case NOT_OWNER -> new ProblemException(HttpStatus.FORBIDDEN, "NOT_OWNER");
            case UNSUPPORTED -> new ProblemException(HttpStatus.METHOD_NOT_ALLOWED, "UNSUPPORTED_OPERATION");
        };
    }
}
