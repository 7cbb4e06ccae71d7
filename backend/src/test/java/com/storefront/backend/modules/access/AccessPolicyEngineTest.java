package com.storefront.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import com.storefront.backend.modules.access.application.AccessPolicyEngine;
import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.AccessDecision;
import com.storefront.backend.modules.access.domain.AccessRequirement;
import com.storefront.backend.modules.access.domain.Caller;
import com.storefront.backend.modules.access.domain.DenyReason;
import com.storefront.backend.modules.access.domain.OwnedResource;
import com.storefront.backend.modules.access.domain.ResourceType;
import com.storefront.backend.modules.auth.domain.StoreUser;
import com.storefront.backend.modules.auth.domain.UserRole;
import com.storefront.backend.modules.catalog.domain.Product;
import com.storefront.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class AccessPolicyEngineTest {

    private static final UUID BUYER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");
    private static final UUID SELLER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000e1");
    private static final UUID OTHER_SELLER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000e2");

    private final AccessPolicyEngine engine = new AccessPolicyEngine();

    private final Caller anonymous = Caller.anonymous();
    private final Caller buyer = Caller.authenticated(BUYER_ID, false);
    private final Caller seller = Caller.authenticated(SELLER_ID, true);

    @ParameterizedTest(name = "{0} {1}: anonymous={2}, user={3}, seller={4}")
    @CsvSource({
            "SESSION,           CREATE, ALLOW,             ALLOW,         ALLOW",
            "SESSION,           UPDATE, NOT_AUTHENTICATED, ALLOW,         ALLOW",
            "SESSION,           DELETE, NOT_AUTHENTICATED, ALLOW,         ALLOW",
            "SESSION,           READ,   UNSUPPORTED,       UNSUPPORTED,   UNSUPPORTED",
            "USER,              CREATE, ALLOW,             ALLOW,         ALLOW",
            "USER,              READ,   NOT_AUTHENTICATED, ALLOW,         ALLOW",
            "USER,              UPDATE, UNSUPPORTED,       UNSUPPORTED,   UNSUPPORTED",
            "USER,              DELETE, UNSUPPORTED,       UNSUPPORTED,   UNSUPPORTED",
            "CATEGORY,          READ,   ALLOW,             ALLOW,         ALLOW",
            "CATEGORY,          CREATE, UNSUPPORTED,       UNSUPPORTED,   UNSUPPORTED",
            "CATEGORY_PRODUCTS, READ,   ALLOW,             ALLOW,         ALLOW",
            "PRODUCT_REVIEWS,   READ,   ALLOW,             ALLOW,         ALLOW",
            "PRODUCT_REVIEWS,   CREATE, UNSUPPORTED,       UNSUPPORTED,   UNSUPPORTED",
            "PRODUCT,           READ,   ALLOW,             ALLOW,         ALLOW",
            "PRODUCT,           CREATE, NOT_AUTHENTICATED, NOT_SELLER,    ALLOW",
            "PRODUCT,           UPDATE, NOT_AUTHENTICATED, NOT_SELLER,    NOT_OWNER",
            "PRODUCT,           DELETE, UNSUPPORTED,       UNSUPPORTED,   UNSUPPORTED"
    })
    void policyTableWithoutResource(
            ResourceType type,
            AccessAction action,
            String anonymousOutcome,
            String buyerOutcome,
            String sellerOutcome
    ) {
        assertThat(engine.evaluate(anonymous, action, type)).isEqualTo(expected(anonymousOutcome));
        assertThat(engine.evaluate(buyer, action, type)).isEqualTo(expected(buyerOutcome));
        assertThat(engine.evaluate(seller, action, type)).isEqualTo(expected(sellerOutcome));
    }

    @Test
    @DisplayName("anonymous caller may read products but not create them")
    void anonymousReadsButCannotCreate() {
        assertThat(engine.evaluate(anonymous, AccessAction.READ, ResourceType.PRODUCT).allowed()).isTrue();
        assertThat(engine.evaluate(anonymous, AccessAction.CREATE, ResourceType.PRODUCT))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_AUTHENTICATED));
    }

    @Test
    @DisplayName("buyer is refused seller operations")
    void buyerCannotCreateProduct() {
        assertThat(engine.evaluate(buyer, AccessAction.CREATE, ResourceType.PRODUCT))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_SELLER));
    }

    @Test
    void owningSellerMayUpdateOwnProductOnly() {
        OwnedResource ownProduct = () -> SELLER_ID;
        OwnedResource foreignProduct = () -> OTHER_SELLER_ID;

        assertThat(engine.evaluate(seller, AccessAction.UPDATE, ResourceType.PRODUCT, ownProduct).allowed()).isTrue();
        assertThat(engine.evaluate(seller, AccessAction.UPDATE, ResourceType.PRODUCT, foreignProduct))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_OWNER));
    }

    @Test
    @DisplayName("a product without a seller yet is owned by nobody")
    void productWithoutOwnerDeniesEverySeller() {
        OwnedResource unownedProduct = () -> null;

        assertThat(engine.evaluate(seller, AccessAction.UPDATE, ResourceType.PRODUCT, unownedProduct))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_OWNER));
        assertThat(engine.evaluate(seller, AccessAction.UPDATE, ResourceType.PRODUCT, new Product()))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_OWNER));
    }

    @Test
    void buyerIsRefusedForRoleBeforeOwnershipIsConsidered() {
        OwnedResource productOwnedByBuyerId = () -> BUYER_ID;

        assertThat(engine.evaluate(buyer, AccessAction.UPDATE, ResourceType.PRODUCT, productOwnedByBuyerId))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_SELLER));
    }

    @Test
    void selfRulesRejectAnotherUsersResource() {
        OwnedResource othersSession = () -> OTHER_SELLER_ID;
        OwnedResource ownSession = () -> BUYER_ID;

        assertThat(engine.evaluate(buyer, AccessAction.UPDATE, ResourceType.SESSION, othersSession))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_OWNER));
        assertThat(engine.evaluate(buyer, AccessAction.DELETE, ResourceType.SESSION, ownSession).allowed()).isTrue();
        assertThat(engine.evaluate(buyer, AccessAction.READ, ResourceType.USER, othersSession))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_OWNER));
    }

    @Test
    void unsupportedWinsOverMissingAuthentication() {
        assertThat(engine.evaluate(anonymous, AccessAction.DELETE, ResourceType.PRODUCT))
                .isEqualTo(AccessDecision.deny(DenyReason.UNSUPPORTED));
    }

    @Test
    void tierEvaluationIgnoresOwnership() {
        assertThat(engine.evaluateTier(seller, AccessAction.UPDATE, ResourceType.PRODUCT).allowed()).isTrue();
        assertThat(engine.evaluateTier(buyer, AccessAction.UPDATE, ResourceType.PRODUCT))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_SELLER));
        assertThat(engine.evaluateTier(anonymous, AccessAction.UPDATE, ResourceType.PRODUCT))
                .isEqualTo(AccessDecision.deny(DenyReason.NOT_AUTHENTICATED));
    }

    @ParameterizedTest
    @EnumSource(ResourceType.class)
    void evaluationIsDeterministic(ResourceType type) {
        for (AccessAction action : AccessAction.values()) {
            AccessDecision first = engine.evaluate(seller, action, type);
            assertThat(engine.evaluate(seller, action, type)).isEqualTo(first);
            assertThat(new AccessPolicyEngine().evaluate(seller, action, type)).isEqualTo(first);
        }
    }

    @Test
    void evaluationLeavesCallerAndResourceUntouched() {
        StoreUser owner = TestEntities.user(SELLER_ID, UserRole.SELLER);
        Product product = TestEntities.product(
                UUID.fromString("00000000-0000-0000-0000-000000000009"),
                owner,
                TestEntities.category(UUID.fromString("00000000-0000-0000-0000-00000000c001"), true)
        );
        Caller intruder = Caller.authenticated(OTHER_SELLER_ID, true);

        engine.evaluate(intruder, AccessAction.UPDATE, ResourceType.PRODUCT, product);
        engine.evaluate(seller, AccessAction.UPDATE, ResourceType.PRODUCT, product);

        assertThat(product.ownerId()).isEqualTo(SELLER_ID);
        assertThat(product.getName()).isEqualTo("Desk lamp");
        assertThat(product.getStock()).isEqualTo(5);
        assertThat(intruder).isEqualTo(Caller.authenticated(OTHER_SELLER_ID, true));
    }

    @Test
    void requirementLookupExposesConfiguredRules() {
        assertThat(engine.requirementFor(ResourceType.PRODUCT, AccessAction.UPDATE))
                .contains(AccessRequirement.OWNING_SELLER);
        assertThat(engine.requirementFor(ResourceType.CATEGORY, AccessAction.DELETE)).isEmpty();
    }

    @Test
    void decisionCarriesReasonOnlyWhenDenied() {
        assertThat(AccessDecision.allow().reason()).isNull();
        assertThatThrownBy(() -> new AccessDecision(true, DenyReason.NOT_OWNER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AccessDecision(false, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void nullCallerIsRejected() {
        assertThatThrownBy(() -> engine.evaluate(null, AccessAction.READ, ResourceType.PRODUCT))
                .isInstanceOf(NullPointerException.class);
    }

    private static AccessDecision expected(String outcome) {
        return "ALLOW".equals(outcome)
                ? AccessDecision.allow()
                : AccessDecision.deny(DenyReason.valueOf(outcome));
    }
}
