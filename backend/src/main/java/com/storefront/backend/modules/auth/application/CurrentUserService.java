package com.storefront.backend.modules.auth.application;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.global.security.SecurityUtils;
import com.storefront.backend.modules.auth.domain.StoreUser;
import com.storefront.backend.modules.auth.infrastructure.persistence.StoreUserRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Loads the account behind the current access token.
 *
 * <p>A token stays valid until it expires, so every authenticated write or profile read
 * goes through here to catch accounts deactivated in the meantime. Runs in the caller's
 * transaction.
 */
@Service
public class CurrentUserService {

    private final StoreUserRepository storeUserRepository;

    public CurrentUserService(StoreUserRepository storeUserRepository) {
        this.storeUserRepository = storeUserRepository;
    }

    public StoreUser loadActiveUser() {
        return storeUserRepository.findById(SecurityUtils.getCurrentUserId())
                .filter(StoreUser::isActive)
                .orElseThrow(() -> new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE"));
    }
}
