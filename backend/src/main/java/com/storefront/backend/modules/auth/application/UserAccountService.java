package com.storefront.backend.modules.auth.application;

import java.util.Locale;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.modules.access.application.AccessGuard;
import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.ResourceType;
import com.storefront.backend.modules.auth.domain.StoreUser;
import com.storefront.backend.modules.auth.domain.UserRole;
import com.storefront.backend.modules.auth.infrastructure.persistence.StoreUserRepository;
import com.storefront.backend.modules.auth.presentation.dto.CreateUserRequest;
import com.storefront.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final StoreUserRepository storeUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final CurrentUserService currentUserService;
    private final AccessGuard accessGuard;

    public UserAccountService(
            StoreUserRepository storeUserRepository,
            PasswordEncoder passwordEncoder,
            CurrentUserService currentUserService,
            AccessGuard accessGuard
    ) {
        this.storeUserRepository = storeUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.currentUserService = currentUserService;
        this.accessGuard = accessGuard;
    }

    public UserProfileResponse createUser(CreateUserRequest request) {
        accessGuard.require(AccessAction.CREATE, ResourceType.USER);

        String username = request.username().trim();
        String email = request.email().trim().toLowerCase(Locale.ROOT);

        if (storeUserRepository.existsByUsernameIgnoreCase(username)) {
            throw usernameTaken();
        }
        if (storeUserRepository.existsByEmailIgnoreCase(email)) {
            throw emailTaken();
        }

        StoreUser user = new StoreUser();
        user.setUsername(username);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(request.role() != null ? request.role() : UserRole.BUYER);
        user.setActive(true);

        StoreUser saved = saveNewUser(user);
        log.info("Registered user {} with role {}", saved.getId(), saved.getRole());
        return UserProfileResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadCurrentUser() {
        accessGuard.requireTier(AccessAction.READ, ResourceType.USER);

        StoreUser user = currentUserService.loadActiveUser();
        accessGuard.require(AccessAction.READ, ResourceType.USER, user);
        return UserProfileResponse.from(user);
    }

    // A concurrent registration can pass the exists checks and still lose on the unique index
    private StoreUser saveNewUser(StoreUser user) {
        try {
            return storeUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
            if (message != null && message.contains("uq_store_user_username")) {
                throw usernameTaken();
            }
            if (message != null && message.contains("uq_store_user_email")) {
                throw emailTaken();
            }
            throw ex;
        }
    }

    private static ProblemException usernameTaken() {
        return new ProblemException(HttpStatus.BAD_REQUEST, "USERNAME_ALREADY_EXISTS", "Username already exists");
    }

    private static ProblemException emailTaken() {
        return new ProblemException(HttpStatus.BAD_REQUEST, "EMAIL_ALREADY_EXISTS", "Email already exists");
    }
}
