package com.storefront.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.modules.access.application.AccessGuard;
import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.ResourceType;
import com.storefront.backend.modules.auth.domain.StoreUser;
import com.storefront.backend.modules.auth.domain.UserSession;
import com.storefront.backend.modules.auth.infrastructure.persistence.StoreUserRepository;
import com.storefront.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.storefront.backend.modules.auth.presentation.dto.LoginRequest;
import com.storefront.backend.modules.auth.presentation.dto.LogoutRequest;
import com.storefront.backend.modules.auth.presentation.dto.RefreshRequest;
import com.storefront.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Session lifecycle: login issues a token pair, refresh rotates it, logout revokes it.
 *
 * <p>Revocations go through a conditional update, so when refresh and logout race on
 * the same session only one of them takes effect.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_USER_INACTIVE = "USER_INACTIVE";

    private final StoreUserRepository storeUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final CurrentUserService currentUserService;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public AuthService(
            StoreUserRepository storeUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            CurrentUserService currentUserService,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.storeUserRepository = storeUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.currentUserService = currentUserService;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public TokenPairResponse login(LoginRequest request) {
        accessGuard.require(AccessAction.CREATE, ResourceType.SESSION);

        // Unknown email, wrong password and inactive account look the same to the client
        StoreUser user = storeUserRepository.findActiveByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        TokenPairResponse tokens = issueSession(user);
        log.info("Session opened for user {}", user.getId());
        return tokens;
    }

    public TokenPairResponse refresh(RefreshRequest request) {
        accessGuard.requireTier(AccessAction.UPDATE, ResourceType.SESSION);

        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(RefreshTokens.hash(request.refreshToken()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        accessGuard.require(AccessAction.UPDATE, ResourceType.SESSION, session);

        if (session.isRevoked()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        if (session.isExpiredAt(now)) {
            userSessionRepository.revokeIfActive(session.getId(), now, REASON_EXPIRED);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        StoreUser user = session.getUser();
        if (!user.isActive()) {
            userSessionRepository.revokeIfActive(session.getId(), now, REASON_USER_INACTIVE);
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        // Rotation: the used token dies before a new one is handed out
        if (userSessionRepository.revokeIfActive(session.getId(), now, REASON_ROTATED) == 0) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        TokenPairResponse tokens = issueSession(user);
        log.info("Session {} rotated for user {}", session.getId(), user.getId());
        return tokens;
    }

    public void logout(LogoutRequest request) {
        accessGuard.requireTier(AccessAction.DELETE, ResourceType.SESSION);
        currentUserService.loadActiveUser();

        Optional<UserSession> session = userSessionRepository.findByRefreshTokenHash(RefreshTokens.hash(request.refreshToken()));
        if (session.isEmpty()) {
            // Unknown tokens get the same response so token validity is not disclosed
            return;
        }

        UserSession found = session.get();
        accessGuard.require(AccessAction.DELETE, ResourceType.SESSION, found);

        int updated = userSessionRepository.revokeIfActive(found.getId(), OffsetDateTime.now(clock), REASON_LOGOUT);
        if (updated > 0) {
            log.info("Session {} revoked by logout", found.getId());
        }
    }

    private TokenPairResponse issueSession(StoreUser user) {
        String refreshToken = RefreshTokens.generate();
        List<String> roles = List.of(user.getRole().name());
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail(), roles, refreshToken);
        persistSession(user.getId(), refreshToken, tokens);
        return tokens;
    }

    private void persistSession(UUID userId, String refreshToken, TokenPairResponse tokens) {
        OffsetDateTime issuedAt = tokens.issuedAt();

        UserSession session = new UserSession();
        session.setUser(storeUserRepository.getReferenceById(userId));
        session.setRefreshTokenHash(RefreshTokens.hash(refreshToken));
        session.setIssuedAt(issuedAt);
        session.setExpiresAt(issuedAt.plusSeconds(tokens.refreshExpiresIn()));

        userSessionRepository.save(session);
    }
}
