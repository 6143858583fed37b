package com.bidmarket.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import com.bidmarket.backend.modules.audit.application.SecurityAuditService;
import com.bidmarket.backend.modules.audit.application.SecurityAuditService.SecurityAuditEvent;
import com.bidmarket.backend.modules.audit.domain.AuditSeverity;
import com.bidmarket.backend.modules.audit.domain.SecurityEventType;
import com.bidmarket.backend.modules.auth.config.AuthProperties;
import com.bidmarket.backend.modules.auth.domain.AccessTokenClaims;
import com.bidmarket.backend.modules.auth.domain.ClientInfo;
import com.bidmarket.backend.modules.auth.domain.Role;
import com.bidmarket.backend.modules.auth.domain.RoleHierarchy;
import com.bidmarket.backend.modules.auth.domain.Session;
import com.bidmarket.backend.modules.auth.domain.TokenPair;
import com.bidmarket.backend.modules.auth.domain.UserAccount;
import com.bidmarket.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.bidmarket.backend.modules.ratelimit.application.RateLimiter;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitAction;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitDecision;
import com.bidmarket.backend.modules.ratelimit.domain.RateLimitKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final int MAX_EMAIL_LENGTH = 320;
    private static final int MAX_NAME_LENGTH = 100;
    private static final Pattern EMAIL_FORMAT = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final UserAccountRepository userAccountRepository;
    private final PasswordHasher passwordHasher;
    private final AccessTokenService accessTokenService;
    private final SessionStore sessionStore;
    private final RateLimiter rateLimiter;
    private final SecurityAuditService auditService;
    private final AuthProperties authProperties;
    private final Clock clock;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordHasher passwordHasher,
            AccessTokenService accessTokenService,
            SessionStore sessionStore,
            RateLimiter rateLimiter,
            SecurityAuditService auditService,
            AuthProperties authProperties,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordHasher = passwordHasher;
        this.accessTokenService = accessTokenService;
        this.sessionStore = sessionStore;
        this.rateLimiter = rateLimiter;
        this.auditService = auditService;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    public AuthResult<UserAccount> register(String email, String password, String name, Role role) {
        String normalizedEmail = normalizeEmail(email);
        if (!isWellFormedEmail(normalizedEmail) || !isAcceptableName(name)) {
            return AuthResult.failure(AuthFailure.INVALID_ACCOUNT_DETAILS);
        }
        if (!satisfiesPasswordPolicy(password)) {
            return AuthResult.failure(AuthFailure.WEAK_PASSWORD);
        }
        if (userAccountRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            return AuthResult.failure(AuthFailure.EMAIL_ALREADY_REGISTERED);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        UserAccount user = new UserAccount();
        user.setEmail(normalizedEmail);
        user.setPasswordHash(passwordHasher.hash(password));
        user.setName(name.trim());
        user.setRole(role != null ? role : Role.USER);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        try {
            UserAccount saved = userAccountRepository.saveAndFlush(user);
            log.info("Registered user {} with role {}", saved.getId(), saved.getRole());
            return AuthResult.success(saved);
        } catch (DataIntegrityViolationException ex) {
            // concurrent registration won the unique index
            return AuthResult.failure(AuthFailure.EMAIL_ALREADY_REGISTERED);
        }
    }

    public AuthResult<AuthTokens> login(String email, String password, ClientInfo client) {
        ClientInfo effectiveClient = client != null ? client : ClientInfo.UNKNOWN_CLIENT;
        RateLimitKey rateLimitKey = RateLimitKey.of(RateLimitAction.LOGIN, effectiveClient.identity());
        RateLimitDecision decision = rateLimiter.check(rateLimitKey);
        if (!decision.allowed()) {
            audit(SecurityAuditEvent.of(SecurityEventType.RATE_LIMIT_EXCEEDED, AuditSeverity.WARNING, null,
                    normalizeEmail(email), effectiveClient).withDetail("action", RateLimitAction.LOGIN.name()));
            return AuthResult.rateLimited(decision.retryAfter());
        }

        String normalizedEmail = normalizeEmail(email);
        Optional<UserAccount> candidate = normalizedEmail == null
                ? Optional.empty()
                : userAccountRepository.findByEmailIgnoreCase(normalizedEmail);
        if (candidate.isEmpty()) {
            passwordHasher.verifyAgainstDummy(password);
            audit(SecurityAuditEvent.of(SecurityEventType.LOGIN_FAILED, AuditSeverity.WARNING, null,
                    normalizedEmail, effectiveClient).withDetail("reason", "unknown_user"));
            return AuthResult.failure(AuthFailure.INVALID_CREDENTIALS);
        }
        UserAccount user = candidate.get();
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            audit(SecurityAuditEvent.of(SecurityEventType.LOGIN_FAILED, AuditSeverity.WARNING, user.getId(),
                    user.getEmail(), effectiveClient).withDetail("reason", "invalid_password"));
            return AuthResult.failure(AuthFailure.INVALID_CREDENTIALS);
        }

        List<UUID> evicted = sessionStore.evictOldest(user.getId(), authProperties.session().maxPerUser());
        if (!evicted.isEmpty()) {
            audit(SecurityAuditEvent.of(SecurityEventType.SESSION_LIMIT_REACHED, AuditSeverity.INFO, user.getId(),
                    user.getEmail(), effectiveClient).withDetail("evictedSessionIds", evicted.stream()
                    .map(UUID::toString)
                    .toList()));
        }

        SessionStore.OpenedSession opened = sessionStore.open(user.getId(), refreshTokenTtl(), effectiveClient);
        AuthTokens tokens = tokensFor(user, opened.session().id(), opened.tokenPair());

        if (authProperties.session().resetRateLimitOnLogin()) {
            rateLimiter.reset(rateLimitKey);
        }
        audit(SecurityAuditEvent.of(SecurityEventType.LOGIN_SUCCESS, AuditSeverity.INFO, user.getId(),
                user.getEmail(), effectiveClient).withDetail("sessionId", opened.session().id().toString()));
        return AuthResult.success(tokens);
    }

    public AuthResult<AuthTokens> refresh(String refreshToken, ClientInfo client) {
        ClientInfo effectiveClient = client != null ? client : ClientInfo.UNKNOWN_CLIENT;
        RateLimitDecision decision = rateLimiter.check(
                RateLimitKey.of(RateLimitAction.REFRESH, effectiveClient.identity()));
        if (!decision.allowed()) {
            audit(SecurityAuditEvent.of(SecurityEventType.RATE_LIMIT_EXCEEDED, AuditSeverity.WARNING, null, null,
                    effectiveClient).withDetail("action", RateLimitAction.REFRESH.name()));
            return AuthResult.rateLimited(decision.retryAfter());
        }

        SessionValidation validation = sessionStore.validateAndConsume(refreshToken);
        if (validation instanceof SessionValidation.ReuseDetected reuse) {
            audit(SecurityAuditEvent.of(SecurityEventType.TOKEN_REUSE_DETECTED, AuditSeverity.CRITICAL,
                    reuse.session().userId(), null, effectiveClient)
                    .withDetail("sessionId", reuse.session().id().toString())
                    .withDetail("revokedSessions", reuse.revokedCount()));
            return AuthResult.failure(AuthFailure.TOKEN_REUSE_DETECTED);
        }
        if (validation instanceof SessionValidation.Rejected rejected) {
            log.debug("Refresh rejected: {}", rejected.reason());
            return AuthResult.failure(rejected.reason());
        }

        Session session = ((SessionValidation.Valid) validation).session();
        Optional<UserAccount> owner = userAccountRepository.findById(session.userId());
        if (owner.isEmpty()) {
            log.warn("Session {} belongs to missing user {}, revoking", session.id(), session.userId());
            sessionStore.revoke(session.id());
            return AuthResult.failure(AuthFailure.TOKEN_NOT_FOUND);
        }

        Optional<TokenPair> rotated = sessionStore.rotate(session, refreshTokenTtl());
        if (rotated.isEmpty()) {
            log.debug("Session {} was rotated or revoked concurrently", session.id());
            return AuthResult.failure(AuthFailure.TOKEN_NOT_FOUND);
        }

        UserAccount user = owner.get();
        AuthTokens tokens = tokensFor(user, session.id(), rotated.get());
        audit(SecurityAuditEvent.of(SecurityEventType.TOKEN_REFRESH, AuditSeverity.INFO, user.getId(),
                user.getEmail(), effectiveClient).withDetail("sessionId", session.id().toString()));
        return AuthResult.success(tokens);
    }

    public void logout(UUID sessionId) {
        logout(sessionId, ClientInfo.UNKNOWN_CLIENT);
    }

    public void logout(UUID sessionId, ClientInfo client) {
        if (sessionId == null) {
            return;
        }
        Optional<Session> session = sessionStore.findById(sessionId);
        if (session.isEmpty() || !sessionStore.revoke(sessionId)) {
            return;
        }
        audit(SecurityAuditEvent.of(SecurityEventType.LOGOUT, AuditSeverity.INFO, session.get().userId(), null,
                client).withDetail("sessionId", sessionId.toString()));
    }

    public int logoutAllOtherSessions(UUID userId, UUID currentSessionId) {
        int revoked = sessionStore.revokeAllExcept(userId, currentSessionId);
        if (revoked > 0) {
            audit(SecurityAuditEvent.of(SecurityEventType.SESSION_REVOKED, AuditSeverity.INFO, userId, null, null)
                    .withDetail("revokedSessions", revoked)
                    .withDetail("keptSessionId", String.valueOf(currentSessionId)));
        }
        return revoked;
    }

    /**
     * Replaces the password, signs out every device and opens a fresh session for the caller.
     */
    public AuthResult<AuthTokens> changePassword(UUID userId, String currentPassword, String newPassword,
            ClientInfo client) {
        if (userId == null) {
            return AuthResult.failure(AuthFailure.USER_NOT_FOUND);
        }
        ClientInfo effectiveClient = client != null ? client : ClientInfo.UNKNOWN_CLIENT;
        RateLimitDecision decision = rateLimiter.check(
                RateLimitKey.of(RateLimitAction.PASSWORD_CHANGE, userId.toString()));
        if (!decision.allowed()) {
            audit(SecurityAuditEvent.of(SecurityEventType.RATE_LIMIT_EXCEEDED, AuditSeverity.WARNING, userId, null,
                    effectiveClient).withDetail("action", RateLimitAction.PASSWORD_CHANGE.name()));
            return AuthResult.rateLimited(decision.retryAfter());
        }

        Optional<UserAccount> candidate = userAccountRepository.findById(userId);
        if (candidate.isEmpty()) {
            return AuthResult.failure(AuthFailure.USER_NOT_FOUND);
        }
        UserAccount user = candidate.get();
        if (!passwordHasher.verify(currentPassword, user.getPasswordHash())) {
            audit(SecurityAuditEvent.of(SecurityEventType.LOGIN_FAILED, AuditSeverity.WARNING, userId,
                    user.getEmail(), effectiveClient).withDetail("reason", "password_change_invalid_current"));
            return AuthResult.failure(AuthFailure.INVALID_CREDENTIALS);
        }
        if (!satisfiesPasswordPolicy(newPassword)) {
            return AuthResult.failure(AuthFailure.WEAK_PASSWORD);
        }

        int revoked = sessionStore.revokeAll(userId);
        user.setPasswordHash(passwordHasher.hash(newPassword));
        user.setUpdatedAt(OffsetDateTime.now(clock));
        userAccountRepository.save(user);

        SessionStore.OpenedSession opened = sessionStore.open(userId, refreshTokenTtl(), effectiveClient);
        audit(SecurityAuditEvent.of(SecurityEventType.PASSWORD_CHANGE, AuditSeverity.WARNING, userId,
                user.getEmail(), effectiveClient).withDetail("revokedSessions", revoked));
        return AuthResult.success(tokensFor(user, opened.session().id(), opened.tokenPair()));
    }

    public List<SessionInfo> listSessions(UUID userId, UUID currentSessionId) {
        return sessionStore.listByUser(userId).stream()
                .map(session -> SessionInfo.of(session, currentSessionId))
                .toList();
    }

    public AuthResult<AccessTokenClaims> authenticate(String accessToken) {
        AccessTokenVerification verification = accessTokenService.inspect(accessToken);
        switch (verification.status()) {
            case VALID:
                return AuthResult.success(verification.claims());
            case EXPIRED:
                return AuthResult.failure(AuthFailure.ACCESS_TOKEN_EXPIRED);
            default:
                return AuthResult.failure(AuthFailure.ACCESS_TOKEN_INVALID);
        }
    }

    /**
     * Admits the caller when their role ranks at or above any of {@code requiredRoles}.
     */
    public AuthResult<AccessTokenClaims> authorize(AccessTokenClaims claims, Collection<String> requiredRoles) {
        if (claims == null) {
            return AuthResult.failure(AuthFailure.ACCESS_TOKEN_INVALID);
        }
        if (!RoleHierarchy.hasAnyRole(claims.role(), requiredRoles)) {
            log.debug("User {} with role {} denied, requires one of {}", claims.subject(), claims.role(), requiredRoles);
            return AuthResult.failure(AuthFailure.INSUFFICIENT_ROLE);
        }
        return AuthResult.success(claims);
    }

    public AuthResult<AccessTokenClaims> authorize(AccessTokenClaims claims, Role... requiredRoles) {
        return authorize(claims, Arrays.stream(requiredRoles).map(Role::name).toList());
    }

    private AuthTokens tokensFor(UserAccount user, UUID sessionId, TokenPair tokenPair) {
        IssuedAccessToken accessToken = accessTokenService.issue(user);
        return new AuthTokens(
                accessToken.token(),
                AuthTokens.DEFAULT_TOKEN_TYPE,
                accessTokenService.getAccessTokenTtl().toSeconds(),
                accessToken.expiresAt(),
                tokenPair.fullToken(),
                sessionId,
                user.getId()
        );
    }

    private boolean satisfiesPasswordPolicy(String password) {
        return password != null
                && password.length() >= authProperties.password().minLength()
                && PasswordHasher.fitsBcryptInput(password);
    }

    private static boolean isWellFormedEmail(String normalizedEmail) {
        return normalizedEmail != null
                && normalizedEmail.length() <= MAX_EMAIL_LENGTH
                && EMAIL_FORMAT.matcher(normalizedEmail).matches();
    }

    private static boolean isAcceptableName(String name) {
        return name != null && !name.isBlank() && name.trim().length() <= MAX_NAME_LENGTH;
    }

    private Duration refreshTokenTtl() {
        return authProperties.session().refreshTokenTtl();
    }

    private void audit(SecurityAuditEvent event) {
        auditService.record(event);
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
