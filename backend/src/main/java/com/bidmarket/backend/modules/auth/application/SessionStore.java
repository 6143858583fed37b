package com.bidmarket.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.bidmarket.backend.modules.auth.config.AuthProperties;
import com.bidmarket.backend.modules.auth.domain.ClientInfo;
import com.bidmarket.backend.modules.auth.domain.ReusePolicy;
import com.bidmarket.backend.modules.auth.domain.Session;
import com.bidmarket.backend.modules.auth.domain.TokenPair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Refresh-token sessions using the selector/verifier scheme.
 *
 * <p>The selector is stored in clear and gives an indexed lookup; the verifier is only stored as a
 * BCrypt hash and checked with a single constant-time comparison. Every successful refresh rotates
 * both halves and remembers the replaced selector so that a second use of the old token can be
 * recognised as theft.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final SessionRepository sessionRepository;
    private final PasswordHasher passwordHasher;
    private final TokenPairGenerator tokenPairGenerator;
    private final Clock clock;
    private final ReusePolicy reusePolicy;
    private final int selectorRetryLimit;

    @Autowired
    public SessionStore(
            SessionRepository sessionRepository,
            PasswordHasher passwordHasher,
            TokenPairGenerator tokenPairGenerator,
            AuthProperties authProperties,
            Clock clock
    ) {
        this(sessionRepository, passwordHasher, tokenPairGenerator, clock,
                authProperties.session().reusePolicy(), authProperties.session().selectorRetryLimit());
    }

    public SessionStore(
            SessionRepository sessionRepository,
            PasswordHasher passwordHasher,
            TokenPairGenerator tokenPairGenerator,
            Clock clock,
            ReusePolicy reusePolicy,
            int selectorRetryLimit
    ) {
        this.sessionRepository = sessionRepository;
        this.passwordHasher = passwordHasher;
        this.tokenPairGenerator = tokenPairGenerator;
        this.clock = clock;
        this.reusePolicy = reusePolicy;
        this.selectorRetryLimit = Math.max(1, selectorRetryLimit);
    }

    /**
     * Stores a new session for {@code tokenPair}.
     *
     * @throws SelectorCollisionException when the selector is already in use
     */
    public Session create(UUID userId, TokenPair tokenPair, Duration ttl, ClientInfo client) {
        OffsetDateTime now = now();
        ClientInfo effectiveClient = client != null ? client : ClientInfo.UNKNOWN_CLIENT;
        Session session = new Session(
                UUID.randomUUID(),
                userId,
                tokenPair.selector(),
                passwordHasher.hash(tokenPair.verifier()),
                null,
                now.plus(ttl),
                now,
                null,
                effectiveClient.userAgent(),
                effectiveClient.ipAddress()
        );
        sessionRepository.insert(session);
        return session;
    }

    /**
     * Generates a pair and creates a session for it, drawing a new pair on selector collision.
     */
    public OpenedSession open(UUID userId, Duration ttl, ClientInfo client) {
        SelectorCollisionException lastCollision = null;
        for (int attempt = 0; attempt < selectorRetryLimit; attempt++) {
            TokenPair pair = tokenPairGenerator.generate();
            try {
                return new OpenedSession(create(userId, pair, ttl, client), pair);
            } catch (SelectorCollisionException ex) {
                log.warn("Selector collision while opening a session for user {}, regenerating", userId);
                lastCollision = ex;
            }
        }
        throw new IllegalStateException("Could not allocate a unique token selector", lastCollision);
    }

    /**
     * Active session for {@code selector}; expired sessions are treated as absent.
     */
    public Optional<Session> lookupBySelector(String selector) {
        if (!TokenPairGenerator.isValidSelector(selector)) {
            return Optional.empty();
        }
        OffsetDateTime now = now();
        return sessionRepository.findBySelector(selector.toLowerCase(Locale.ROOT))
                .filter(session -> !session.isExpiredAt(now));
    }

    /**
     * Checks a presented refresh token without modifying the session, except when it turns out to be
     * a replay of a rotated-out token: then the affected sessions are revoked before returning.
     */
    public SessionValidation validateAndConsume(String fullToken) {
        Optional<TokenPair> parsed = tokenPairGenerator.parse(fullToken);
        if (parsed.isEmpty()) {
            return new SessionValidation.Rejected(AuthFailure.TOKEN_MALFORMED);
        }
        TokenPair presented = parsed.get();
        OffsetDateTime now = now();

        Optional<Session> current = sessionRepository.findBySelector(presented.selector());
        if (current.isEmpty()) {
            Optional<Session> rotatedFrom = sessionRepository.findByPreviousSelector(presented.selector())
                    .filter(session -> !session.isExpiredAt(now));
            if (rotatedFrom.isPresent()) {
                return handleReuse(rotatedFrom.get());
            }
            passwordHasher.verifyAgainstDummy(presented.verifier());
            return new SessionValidation.Rejected(AuthFailure.TOKEN_NOT_FOUND);
        }

        Session session = current.get();
        if (session.isExpiredAt(now)) {
            passwordHasher.verifyAgainstDummy(presented.verifier());
            sessionRepository.deleteById(session.id());
            return new SessionValidation.Rejected(AuthFailure.TOKEN_EXPIRED);
        }
        if (!passwordHasher.verify(presented.verifier(), session.tokenVerifierHash())) {
            return new SessionValidation.Rejected(AuthFailure.TOKEN_MISMATCH);
        }
        return new SessionValidation.Valid(session);
    }

    /**
     * Moves {@code session} to {@code newTokenPair} if nobody rotated or revoked it since it was read.
     * The replaced selector becomes {@code previousSelector} and the expiry slides to now + ttl.
     *
     * @throws SelectorCollisionException when the new selector is already in use
     */
    public boolean rotate(Session session, TokenPair newTokenPair, Duration ttl) {
        OffsetDateTime now = now();
        Session rotated = session.rotatedTo(
                newTokenPair.selector(),
                passwordHasher.hash(newTokenPair.verifier()),
                now,
                now.plus(ttl)
        );
        return sessionRepository.compareAndRotate(session.id(), session.tokenSelector(), rotated);
    }

    /**
     * Rotates to a freshly generated pair. Empty when the session was rotated or revoked concurrently.
     */
    public Optional<TokenPair> rotate(Session session, Duration ttl) {
        SelectorCollisionException lastCollision = null;
        for (int attempt = 0; attempt < selectorRetryLimit; attempt++) {
            TokenPair next = tokenPairGenerator.generate();
            try {
                return rotate(session, next, ttl) ? Optional.of(next) : Optional.empty();
            } catch (SelectorCollisionException ex) {
                log.warn("Selector collision while rotating session {}, regenerating", session.id());
                lastCollision = ex;
            }
        }
        throw new IllegalStateException("Could not allocate a unique token selector", lastCollision);
    }

    public Optional<Session> findById(UUID sessionId) {
        return sessionRepository.findById(sessionId);
    }

    public boolean revoke(UUID sessionId) {
        return sessionRepository.deleteById(sessionId);
    }

    public int revokeAll(UUID userId) {
        return sessionRepository.deleteByUserId(userId);
    }

    public int revokeAllExcept(UUID userId, UUID keepSessionId) {
        return sessionRepository.deleteByUserIdExcept(userId, keepSessionId);
    }

    public List<Session> listByUser(UUID userId) {
        return sessionRepository.findActiveByUserId(userId, now());
    }

    /**
     * Revokes the oldest sessions until fewer than {@code maxSessions} remain, making room for one more.
     */
    public List<UUID> evictOldest(UUID userId, int maxSessions) {
        List<Session> active = listByUser(userId);
        List<UUID> evicted = new ArrayList<>();
        int excess = active.size() - maxSessions + 1;
        for (int i = 0; i < excess && i < active.size(); i++) {
            UUID sessionId = active.get(i).id();
            if (sessionRepository.deleteById(sessionId)) {
                evicted.add(sessionId);
            }
        }
        return evicted;
    }

    public int purgeExpired() {
        return sessionRepository.deleteExpired(now());
    }

    private SessionValidation handleReuse(Session session) {
        int revoked;
        if (reusePolicy == ReusePolicy.REVOKE_ALL_USER_SESSIONS) {
            revoked = sessionRepository.deleteByUserId(session.userId());
        } else {
            revoked = sessionRepository.deleteById(session.id()) ? 1 : 0;
        }
        log.error("Refresh token reuse detected for session {} of user {}; revoked {} session(s) under {}",
                session.id(), session.userId(), revoked, reusePolicy);
        return new SessionValidation.ReuseDetected(session, revoked);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    /**
     * A newly created session together with the token pair handed to the client.
     */
    public record OpenedSession(Session session, TokenPair tokenPair) {
    }
}
