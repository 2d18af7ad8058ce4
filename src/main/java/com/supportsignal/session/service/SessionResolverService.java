package com.supportsignal.session.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.supportsignal.session.domain.ImpersonationSession;
import com.supportsignal.session.domain.Session;
import com.supportsignal.session.domain.User;
import com.supportsignal.session.repository.ImpersonationSessionRepository;
import com.supportsignal.session.repository.SessionRepository;
import com.supportsignal.session.repository.UserRepository;
import com.supportsignal.session.util.MetricsHelper;
import com.supportsignal.session.util.TokenGenerator;

import io.opentelemetry.instrumentation.annotations.WithSpan;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns an opaque token into the effective user.
 *
 * Resolution order:
 * 1. live impersonation overlay: resolves to the target user, with the
 *    admin id, overlay correlation id and reason attached
 * 2. live regular session: resolves to the session owner
 * 3. otherwise unauthenticated
 *
 * Both store lookups run for every token that the overlay store does not
 * match, whatever the token looks like, so unrecognized input always takes
 * the same path. The reserved impersonation prefix is never used to skip a
 * lookup.
 *
 * Never mutates state and never throws for malformed input. Store failures
 * propagate.
 */
@Slf4j
@Service
public class SessionResolverService {

    private final ImpersonationSessionRepository impersonationSessionRepository;
    private final SessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final MetricsHelper metricsHelper;
    private final Clock clock;

    private final List<TokenResolver> chain;

    public SessionResolverService(
            ImpersonationSessionRepository impersonationSessionRepository,
            SessionRepository sessionRepository,
            UserRepository userRepository,
            MetricsHelper metricsHelper,
            Clock clock) {
        this.impersonationSessionRepository = impersonationSessionRepository;
        this.sessionRepository = sessionRepository;
        this.userRepository = userRepository;
        this.metricsHelper = metricsHelper;
        this.clock = clock;
        this.chain = List.of(this::resolveImpersonation, this::resolveRegular);
    }

    /**
     * Resolves a token to its effective identity.
     *
     * @param token raw token, possibly null or attacker-controlled
     * @return the identity, or empty when the token is not live
     */
    @WithSpan
    @Transactional(readOnly = true)
    public Optional<ResolvedIdentity> resolve(String token) {
        long start = System.nanoTime();
        String normalized = TokenGenerator.normalize(token);

        Optional<ResolvedIdentity> result = Optional.empty();
        for (TokenResolver resolver : chain) {
            result = resolver.resolve(normalized);
            if (result.isPresent()) {
                break;
            }
        }

        String outcome = result.map(r -> r.impersonating() ? "impersonation" : "session")
            .orElse("unauthenticated");
        metricsHelper.recordResolution(outcome, System.nanoTime() - start);
        log.trace("Token resolution outcome={}", outcome);

        return result;
    }

    /**
     * Resolves a token to the effective user only.
     *
     * @param token raw token
     * @return the effective user, or null when unauthenticated
     */
    @Transactional(readOnly = true)
    public User resolveUser(String token) {
        return resolve(token).map(ResolvedIdentity::user).orElse(null);
    }

    private Optional<ResolvedIdentity> resolveImpersonation(String token) {
        Instant now = clock.instant();
        Optional<ImpersonationSession> overlay = impersonationSessionRepository.findLiveBySessionToken(token, now);

        // deleted target: resolves to nobody
        return overlay.flatMap(o -> userRepository.findById(o.getTargetUserId())
            .map(target -> ResolvedIdentity.impersonation(target, o)));
    }

    private Optional<ResolvedIdentity> resolveRegular(String token) {
        Instant now = clock.instant();
        Optional<Session> session = sessionRepository.findActiveBySessionToken(token, now);

        return session.flatMap(s -> userRepository.findById(s.getUserId())
            .map(ResolvedIdentity::regular));
    }

    /**
     * Effective identity behind a token.
     *
     * @param user effective user (the target while impersonating)
     * @param impersonating whether the token is an overlay token
     * @param adminUserId admin behind the overlay, null for regular sessions
     * @param impersonationCorrelationId overlay correlation id, null for regular sessions
     * @param impersonationReason recorded reason, null for regular sessions
     */
    public record ResolvedIdentity(
        User user,
        boolean impersonating,
        Long adminUserId,
        String impersonationCorrelationId,
        String impersonationReason
    ) {
        static ResolvedIdentity regular(User user) {
            return new ResolvedIdentity(user, false, null, null, null);
        }

        static ResolvedIdentity impersonation(User target, ImpersonationSession overlay) {
            return new ResolvedIdentity(target, true, overlay.getAdminUserId(),
                overlay.getCorrelationId(), overlay.getReason());
        }
    }
}
