package com.supportsignal.session.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.supportsignal.session.domain.ImpersonationSession;
import com.supportsignal.session.domain.Session;
import com.supportsignal.session.domain.User;
import com.supportsignal.session.domain.UserRole;
import com.supportsignal.session.repository.ImpersonationSessionRepository;
import com.supportsignal.session.repository.SessionRepository;
import com.supportsignal.session.repository.UserRepository;
import com.supportsignal.session.util.MetricsHelper;
import com.supportsignal.session.util.MutableClock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class SessionResolverServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private ImpersonationSessionRepository impersonationSessionRepository;

    @Mock
    private SessionRepository sessionRepository;

    @Mock
    private UserRepository userRepository;

    private SimpleMeterRegistry meterRegistry;
    private SessionResolverService resolver;

    private User admin;
    private User worker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        resolver = new SessionResolverService(
            impersonationSessionRepository,
            sessionRepository,
            userRepository,
            new MetricsHelper(meterRegistry),
            new MutableClock(NOW)
        );

        admin = User.builder().id(1L).name("Admin").email("admin@x.test").role(UserRole.SYSTEM_ADMIN).build();
        worker = User.builder().id(2L).name("Worker").email("worker@x.test").role(UserRole.FRONTLINE_WORKER).build();
    }

    @Test
    void resolve_LiveOverlay_ShouldReturnTargetWithAdminContext() {
        // Given
        ImpersonationSession overlay = ImpersonationSession.builder()
            .id(7L)
            .adminUserId(1L)
            .targetUserId(2L)
            .sessionToken("imp_token")
            .reason("Ticket 4411")
            .correlationId("corr-7")
            .expiresAt(NOW.plus(Duration.ofMinutes(5)))
            .active(true)
            .build();
        when(impersonationSessionRepository.findLiveBySessionToken("imp_token", NOW)).thenReturn(Optional.of(overlay));
        when(userRepository.findById(2L)).thenReturn(Optional.of(worker));

        // When
        Optional<SessionResolverService.ResolvedIdentity> identity = resolver.resolve("imp_token");

        // Then
        assertThat(identity).isPresent();
        assertThat(identity.get().user()).isSameAs(worker);
        assertThat(identity.get().impersonating()).isTrue();
        assertThat(identity.get().adminUserId()).isEqualTo(1L);
        assertThat(identity.get().impersonationCorrelationId()).isEqualTo("corr-7");
        assertThat(identity.get().impersonationReason()).isEqualTo("Ticket 4411");
        verify(sessionRepository, never()).findActiveBySessionToken(anyString(), any());
    }

    @Test
    void resolve_RegularSession_ShouldReturnOwner() {
        String token = "f".repeat(64);
        when(impersonationSessionRepository.findLiveBySessionToken(token, NOW)).thenReturn(Optional.empty());
        when(sessionRepository.findActiveBySessionToken(token, NOW)).thenReturn(Optional.of(
            Session.builder().id(3L).userId(1L).sessionToken(token).expiresAt(NOW.plusSeconds(60)).build()));
        when(userRepository.findById(1L)).thenReturn(Optional.of(admin));

        Optional<SessionResolverService.ResolvedIdentity> identity = resolver.resolve(token);

        assertThat(identity).isPresent();
        assertThat(identity.get().impersonating()).isFalse();
        assertThat(identity.get().adminUserId()).isNull();
        assertThat(meterRegistry.get("session.resolver.lookups").tag("result", "session").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void resolve_OverlayForDeletedTarget_ShouldFallThroughToRegularLookup() {
        ImpersonationSession overlay = ImpersonationSession.builder()
            .id(7L).adminUserId(1L).targetUserId(99L).sessionToken("imp_orphan")
            .expiresAt(NOW.plusSeconds(60)).active(true).build();
        when(impersonationSessionRepository.findLiveBySessionToken("imp_orphan", NOW)).thenReturn(Optional.of(overlay));
        when(userRepository.findById(99L)).thenReturn(Optional.empty());
        when(sessionRepository.findActiveBySessionToken("imp_orphan", NOW)).thenReturn(Optional.empty());

        assertThat(resolver.resolve("imp_orphan")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "imp_", "imp_nonexistent", "' OR 1=1 --", "\t\n", "not-a-token"})
    void resolve_MalformedTokens_ShouldQueryBothStoresAndReturnEmpty(String token) {
        when(impersonationSessionRepository.findLiveBySessionToken(token, NOW)).thenReturn(Optional.empty());
        when(sessionRepository.findActiveBySessionToken(token, NOW)).thenReturn(Optional.empty());

        assertThat(resolver.resolve(token)).isEmpty();

        verify(impersonationSessionRepository).findLiveBySessionToken(token, NOW);
        verify(sessionRepository).findActiveBySessionToken(token, NOW);
    }

    @Test
    void resolve_NullToken_ShouldBehaveLikeEmpty() {
        when(impersonationSessionRepository.findLiveBySessionToken("", NOW)).thenReturn(Optional.empty());
        when(sessionRepository.findActiveBySessionToken("", NOW)).thenReturn(Optional.empty());

        assertThat(resolver.resolve(null)).isEmpty();
        assertThat(resolver.resolveUser(null)).isNull();
        assertThat(meterRegistry.get("session.resolver.lookups").tag("result", "unauthenticated").counter().count())
            .isEqualTo(2.0);
    }

    @Test
    void resolve_LongToken_ShouldNotThrow() {
        String huge = "x".repeat(10_000);
        when(impersonationSessionRepository.findLiveBySessionToken(huge, NOW)).thenReturn(Optional.empty());
        when(sessionRepository.findActiveBySessionToken(huge, NOW)).thenReturn(Optional.empty());

        assertThat(resolver.resolve(huge)).isEmpty();
    }
}
