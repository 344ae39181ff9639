package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.ActiveSession;
import com.voiceactivity.domain.model.ActivityLogEvent;
import com.voiceactivity.domain.model.CompletedSession;
import com.voiceactivity.domain.model.ExclusionPolicy;
import com.voiceactivity.domain.model.MemberUpdateEvent;
import com.voiceactivity.domain.model.TrackerStatistics;
import com.voiceactivity.domain.model.TransitionEvent;
import com.voiceactivity.domain.model.TransitionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-user session state machine.
 *
 * Transition Handling:
 * - JOIN into an accruing resource starts a session
 * - LEAVE ends the user's session, whatever the resource's current policy
 * - MOVE ends the current session (if any) and starts a new one when the
 *   destination accrues, so each session belongs to exactly one resource
 * - old == new is a no-op
 *
 * Exclusion policy is read when the transition happens, not when the
 * session started. Events for one user must arrive in order; see
 * {@link TransitionDispatcher}.
 */
@Slf4j
@Service
public class SessionTracker {

    private final ActiveSessionStore sessionStore;
    private final GuildSettingsProvider settingsProvider;
    private final ActivityAggregationService aggregationService;
    private final LiveActivityService liveActivityService;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final AtomicInteger activeSessions = new AtomicInteger();
    private final AtomicInteger peakSessions = new AtomicInteger();
    private final AtomicLong totalJoins = new AtomicLong();
    private final AtomicLong totalLeaves = new AtomicLong();
    private final AtomicLong storeFailures = new AtomicLong();

    public SessionTracker(ActiveSessionStore sessionStore,
                          GuildSettingsProvider settingsProvider,
                          ActivityAggregationService aggregationService,
                          LiveActivityService liveActivityService,
                          ApplicationEventPublisher eventPublisher,
                          AppProperties properties,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.sessionStore = sessionStore;
        this.settingsProvider = settingsProvider;
        this.aggregationService = aggregationService;
        this.liveActivityService = liveActivityService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        Gauge.builder("tracker.sessions.active", activeSessions, AtomicInteger::get)
                .register(meterRegistry);
        Gauge.builder("tracker.sessions.peak", peakSessions, AtomicInteger::get)
                .register(meterRegistry);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        restoreSessions();
    }

    /**
     * Reloads sessions that survived a restart in the shared cache.
     */
    public int restoreSessions() {
        List<ActiveSession> restored = sessionStore.restore();
        activeSessions.set(restored.size());
        peakSessions.accumulateAndGet(restored.size(), Math::max);
        return restored.size();
    }

    public TransitionType onTransition(TransitionEvent event) {
        String oldResource = event.getOldResourceId();
        String newResource = event.getNewResourceId();
        if (Objects.equals(oldResource, newResource)) {
            log.debug("Ignoring no-op transition for user {} in guild {}", event.getUserId(), event.getGuildId());
            return TransitionType.NO_OP;
        }

        TransitionType type = classify(oldResource, newResource);
        Instant now = event.getTimestamp() != null ? event.getTimestamp() : clock.instant();
        ExclusionPolicy policy = settingsProvider.getExclusionPolicy(event.getGuildId());
        Optional<ActiveSession> current = sessionStore.find(event.getGuildId(), event.getUserId());
        boolean destinationAccrues = accrues(policy, newResource, event.getDisplayName());

        switch (type) {
            case JOIN -> {
                if (destinationAccrues) {
                    startSession(event, newResource, now, current);
                }
            }
            case LEAVE -> current.ifPresent(session -> endSession(session, now));
            case MOVE -> {
                current.ifPresent(session -> endSession(session, now));
                if (destinationAccrues) {
                    startSession(event, newResource, now, Optional.empty());
                }
            }
            default -> throw new IllegalStateException("Unexpected transition " + type);
        }

        Counter.builder("tracker.transitions")
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();

        publishLogEvent(type, event, policy, now, destinationAccrues);
        return type;
    }

    /**
     * Stops accrual when an observation marker is added to the display name
     * and resumes it when the marker is removed.
     */
    public void onMemberUpdate(MemberUpdateEvent event) {
        boolean wasObserving = isObserving(event.getOldDisplayName());
        boolean observing = isObserving(event.getNewDisplayName());
        if (wasObserving == observing) {
            return;
        }

        Instant now = event.getTimestamp() != null ? event.getTimestamp() : clock.instant();
        Optional<ActiveSession> current = sessionStore.find(event.getGuildId(), event.getUserId());

        if (observing) {
            current.ifPresent(session -> {
                log.info("User {} entered observation mode, ending session", event.getUserId());
                endSession(session, now);
            });
            return;
        }

        String resource = event.getCurrentResourceId();
        if (current.isEmpty() && resource != null
                && settingsProvider.getExclusionPolicy(event.getGuildId()).accrues(resource)) {
            log.info("User {} left observation mode, resuming in {}", event.getUserId(), resource);
            startSession(TransitionEvent.builder()
                    .userId(event.getUserId())
                    .guildId(event.getGuildId())
                    .displayName(event.getNewDisplayName())
                    .build(), resource, now, Optional.empty());
        }
    }

    public Optional<ActiveSession> getActiveSession(String guildId, String userId) {
        return sessionStore.find(guildId, userId);
    }

    public TrackerStatistics getStatistics() {
        return TrackerStatistics.builder()
                .totalJoins(totalJoins.get())
                .totalLeaves(totalLeaves.get())
                .activeSessions(activeSessions.get())
                .peakConcurrentSessions(peakSessions.get())
                .storeFailures(storeFailures.get())
                .build();
    }

    private TransitionType classify(String oldResource, String newResource) {
        if (oldResource == null) {
            return TransitionType.JOIN;
        }
        return newResource == null ? TransitionType.LEAVE : TransitionType.MOVE;
    }

    private boolean accrues(ExclusionPolicy policy, String resourceId, String displayName) {
        return policy.accrues(resourceId) && !isObserving(displayName);
    }

    boolean isObserving(String displayName) {
        if (displayName == null) {
            return false;
        }
        return properties.getTracker().getObservationMarkers().stream().anyMatch(displayName::contains);
    }

    private void startSession(TransitionEvent event, String resourceId, Instant now, Optional<ActiveSession> existing) {
        if (existing.isPresent()) {
            // Missed leave: keep the record, restart the clock
            ActiveSession session = existing.get();
            log.warn("User {} already had a session in {} since {}, resetting start time",
                    session.getUserId(), session.getResourceId(), session.getStartTime());
            session.setResourceId(resourceId);
            session.setStartTime(now);
            session.setDisplayName(event.getDisplayName());
            sessionStore.save(session);
            return;
        }

        sessionStore.save(ActiveSession.builder()
                .userId(event.getUserId())
                .guildId(event.getGuildId())
                .resourceId(resourceId)
                .startTime(now)
                .displayName(event.getDisplayName())
                .build());

        totalJoins.incrementAndGet();
        peakSessions.accumulateAndGet(activeSessions.incrementAndGet(), Math::max);
        log.info("Session started: user={}, guild={}, resource={}", event.getUserId(), event.getGuildId(), resourceId);
    }

    private void endSession(ActiveSession session, Instant now) {
        CompletedSession completed = CompletedSession.close(session, now);
        try {
            aggregationService.recordCompletedSession(completed);
            liveActivityService.refresh(session.getUserId(), session.getGuildId());
            Counter.builder("tracker.sessions.completed")
                    .register(meterRegistry)
                    .increment();
        } catch (RuntimeException e) {
            storeFailures.incrementAndGet();
            Counter.builder("tracker.store.failures")
                    .register(meterRegistry)
                    .increment();
            log.error("Failed to record session for user {} in guild {} ({} ms): {}",
                    session.getUserId(), session.getGuildId(), completed.getDurationMs(), e.getMessage(), e);
        } finally {
            sessionStore.remove(session.getGuildId(), session.getUserId());
            totalLeaves.incrementAndGet();
            activeSessions.updateAndGet(count -> Math.max(0, count - 1));
        }
        log.info("Session ended: user={}, guild={}, resource={}, duration={} ms",
                session.getUserId(), session.getGuildId(), session.getResourceId(), completed.getDurationMs());
    }

    private void publishLogEvent(TransitionType type, TransitionEvent event, ExclusionPolicy policy,
                                 Instant now, boolean accruing) {
        boolean fromLogged = event.getOldResourceId() != null && !policy.isFullyExcluded(event.getOldResourceId());
        boolean toLogged = event.getNewResourceId() != null && !policy.isFullyExcluded(event.getNewResourceId());
        if (!fromLogged && !toLogged) {
            return;
        }
        eventPublisher.publishEvent(ActivityLogEvent.builder()
                .type(type)
                .userId(event.getUserId())
                .guildId(event.getGuildId())
                .displayName(event.getDisplayName())
                .fromResourceId(fromLogged ? event.getOldResourceId() : null)
                .toResourceId(toLogged ? event.getNewResourceId() : null)
                .timestamp(now)
                .accruing(accruing)
                .build());
    }
}
