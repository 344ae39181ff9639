package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.MemberUpdateEvent;
import com.voiceactivity.domain.model.TransitionEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget ingestion for the {@link SessionTracker}.
 *
 * Events are routed to one of N single-thread executors by (guild, user),
 * so one user's events run in arrival order while different users run
 * in parallel.
 */
@Slf4j
@Component
public class TransitionDispatcher {

    private final SessionTracker sessionTracker;
    private final ExecutorService[] stripes;

    public TransitionDispatcher(SessionTracker sessionTracker, AppProperties properties) {
        this.sessionTracker = sessionTracker;
        int count = properties.getTracker().getDispatcherStripes();
        this.stripes = new ExecutorService[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("transition-" + i + "-"));
        }
    }

    public void recordTransition(TransitionEvent event) {
        stripeFor(event.getGuildId(), event.getUserId()).execute(() -> {
            try {
                sessionTracker.onTransition(event);
            } catch (RuntimeException e) {
                log.error("Transition failed for user {} in guild {}: {}",
                        event.getUserId(), event.getGuildId(), e.getMessage(), e);
            }
        });
    }

    public void recordMemberUpdate(MemberUpdateEvent event) {
        stripeFor(event.getGuildId(), event.getUserId()).execute(() -> {
            try {
                sessionTracker.onMemberUpdate(event);
            } catch (RuntimeException e) {
                log.error("Member update failed for user {} in guild {}: {}",
                        event.getUserId(), event.getGuildId(), e.getMessage(), e);
            }
        });
    }

    ExecutorService stripeFor(String guildId, String userId) {
        int hash = (guildId + ":" + userId).hashCode();
        return stripes[Math.floorMod(hash, stripes.length)];
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        for (ExecutorService stripe : stripes) {
            stripe.shutdown();
        }
        for (ExecutorService stripe : stripes) {
            if (!stripe.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Transition stripe did not drain in time, dropping pending events");
                stripe.shutdownNow();
            }
        }
    }
}
