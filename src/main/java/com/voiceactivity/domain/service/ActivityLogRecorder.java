package com.voiceactivity.domain.service;

import com.voiceactivity.domain.model.ActivityLogEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes the presence audit trail for {@link ActivityLogEvent}s.
 * Outbound delivery to a chat channel hooks in here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActivityLogRecorder {

    private final MeterRegistry meterRegistry;

    @EventListener
    public void onActivityLog(ActivityLogEvent event) {
        Counter.builder("activity.log.events")
                .tag("type", event.getType().name())
                .tag("accruing", String.valueOf(event.isAccruing()))
                .register(meterRegistry)
                .increment();

        log.info("[{}] {} ({}) {} -> {} at {}{}",
                event.getGuildId(),
                event.getDisplayName() != null ? event.getDisplayName() : event.getUserId(),
                event.getType(),
                event.getFromResourceId() != null ? event.getFromResourceId() : "-",
                event.getToResourceId() != null ? event.getToResourceId() : "-",
                event.getTimestamp(),
                event.isAccruing() ? "" : " (not accruing)");
    }
}
