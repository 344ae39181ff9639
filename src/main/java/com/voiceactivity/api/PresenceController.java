package com.voiceactivity.api;

import com.voiceactivity.domain.model.LiveActivity;
import com.voiceactivity.domain.model.MemberUpdateEvent;
import com.voiceactivity.domain.model.TrackerStatistics;
import com.voiceactivity.domain.model.TransitionEvent;
import com.voiceactivity.domain.service.LiveActivityService;
import com.voiceactivity.domain.service.SessionTracker;
import com.voiceactivity.domain.service.TransitionDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Ingestion of presence events from the platform gateway.
 *
 * Endpoints:
 * - POST /api/v1/presence/transitions - Voice join/leave/move (fire-and-forget)
 * - POST /api/v1/presence/member-updates - Display name changes
 * - GET /api/v1/presence/guilds/{guildId}/users/{userId}/live - Today's activity
 * - GET /api/v1/presence/statistics - Tracker counters
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/presence")
@RequiredArgsConstructor
public class PresenceController {

    private final TransitionDispatcher dispatcher;
    private final SessionTracker sessionTracker;
    private final LiveActivityService liveActivityService;

    @PostMapping("/transitions")
    public ResponseEntity<Void> recordTransition(@Valid @RequestBody TransitionEvent event) {
        log.debug("Transition: user={}, guild={}, {} -> {}",
                event.getUserId(), event.getGuildId(), event.getOldResourceId(), event.getNewResourceId());
        dispatcher.recordTransition(event);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/member-updates")
    public ResponseEntity<Void> recordMemberUpdate(@Valid @RequestBody MemberUpdateEvent event) {
        log.debug("Member update: user={}, guild={}", event.getUserId(), event.getGuildId());
        dispatcher.recordMemberUpdate(event);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/guilds/{guildId}/users/{userId}/live")
    public ResponseEntity<LiveActivity> getLiveActivity(@PathVariable String guildId, @PathVariable String userId) {
        return ResponseEntity.ok(liveActivityService.getLiveActivity(userId, guildId));
    }

    @GetMapping("/statistics")
    public ResponseEntity<TrackerStatistics> getStatistics() {
        return ResponseEntity.ok(sessionTracker.getStatistics());
    }
}
