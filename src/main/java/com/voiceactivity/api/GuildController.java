package com.voiceactivity.api;

import com.voiceactivity.domain.model.GuildMember;
import com.voiceactivity.domain.model.GuildSettings;
import com.voiceactivity.domain.service.GuildSettingsService;
import com.voiceactivity.infrastructure.directory.JpaMemberDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Minimal guild configuration and member sync, so cache invalidation has a trigger.
 *
 * Endpoints:
 * - GET /api/v1/guilds/{guildId}/settings
 * - PUT /api/v1/guilds/{guildId}/settings/exclusions
 * - PUT /api/v1/guilds/{guildId}/settings/threshold
 * - GET /api/v1/guilds/{guildId}/roles/thresholds
 * - PUT /api/v1/guilds/{guildId}/roles/{roleName}/threshold
 * - DELETE /api/v1/guilds/{guildId}/roles/{roleName}/threshold
 * - PUT /api/v1/guilds/{guildId}/members
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/guilds/{guildId}")
@RequiredArgsConstructor
public class GuildController {

    private final GuildSettingsService settingsService;
    private final JpaMemberDirectory memberDirectory;

    @GetMapping("/settings")
    public ResponseEntity<GuildSettings> getSettings(@PathVariable String guildId) {
        return ResponseEntity.ok(settingsService.getSettings(guildId));
    }

    @PutMapping("/settings/exclusions")
    public ResponseEntity<GuildSettings> updateExclusions(
            @PathVariable String guildId,
            @RequestBody Map<String, Set<String>> body) {

        log.info("Update exclusions: guild={}", guildId);
        return ResponseEntity.ok(settingsService.updateExclusions(
                guildId, body.get("fullyExcluded"), body.get("activityLimited")));
    }

    @PutMapping("/settings/threshold")
    public ResponseEntity<GuildSettings> updateThreshold(
            @PathVariable String guildId,
            @RequestBody Map<String, Integer> body) {

        Integer hours = body.get("hours");
        if (hours == null) {
            throw new IllegalArgumentException("hours is required");
        }
        log.info("Update activity threshold: guild={}, hours={}", guildId, hours);
        return ResponseEntity.ok(settingsService.updateActivityThreshold(guildId, hours));
    }

    @GetMapping("/roles/thresholds")
    public ResponseEntity<Map<String, Integer>> getRoleThresholds(@PathVariable String guildId) {
        return ResponseEntity.ok(settingsService.getRoleThresholds(guildId));
    }

    @PutMapping("/roles/{roleName}/threshold")
    public ResponseEntity<Void> setRoleThreshold(
            @PathVariable String guildId,
            @PathVariable String roleName,
            @RequestBody Map<String, Integer> body) {

        Integer hours = body.get("minHours");
        if (hours == null) {
            throw new IllegalArgumentException("minHours is required");
        }
        settingsService.setRoleThreshold(guildId, roleName, hours);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/roles/{roleName}/threshold")
    public ResponseEntity<Map<String, Object>> removeRoleThreshold(
            @PathVariable String guildId,
            @PathVariable String roleName) {

        boolean removed = settingsService.removeRoleThreshold(guildId, roleName);
        return ResponseEntity.ok(Map.of("roleName", roleName, "removed", removed));
    }

    @PutMapping("/members")
    public ResponseEntity<Map<String, Object>> syncMembers(
            @PathVariable String guildId,
            @RequestBody List<GuildMember> members) {

        log.info("Member sync: guild={}, members={}", guildId, members.size());
        int written = memberDirectory.syncMembers(guildId, members);
        return ResponseEntity.ok(Map.of("guildId", guildId, "synced", written));
    }
}
