package com.voiceactivity.domain.service;

import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.GuildMember;
import com.voiceactivity.domain.model.report.ClassifiedUsers;
import com.voiceactivity.domain.model.report.UserActivityEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits members into active, inactive and AFK buckets.
 *
 * A member holding a role whose name contains an AFK keyword is AFK
 * regardless of time. Everyone else is active when their total reaches
 * the threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserClassificationService {

    private final ActivityQueryService queryService;
    private final GuildSettingsProvider settingsProvider;
    private final AppProperties properties;

    /**
     * Threshold precedence: explicit override, then the filtered role's rule,
     * then the guild threshold.
     */
    public long resolveThresholdMs(String guildId, String roleFilter, Integer overrideHours) {
        int hours;
        if (overrideHours != null) {
            hours = overrideHours;
        } else {
            Map<String, Integer> rules = roleFilter == null ? Map.of() : settingsProvider.getRoleThresholds(guildId);
            Integer roleHours = rules.get(roleFilter);
            hours = roleHours != null ? roleHours : settingsProvider.getActivityThresholdHours(guildId);
        }
        return Duration.ofHours(hours).toMillis();
    }

    public ClassifiedUsers classify(String guildId, List<GuildMember> members,
                                    LocalDate start, LocalDate end, long thresholdMs) {
        ClassifiedUsers result = new ClassifiedUsers();
        if (members.isEmpty()) {
            return result;
        }

        Map<String, Long> totals = queryService.getBatchActivity(
                members.stream().map(GuildMember::getUserId).toList(), guildId, start, end);

        for (GuildMember member : members) {
            UserActivityEntry entry = UserActivityEntry.builder()
                    .userId(member.getUserId())
                    .displayName(member.label())
                    .totalTimeMs(totals.getOrDefault(member.getUserId(), 0L))
                    .build();

            if (isAfk(member)) {
                result.getAfk().add(entry);
            } else if (entry.getTotalTimeMs() >= thresholdMs) {
                result.getActive().add(entry);
            } else {
                result.getInactive().add(entry);
            }
        }

        result.sortByTimeDescending();
        log.debug("Classified {} members in guild {}: {} active, {} inactive, {} afk", members.size(), guildId,
                result.getActive().size(), result.getInactive().size(), result.getAfk().size());
        return result;
    }

    boolean isAfk(GuildMember member) {
        if (member.getRoles() == null) {
            return false;
        }
        List<String> keywords = properties.getGuild().getAfkRoleKeywords();
        return member.getRoles().stream()
                .map(role -> role.toUpperCase(Locale.ROOT))
                .anyMatch(role -> keywords.stream().anyMatch(keyword -> role.contains(keyword.toUpperCase(Locale.ROOT))));
    }
}
