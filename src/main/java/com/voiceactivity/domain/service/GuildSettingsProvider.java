package com.voiceactivity.domain.service;

import com.voiceactivity.domain.model.ExclusionPolicy;

import java.util.Map;

/**
 * Read side of per-guild configuration.
 */
public interface GuildSettingsProvider {

    ExclusionPolicy getExclusionPolicy(String guildId);

    int getActivityThresholdHours(String guildId);

    /**
     * Role name to minimum hours, for every role with a rule in the guild.
     */
    Map<String, Integer> getRoleThresholds(String guildId);
}
