package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuildSettings {

    private String guildId;

    @Builder.Default
    private Set<String> fullyExcludedResources = new HashSet<>();

    @Builder.Default
    private Set<String> activityLimitedResources = new HashSet<>();

    private int activityThresholdHours;

    public ExclusionPolicy toExclusionPolicy() {
        return new ExclusionPolicy(new HashSet<>(fullyExcludedResources), new HashSet<>(activityLimitedResources));
    }
}
