package com.voiceactivity.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.ExclusionPolicy;
import com.voiceactivity.domain.model.GuildSettings;
import com.voiceactivity.infrastructure.cache.ActivityCacheService;
import com.voiceactivity.infrastructure.persistence.entity.GuildSettingsEntity;
import com.voiceactivity.infrastructure.persistence.entity.RoleThresholdEntity;
import com.voiceactivity.infrastructure.persistence.repository.GuildSettingsRepository;
import com.voiceactivity.infrastructure.persistence.repository.RoleThresholdRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Guild settings and role thresholds with read-through caching (10 minutes).
 *
 * Cache keys:
 * - guild-settings:{guild}: exclusions and activity threshold
 * - role-threshold:{guild}:{role}: one rule
 * - role-threshold:{guild}:all: every rule of the guild
 *
 * A rule write invalidates its own key and the guild's "all" key. Threshold
 * writes also drop the guild's stored reports, which were classified with the
 * old thresholds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuildSettingsService implements GuildSettingsProvider {

    static final String SETTINGS_PREFIX = "guild-settings";
    static final String ROLE_PREFIX = "role-threshold";
    static final String ALL_RULES = "all";

    private static final TypeReference<Map<String, Integer>> RULES_TYPE = new TypeReference<>() {
    };

    private final GuildSettingsRepository settingsRepository;
    private final RoleThresholdRepository roleThresholdRepository;
    private final ActivityCacheService cacheService;
    private final ReportCacheService reportCacheService;
    private final AppProperties properties;

    public GuildSettings getSettings(String guildId) {
        String key = cacheService.generateCacheKey(SETTINGS_PREFIX, guildId);
        Optional<GuildSettings> cached = cacheService.get(key, GuildSettings.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        GuildSettings settings = settingsRepository.findById(guildId)
                .map(this::toModel)
                .orElseGet(() -> GuildSettings.builder()
                        .guildId(guildId)
                        .activityThresholdHours(properties.getGuild().getDefaultActivityThresholdHours())
                        .build());
        cacheService.set(key, settings, properties.getCache().getGuildSettingsTtl());
        return settings;
    }

    @Override
    public ExclusionPolicy getExclusionPolicy(String guildId) {
        return getSettings(guildId).toExclusionPolicy();
    }

    @Override
    public int getActivityThresholdHours(String guildId) {
        return getSettings(guildId).getActivityThresholdHours();
    }

    @Override
    public Map<String, Integer> getRoleThresholds(String guildId) {
        String key = cacheService.generateCacheKey(ROLE_PREFIX, guildId, ALL_RULES);
        Optional<Map<String, Integer>> cached = cacheService.get(key, RULES_TYPE);
        if (cached.isPresent()) {
            return cached.get();
        }

        Map<String, Integer> rules = new TreeMap<>();
        roleThresholdRepository.findByGuildId(guildId)
                .forEach(rule -> rules.put(rule.getRoleName(), rule.getMinHours()));
        cacheService.set(key, rules, properties.getCache().getGuildSettingsTtl());
        return rules;
    }

    public Optional<Integer> getRoleMinHours(String guildId, String roleName) {
        String key = cacheService.generateCacheKey(ROLE_PREFIX, guildId, roleName);
        Optional<Integer> cached = cacheService.get(key, Integer.class);
        if (cached.isPresent()) {
            return cached.get() < 0 ? Optional.empty() : cached;
        }

        Optional<Integer> minHours = roleThresholdRepository.findByGuildIdAndRoleName(guildId, roleName)
                .map(RoleThresholdEntity::getMinHours);
        // -1 marks "no rule" so misses are cached too
        cacheService.set(key, minHours.orElse(-1), properties.getCache().getGuildSettingsTtl());
        return minHours;
    }

    @Transactional
    public GuildSettings updateExclusions(String guildId, Set<String> fullyExcluded, Set<String> activityLimited) {
        GuildSettingsEntity entity = loadOrCreate(guildId);
        entity.setFullyExcludedResources(sorted(fullyExcluded));
        entity.setActivityLimitedResources(sorted(activityLimited));
        settingsRepository.save(entity);
        invalidateSettings(guildId);
        log.info("Updated exclusions for guild {}: {} fully excluded, {} activity limited",
                guildId, entity.getFullyExcludedResources().size(), entity.getActivityLimitedResources().size());
        return toModel(entity);
    }

    @Transactional
    public GuildSettings updateActivityThreshold(String guildId, int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("Activity threshold must be positive: " + hours);
        }
        GuildSettingsEntity entity = loadOrCreate(guildId);
        entity.setActivityThresholdHours(hours);
        settingsRepository.save(entity);
        invalidateSettings(guildId);
        invalidateReports(guildId);
        log.info("Updated activity threshold for guild {}: {}h", guildId, hours);
        return toModel(entity);
    }

    @Transactional
    public void setRoleThreshold(String guildId, String roleName, int minHours) {
        if (minHours < 0) {
            throw new IllegalArgumentException("Role threshold must not be negative: " + minHours);
        }
        RoleThresholdEntity rule = roleThresholdRepository.findByGuildIdAndRoleName(guildId, roleName)
                .orElseGet(() -> RoleThresholdEntity.builder()
                        .guildId(guildId)
                        .roleName(roleName)
                        .build());
        rule.setMinHours(minHours);
        roleThresholdRepository.save(rule);
        invalidateRole(guildId, roleName);
        invalidateReports(guildId);
        log.info("Set role threshold for guild {}: {} = {}h", guildId, roleName, minHours);
    }

    @Transactional
    public boolean removeRoleThreshold(String guildId, String roleName) {
        Optional<RoleThresholdEntity> rule = roleThresholdRepository.findByGuildIdAndRoleName(guildId, roleName);
        rule.ifPresent(roleThresholdRepository::delete);
        invalidateRole(guildId, roleName);
        if (rule.isPresent()) {
            invalidateReports(guildId);
        }
        return rule.isPresent();
    }

    private GuildSettingsEntity loadOrCreate(String guildId) {
        return settingsRepository.findById(guildId)
                .orElseGet(() -> GuildSettingsEntity.builder()
                        .guildId(guildId)
                        .activityThresholdHours(properties.getGuild().getDefaultActivityThresholdHours())
                        .build());
    }

    private void invalidateSettings(String guildId) {
        invalidate(cacheService.generateCacheKey(SETTINGS_PREFIX, guildId));
    }

    private void invalidateRole(String guildId, String roleName) {
        invalidate(cacheService.generateCacheKey(ROLE_PREFIX, guildId, roleName));
        invalidate(cacheService.generateCacheKey(ROLE_PREFIX, guildId, ALL_RULES));
    }

    private void invalidateReports(String guildId) {
        try {
            reportCacheService.invalidateGuild(guildId);
        } catch (RuntimeException e) {
            log.warn("Report invalidation failed for guild {}, reports expire with their TTL: {}",
                    guildId, e.getMessage());
        }
    }

    private void invalidate(String key) {
        try {
            cacheService.invalidate(key);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed for {}, entry expires with its TTL: {}", key, e.getMessage());
        }
    }

    private static Set<String> sorted(Set<String> ids) {
        Set<String> result = new TreeSet<>();
        if (ids != null) {
            result.addAll(ids);
        }
        return result;
    }

    private GuildSettings toModel(GuildSettingsEntity entity) {
        Integer hours = entity.getActivityThresholdHours();
        return GuildSettings.builder()
                .guildId(entity.getGuildId())
                .fullyExcludedResources(new HashSet<>(entity.getFullyExcludedResources()))
                .activityLimitedResources(new HashSet<>(entity.getActivityLimitedResources()))
                .activityThresholdHours(hours != null ? hours : properties.getGuild().getDefaultActivityThresholdHours())
                .build();
    }
}
