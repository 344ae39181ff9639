package com.voiceactivity.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voiceactivity.config.AppProperties;
import com.voiceactivity.domain.model.ExclusionPolicy;
import com.voiceactivity.domain.model.GuildSettings;
import com.voiceactivity.infrastructure.cache.ActivityCacheService;
import com.voiceactivity.infrastructure.cache.CacheStore;
import com.voiceactivity.infrastructure.cache.LocalCacheStore;
import com.voiceactivity.infrastructure.persistence.entity.GuildSettingsEntity;
import com.voiceactivity.infrastructure.persistence.entity.RoleThresholdEntity;
import com.voiceactivity.infrastructure.persistence.repository.GuildSettingsRepository;
import com.voiceactivity.infrastructure.persistence.repository.RoleThresholdRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GuildSettingsServiceTest {

    private static final String GUILD = "guild-1";

    @Mock
    private GuildSettingsRepository settingsRepository;

    @Mock
    private RoleThresholdRepository roleThresholdRepository;

    @Mock
    private ReportCacheService reportCacheService;

    private ActivityCacheService cacheService;
    private GuildSettingsService settingsService;

    @BeforeEach
    void setUp() {
        cacheService = new ActivityCacheService(new LocalCacheStore(100, Clock.systemUTC()),
                new ObjectMapper().findAndRegisterModules());
        settingsService = new GuildSettingsService(settingsRepository, roleThresholdRepository, cacheService,
                reportCacheService, new AppProperties());
    }

    @Test
    void testGetSettings_NoRow_DefaultThreshold() {
        // Given
        when(settingsRepository.findById(GUILD)).thenReturn(Optional.empty());

        // When
        GuildSettings settings = settingsService.getSettings(GUILD);

        // Then
        assertEquals(30, settings.getActivityThresholdHours());
        assertTrue(settings.getFullyExcludedResources().isEmpty());
    }

    @Test
    void testGetExclusionPolicy_ReadThroughCache() {
        // Given
        when(settingsRepository.findById(GUILD)).thenReturn(Optional.of(GuildSettingsEntity.builder()
                .guildId(GUILD)
                .fullyExcludedResources(new TreeSet<>(Set.of("afk")))
                .activityLimitedResources(new TreeSet<>(Set.of("music")))
                .activityThresholdHours(10)
                .build()));

        // When
        ExclusionPolicy first = settingsService.getExclusionPolicy(GUILD);
        ExclusionPolicy second = settingsService.getExclusionPolicy(GUILD);

        // Then
        assertTrue(first.isFullyExcluded("afk"));
        assertTrue(second.isActivityLimited("music"));
        assertTrue(second.accrues("general"));
        assertEquals(10, settingsService.getActivityThresholdHours(GUILD));
        verify(settingsRepository, times(1)).findById(GUILD);
    }

    @Test
    void testUpdateExclusions_InvalidatesSettingsKey() {
        // Given
        when(settingsRepository.findById(GUILD)).thenReturn(Optional.empty());
        settingsService.getExclusionPolicy(GUILD);

        // When
        settingsService.updateExclusions(GUILD, Set.of("afk"), Set.of());

        // Then
        assertTrue(cacheService.get("guild-settings:" + GUILD, GuildSettings.class).isEmpty());
        ArgumentCaptor<GuildSettingsEntity> saved = ArgumentCaptor.forClass(GuildSettingsEntity.class);
        verify(settingsRepository).save(saved.capture());
        assertEquals(Set.of("afk"), saved.getValue().getFullyExcludedResources());
        verifyNoInteractions(reportCacheService);
    }

    @Test
    void testUpdateActivityThreshold_InvalidatesGuildReports() {
        // Given
        when(settingsRepository.findById(GUILD)).thenReturn(Optional.empty());

        // When
        settingsService.updateActivityThreshold(GUILD, 12);

        // Then
        verify(reportCacheService).invalidateGuild(GUILD);
    }

    @Test
    void testUpdateActivityThreshold_ReportInvalidationFailure_WriteStillSucceeds() {
        // Given
        when(settingsRepository.findById(GUILD)).thenReturn(Optional.empty());
        when(reportCacheService.invalidateGuild(GUILD)).thenThrow(new RedisConnectionFailureException("down"));

        // When
        GuildSettings updated = settingsService.updateActivityThreshold(GUILD, 12);

        // Then
        assertEquals(12, updated.getActivityThresholdHours());
        verify(settingsRepository).save(any(GuildSettingsEntity.class));
    }

    @Test
    void testSetRoleThreshold_InvalidatesRoleAndAllKeys() {
        // Given: both lookups cached before the write
        RoleThresholdEntity rule = RoleThresholdEntity.builder().guildId(GUILD).roleName("Member").minHours(40).build();
        when(roleThresholdRepository.findByGuildIdAndRoleName(GUILD, "Member"))
                .thenReturn(Optional.empty(), Optional.empty(), Optional.of(rule));
        when(roleThresholdRepository.findByGuildId(GUILD)).thenReturn(List.of(), List.of(rule));

        assertTrue(settingsService.getRoleMinHours(GUILD, "Member").isEmpty());
        assertTrue(settingsService.getRoleThresholds(GUILD).isEmpty());
        assertTrue(settingsService.getRoleMinHours(GUILD, "Member").isEmpty());

        // When
        settingsService.setRoleThreshold(GUILD, "Member", 40);

        // Then
        assertEquals(Optional.of(40), settingsService.getRoleMinHours(GUILD, "Member"));
        assertEquals(Map.of("Member", 40), settingsService.getRoleThresholds(GUILD));
        verify(roleThresholdRepository, times(3)).findByGuildIdAndRoleName(GUILD, "Member");
        verify(roleThresholdRepository, times(2)).findByGuildId(GUILD);
        verify(reportCacheService).invalidateGuild(GUILD);
    }

    @Test
    void testRemoveRoleThreshold() {
        RoleThresholdEntity rule = RoleThresholdEntity.builder().guildId(GUILD).roleName("Member").minHours(40).build();
        when(roleThresholdRepository.findByGuildIdAndRoleName(GUILD, "Member")).thenReturn(Optional.of(rule));

        assertTrue(settingsService.removeRoleThreshold(GUILD, "Member"));

        verify(roleThresholdRepository).delete(rule);
        verify(reportCacheService).invalidateGuild(GUILD);
    }

    @Test
    void testRemoveRoleThreshold_NoRule_ReportsKept() {
        when(roleThresholdRepository.findByGuildIdAndRoleName(GUILD, "Member")).thenReturn(Optional.empty());

        assertFalse(settingsService.removeRoleThreshold(GUILD, "Member"));

        verifyNoInteractions(reportCacheService);
    }

    @Test
    void testUpdateActivityThreshold_NonPositive_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> settingsService.updateActivityThreshold(GUILD, 0));
        verifyNoInteractions(settingsRepository);
    }

    @Test
    void testUpdateActivityThreshold_InvalidationFailure_WriteStillSucceeds() {
        // Given
        CacheStore broken = mock(CacheStore.class);
        doThrow(new RedisConnectionFailureException("down")).when(broken).delete(anyString());
        GuildSettingsService service = new GuildSettingsService(settingsRepository, roleThresholdRepository,
                new ActivityCacheService(broken, new ObjectMapper()), reportCacheService, new AppProperties());
        when(settingsRepository.findById(GUILD)).thenReturn(Optional.empty());

        // When
        GuildSettings updated = service.updateActivityThreshold(GUILD, 12);

        // Then
        assertEquals(12, updated.getActivityThresholdHours());
        verify(settingsRepository).save(any(GuildSettingsEntity.class));
    }
}
