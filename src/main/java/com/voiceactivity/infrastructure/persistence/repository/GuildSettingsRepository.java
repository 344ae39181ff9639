package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.GuildSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GuildSettingsRepository extends JpaRepository<GuildSettingsEntity, String> {
}
