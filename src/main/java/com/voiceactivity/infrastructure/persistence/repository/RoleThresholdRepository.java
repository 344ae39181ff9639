package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.RoleThresholdEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoleThresholdRepository extends JpaRepository<RoleThresholdEntity, Long> {

    List<RoleThresholdEntity> findByGuildId(String guildId);

    Optional<RoleThresholdEntity> findByGuildIdAndRoleName(String guildId, String roleName);
}
