package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.CompletedSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CompletedSessionRepository extends JpaRepository<CompletedSessionEntity, Long> {

    boolean existsByUserIdAndGuildIdAndResourceIdAndStartTime(
            String userId, String guildId, String resourceId, Instant startTime);

    List<CompletedSessionEntity> findByUserIdAndGuildIdOrderByStartTimeAsc(String userId, String guildId);

    long deleteByUserIdAndGuildId(String userId, String guildId);
}
