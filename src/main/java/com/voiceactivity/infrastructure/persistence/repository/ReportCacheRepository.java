package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.ReportCacheEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface ReportCacheRepository extends JpaRepository<ReportCacheEntity, String> {

    @Modifying
    @Query("DELETE FROM ReportCacheEntity r WHERE r.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    long deleteByGuildId(String guildId);
}
