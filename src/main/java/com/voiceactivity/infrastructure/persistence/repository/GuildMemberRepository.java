package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.GuildMemberEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GuildMemberRepository extends JpaRepository<GuildMemberEntity, Long> {

    List<GuildMemberEntity> findByGuildIdOrderByUserIdAsc(String guildId);

    Optional<GuildMemberEntity> findByGuildIdAndUserId(String guildId, String userId);
}
