package com.voiceactivity.infrastructure.directory;

import com.voiceactivity.domain.model.GuildMember;
import com.voiceactivity.infrastructure.persistence.entity.GuildMemberEntity;
import com.voiceactivity.infrastructure.persistence.repository.GuildMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Member directory backed by the guild_members table, kept current by member sync.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaMemberDirectory implements MemberDirectory {

    private final GuildMemberRepository memberRepository;

    @Override
    @Transactional(readOnly = true)
    public List<GuildMember> findMembers(String guildId, String roleFilter) {
        return memberRepository.findByGuildIdOrderByUserIdAsc(guildId).stream()
                .filter(member -> roleFilter == null || member.getRoles().contains(roleFilter))
                .map(this::toModel)
                .toList();
    }

    @Override
    public String displayName(String guildId, String userId) {
        try {
            return memberRepository.findByGuildIdAndUserId(guildId, userId)
                    .map(GuildMemberEntity::getDisplayName)
                    .filter(name -> !name.isBlank())
                    .orElse(userId);
        } catch (RuntimeException e) {
            log.warn("Member lookup failed for {} in guild {}, showing raw id: {}", userId, guildId, e.getMessage());
            return userId;
        }
    }

    /**
     * Inserts or refreshes the given members.
     *
     * @return number of members written
     */
    @Transactional
    public int syncMembers(String guildId, List<GuildMember> members) {
        for (GuildMember member : members) {
            GuildMemberEntity entity = memberRepository.findByGuildIdAndUserId(guildId, member.getUserId())
                    .orElseGet(() -> GuildMemberEntity.builder()
                            .guildId(guildId)
                            .userId(member.getUserId())
                            .build());
            entity.setDisplayName(member.getDisplayName());
            Set<String> roles = member.getRoles() == null ? Set.of() : member.getRoles();
            entity.setRoles(new TreeSet<>(roles));
            memberRepository.save(entity);
        }
        log.info("Synced {} members for guild {}", members.size(), guildId);
        return members.size();
    }

    private GuildMember toModel(GuildMemberEntity entity) {
        return GuildMember.builder()
                .userId(entity.getUserId())
                .displayName(entity.getDisplayName())
                .roles(new HashSet<>(entity.getRoles()))
                .build();
    }
}
