package com.voiceactivity.infrastructure.directory;

import com.voiceactivity.domain.model.GuildMember;

import java.util.List;

/**
 * Platform membership lookups.
 */
public interface MemberDirectory {

    /**
     * Members of a guild, restricted to holders of {@code roleFilter} when it is not null.
     */
    List<GuildMember> findMembers(String guildId, String roleFilter);

    /**
     * Display name of a member; the raw user id when unknown or on lookup failure.
     */
    String displayName(String guildId, String userId);
}
