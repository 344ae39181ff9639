package com.voiceactivity.infrastructure.directory;

import com.voiceactivity.domain.model.GuildMember;
import com.voiceactivity.infrastructure.persistence.repository.GuildMemberRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DataJpaTest
class JpaMemberDirectoryTest {

    private static final String GUILD = "guild-1";

    @Autowired
    private GuildMemberRepository memberRepository;

    private JpaMemberDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new JpaMemberDirectory(memberRepository);
    }

    @Test
    void testSyncMembers_ThenFindByRole() {
        // Given
        directory.syncMembers(GUILD, List.of(
                member("u2", "Bob", "Member"),
                member("u1", "Alice", "Member", "Admin"),
                member("u3", "Carol", "Guest")));

        // When
        List<GuildMember> everyone = directory.findMembers(GUILD, null);
        List<GuildMember> members = directory.findMembers(GUILD, "Member");

        // Then
        assertEquals(List.of("u1", "u2", "u3"), everyone.stream().map(GuildMember::getUserId).toList());
        assertEquals(List.of("u1", "u2"), members.stream().map(GuildMember::getUserId).toList());
        assertEquals(Set.of("Member", "Admin"), members.get(0).getRoles());
    }

    @Test
    void testSyncMembers_UpdatesExistingRow() {
        directory.syncMembers(GUILD, List.of(member("u1", "Alice", "Member")));

        directory.syncMembers(GUILD, List.of(member("u1", "Alice [관전]", "AFK")));

        assertEquals(1, memberRepository.count());
        assertEquals("Alice [관전]", directory.displayName(GUILD, "u1"));
        assertTrue(directory.findMembers(GUILD, "Member").isEmpty());
    }

    @Test
    void testDisplayName_UnknownMember_RawId() {
        assertEquals("u404", directory.displayName(GUILD, "u404"));
    }

    @Test
    void testDisplayName_LookupFailure_RawId() {
        GuildMemberRepository failing = mock(GuildMemberRepository.class);
        when(failing.findByGuildIdAndUserId(anyString(), anyString())).thenThrow(new IllegalStateException("db down"));

        assertEquals("u1", new JpaMemberDirectory(failing).displayName(GUILD, "u1"));
    }

    private static GuildMember member(String userId, String displayName, String... roles) {
        return GuildMember.builder()
                .userId(userId)
                .displayName(displayName)
                .roles(Set.of(roles))
                .build();
    }
}
