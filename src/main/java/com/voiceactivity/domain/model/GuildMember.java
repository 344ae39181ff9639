package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuildMember {

    private String userId;
    private String displayName;

    @Builder.Default
    private Set<String> roles = new HashSet<>();

    /** Display name, or the raw id when the directory had none. */
    public String label() {
        return displayName == null || displayName.isBlank() ? userId : displayName;
    }
}
