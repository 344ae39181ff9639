package com.voiceactivity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Per-guild resource policy, read at transition time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExclusionPolicy {

    private Set<String> fullyExcluded = new HashSet<>();
    private Set<String> activityLimited = new HashSet<>();

    public static ExclusionPolicy none() {
        return new ExclusionPolicy();
    }

    public boolean isFullyExcluded(String resourceId) {
        return resourceId != null && fullyExcluded.contains(resourceId);
    }

    public boolean isActivityLimited(String resourceId) {
        return resourceId != null && activityLimited.contains(resourceId);
    }

    /**
     * A resource accrues time unless it is excluded under either policy.
     */
    public boolean accrues(String resourceId) {
        return resourceId != null && !isFullyExcluded(resourceId) && !isActivityLimited(resourceId);
    }
}
