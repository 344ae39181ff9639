package com.voiceactivity.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Members split into active, inactive and AFK buckets.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClassifiedUsers {

    private static final Comparator<UserActivityEntry> BY_TIME_DESC =
            Comparator.comparingLong(UserActivityEntry::getTotalTimeMs).reversed()
                    .thenComparing(UserActivityEntry::getUserId);

    private List<UserActivityEntry> active = new ArrayList<>();
    private List<UserActivityEntry> inactive = new ArrayList<>();
    private List<UserActivityEntry> afk = new ArrayList<>();

    public void addAll(ClassifiedUsers other) {
        active.addAll(other.getActive());
        inactive.addAll(other.getInactive());
        afk.addAll(other.getAfk());
    }

    public void sortByTimeDescending() {
        active.sort(BY_TIME_DESC);
        inactive.sort(BY_TIME_DESC);
        afk.sort(BY_TIME_DESC);
    }

    public int size() {
        return active.size() + inactive.size() + afk.size();
    }

    /**
     * Sorted copy with each bucket truncated for a preview.
     */
    public ClassifiedUsers preview(int activeLimit, int otherLimit) {
        ClassifiedUsers copy = new ClassifiedUsers(new ArrayList<>(active), new ArrayList<>(inactive), new ArrayList<>(afk));
        copy.sortByTimeDescending();
        return new ClassifiedUsers(
                new ArrayList<>(copy.getActive().subList(0, Math.min(activeLimit, copy.getActive().size()))),
                new ArrayList<>(copy.getInactive().subList(0, Math.min(otherLimit, copy.getInactive().size()))),
                new ArrayList<>(copy.getAfk().subList(0, Math.min(otherLimit, copy.getAfk().size()))));
    }
}
