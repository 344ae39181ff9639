package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.WeeklyActivityEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface WeeklyActivityRepository extends JpaRepository<WeeklyActivityEntity, Long> {

    Optional<WeeklyActivityEntity> findByUserIdAndGuildIdAndWeekStart(
            String userId, String guildId, LocalDate weekStart);

    @Query("SELECT SUM(w.totalTimeMs) FROM WeeklyActivityEntity w WHERE " +
           "w.userId = :userId AND w.guildId = :guildId AND " +
           "w.weekStart BETWEEN :firstWeek AND :lastWeek")
    Long sumTotalTime(
            @Param("userId") String userId,
            @Param("guildId") String guildId,
            @Param("firstWeek") LocalDate firstWeek,
            @Param("lastWeek") LocalDate lastWeek
    );

    @Query("SELECT w.userId, SUM(w.totalTimeMs) FROM WeeklyActivityEntity w WHERE " +
           "w.guildId = :guildId AND w.userId IN :userIds AND " +
           "w.weekStart BETWEEN :firstWeek AND :lastWeek " +
           "GROUP BY w.userId")
    List<Object[]> sumTotalTimeByUser(
            @Param("userIds") Collection<String> userIds,
            @Param("guildId") String guildId,
            @Param("firstWeek") LocalDate firstWeek,
            @Param("lastWeek") LocalDate lastWeek
    );

    long deleteByUserIdAndGuildId(String userId, String guildId);
}
