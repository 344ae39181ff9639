package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.DailyActivityEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Daily rollups. Also the source for recomputing weekly and monthly rows.
 */
@Repository
public interface DailyActivityRepository extends JpaRepository<DailyActivityEntity, Long> {

    Optional<DailyActivityEntity> findByUserIdAndGuildIdAndActivityDate(
            String userId, String guildId, LocalDate activityDate);

    List<DailyActivityEntity> findByUserIdAndGuildIdAndActivityDateBetween(
            String userId, String guildId, LocalDate start, LocalDate end);

    /**
     * Null when the user has no rows in range.
     */
    @Query("SELECT SUM(d.totalTimeMs) FROM DailyActivityEntity d WHERE " +
           "d.userId = :userId AND d.guildId = :guildId AND " +
           "d.activityDate BETWEEN :start AND :end")
    Long sumTotalTime(
            @Param("userId") String userId,
            @Param("guildId") String guildId,
            @Param("start") LocalDate start,
            @Param("end") LocalDate end
    );

    /**
     * One grouped query for many users: rows of [userId, totalTimeMs].
     */
    @Query("SELECT d.userId, SUM(d.totalTimeMs) FROM DailyActivityEntity d WHERE " +
           "d.guildId = :guildId AND d.userId IN :userIds AND " +
           "d.activityDate BETWEEN :start AND :end " +
           "GROUP BY d.userId")
    List<Object[]> sumTotalTimeByUser(
            @Param("userIds") Collection<String> userIds,
            @Param("guildId") String guildId,
            @Param("start") LocalDate start,
            @Param("end") LocalDate end
    );

    /**
     * Rows of [activityDate, distinct users, totalTimeMs] ordered by date.
     */
    @Query("SELECT d.activityDate, COUNT(DISTINCT d.userId), SUM(d.totalTimeMs) " +
           "FROM DailyActivityEntity d WHERE " +
           "d.guildId = :guildId AND d.activityDate BETWEEN :start AND :end " +
           "GROUP BY d.activityDate " +
           "ORDER BY d.activityDate ASC")
    List<Object[]> aggregateByDate(
            @Param("guildId") String guildId,
            @Param("start") LocalDate start,
            @Param("end") LocalDate end
    );

    long deleteByUserIdAndGuildId(String userId, String guildId);
}
