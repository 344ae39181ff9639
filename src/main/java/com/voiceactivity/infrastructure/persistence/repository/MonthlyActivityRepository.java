package com.voiceactivity.infrastructure.persistence.repository;

import com.voiceactivity.infrastructure.persistence.entity.MonthlyActivityEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MonthlyActivityRepository extends JpaRepository<MonthlyActivityEntity, Long> {

    Optional<MonthlyActivityEntity> findByUserIdAndGuildIdAndActivityMonth(
            String userId, String guildId, LocalDate activityMonth);

    @Query("SELECT SUM(m.totalTimeMs) FROM MonthlyActivityEntity m WHERE " +
           "m.userId = :userId AND m.guildId = :guildId AND " +
           "m.activityMonth BETWEEN :firstMonth AND :lastMonth")
    Long sumTotalTime(
            @Param("userId") String userId,
            @Param("guildId") String guildId,
            @Param("firstMonth") LocalDate firstMonth,
            @Param("lastMonth") LocalDate lastMonth
    );

    @Query("SELECT m.userId, SUM(m.totalTimeMs) FROM MonthlyActivityEntity m WHERE " +
           "m.guildId = :guildId AND m.userId IN :userIds AND " +
           "m.activityMonth BETWEEN :firstMonth AND :lastMonth " +
           "GROUP BY m.userId")
    List<Object[]> sumTotalTimeByUser(
            @Param("userIds") Collection<String> userIds,
            @Param("guildId") String guildId,
            @Param("firstMonth") LocalDate firstMonth,
            @Param("lastMonth") LocalDate lastMonth
    );

    long deleteByUserIdAndGuildId(String userId, String guildId);
}
