package com.example.cronhooks.repo;

import com.example.cronhooks.domain.PeriodicTrigger;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Optional;

@Repository
public interface PeriodicTriggerRepo extends JpaRepository<PeriodicTrigger, Long> {

    Optional<PeriodicTrigger> findByMinuteAndHourAndDayOfMonthAndMonthAndDayOfWeekAndTimezone(
            String minute, String hour, String dayOfMonth, String month, String dayOfWeek, String timezone);

    @Modifying
    @Query(value =
            "INSERT INTO periodic_trigger(" +
                    "  cron_minute, cron_hour, cron_day_of_month, cron_month, cron_day_of_week, tz_name, enabled, created_at" +
                    ") " +
                    "SELECT ?1, ?2, ?3, ?4, ?5, ?6, ?7, ?8 " +
                    "WHERE NOT EXISTS (SELECT 1 FROM periodic_trigger " +
                    "  WHERE cron_minute = ?1 AND cron_hour = ?2 AND cron_day_of_month = ?3 " +
                    "    AND cron_month = ?4 AND cron_day_of_week = ?5 AND tz_name = ?6)",
            nativeQuery = true)
    int insertIfNotExists(
            String minute,
            String hour,
            String dayOfMonth,
            String month,
            String dayOfWeek,
            String timezone,
            boolean enabled,
            Timestamp createdAt
    );

    @Modifying
    @Query("update PeriodicTrigger t set t.enabled = :enabled where t.id = :id")
    int updateEnabled(@Param("id") Long id, @Param("enabled") boolean enabled);
}
