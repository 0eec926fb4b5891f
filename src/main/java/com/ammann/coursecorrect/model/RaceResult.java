/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Gender;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A cleaned finish time stored for correction runs and distribution views.
 */
@Entity
@Table(name = RaceResult.TABLE_NAME, indexes = {
        @Index(name = "idx_venue_gender", columnList = "venue, gender")
})
public class RaceResult extends PanacheEntity
{
    public static final String TABLE_NAME = "race_results";

    @Column(nullable = false, length = 128)
    @NotBlank
    public String venue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 1)
    @NotNull
    public Gender gender;

    /**
     * Finish time in seconds. Primary field for every statistic.
     */
    @Column(name = "finish_seconds", nullable = false)
    @NotNull
    @Positive(message = "Finish time must be positive")
    public Double finishSeconds;

    /**
     * Finish time as published by the event, kept for display and debugging.
     */
    @Column(name = "finish_time", length = 32)
    public String finishTime;

    @Column(name = "ingested_at", nullable = false)
    public Instant ingestedAt = Instant.now();

    public RaceResult() {
    }

    public RaceResult(String venue, Gender gender, double finishSeconds) {
        this.venue = venue;
        this.gender = gender;
        this.finishSeconds = finishSeconds;
    }

    public ResultRecord toRecord() {
        return new ResultRecord(venue, gender, finishSeconds);
    }

    /**
     * Returns stored results ordered by venue, gender and finish time.
     *
     * @param venue  optional venue filter
     * @param gender optional gender filter
     * @param limit  maximum number of rows
     */
    public static List<RaceResult> findByVenueAndGender(String venue, Gender gender, int limit) {
        List<String> conditions = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        if (venue != null) {
            conditions.add("venue = :venue");
            params.put("venue", venue);
        }
        if (gender != null) {
            conditions.add("gender = :gender");
            params.put("gender", gender);
        }
        String where = conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + " ";
        return find("FROM RaceResult " + where + "ORDER BY venue, gender, finishSeconds", params)
                .page(0, limit)
                .list();
    }

    /**
     * Returns all stored results of the given genders and venues; an empty set selects all.
     */
    public static List<RaceResult> findSelection(Set<Gender> genders, Set<String> venues) {
        List<String> conditions = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        if (genders != null && !genders.isEmpty()) {
            conditions.add("gender IN :genders");
            params.put("genders", genders);
        }
        if (venues != null && !venues.isEmpty()) {
            conditions.add("venue IN :venues");
            params.put("venues", venues);
        }
        if (conditions.isEmpty()) {
            return listAll();
        }
        return list(String.join(" AND ", conditions), params);
    }

    public static List<String> findVenueNames() {
        return getEntityManager()
                .createQuery("SELECT DISTINCT r.venue FROM RaceResult r ORDER BY r.venue", String.class)
                .getResultList();
    }
}
