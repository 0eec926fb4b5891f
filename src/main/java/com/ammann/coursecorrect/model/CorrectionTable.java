/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.UnknownVenueException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Immutable snapshot of one completed correction run.
 *
 * <p>A table is never modified after construction. Recomputation builds a new table and
 * publishes it by replacing the reference held by the registry, so a reader holding a table
 * always sees one consistent run.
 */
public final class CorrectionTable {

    private final Long runId;
    private final String baselineVenue;
    private final Map<Gender, Double> baselineMedians;
    private final Map<VenueGender, CorrectionEntry> entries;
    private final Instant computedAt;

    public CorrectionTable(
            Long runId,
            String baselineVenue,
            Map<Gender, Double> baselineMedians,
            List<CorrectionEntry> entries,
            Instant computedAt) {
        this.runId = runId;
        this.baselineVenue = baselineVenue;
        this.baselineMedians = Collections.unmodifiableMap(new EnumMap<>(baselineMedians));
        this.computedAt = computedAt;

        Map<VenueGender, CorrectionEntry> byKey = new LinkedHashMap<>();
        entries.stream()
                .sorted((a, b) -> VenueGender.NATURAL_ORDER.compare(a.key(), b.key()))
                .forEach(
                        entry -> {
                            if (byKey.put(entry.key(), entry) != null) {
                                throw new IllegalArgumentException(
                                        "Duplicate correction entry for " + entry.key());
                            }
                        });
        this.entries = Collections.unmodifiableMap(byKey);
    }

    public Long getRunId() {
        return runId;
    }

    public String getBaselineVenue() {
        return baselineVenue;
    }

    public Map<Gender, Double> getBaselineMedians() {
        return baselineMedians;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    /** All entries ordered by venue name, then gender. */
    public List<CorrectionEntry> getEntries() {
        return new ArrayList<>(entries.values());
    }

    public Optional<CorrectionEntry> find(String venue, Gender gender) {
        return Optional.ofNullable(entries.get(new VenueGender(venue, gender)));
    }

    /**
     * Returns the entry for a venue/gender.
     *
     * @throws UnknownVenueException if the table has no such entry
     */
    public CorrectionEntry require(String venue, Gender gender) {
        return find(venue, gender).orElseThrow(() -> new UnknownVenueException(venue, gender));
    }

    /** Distinct venue names, sorted. */
    public List<String> getVenues() {
        TreeSet<String> venues = new TreeSet<>();
        entries.keySet().forEach(key -> venues.add(key.venue()));
        return new ArrayList<>(venues);
    }

    public int size() {
        return entries.size();
    }
}
