/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.dto.DistributionResponseDTO;
import com.ammann.coursecorrect.dto.HistogramBucketDTO;
import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.ValidationException;
import com.ammann.coursecorrect.model.RaceResult;
import com.ammann.coursecorrect.model.ResultRecord;
import com.ammann.coursecorrect.model.VenueGender;
import com.ammann.coursecorrect.model.VenueStat;
import com.ammann.coursecorrect.time.FinishTimes;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the analysis views over the stored results: finish time histograms and per-venue
 * statistics.
 *
 * <p>Quality filtering is applied per venue/gender group before anything is counted, so the
 * views describe exactly the population the corrections are derived from. The histogram spans
 * the quality bounds with fixed-width bins; a time equal to the upper bound is counted in the
 * last bin.
 */
@ApplicationScoped
public class DistributionService
{

    private static final Logger LOG = Logger.getLogger(DistributionService.class);

    public static final double DEFAULT_BIN_WIDTH_SECONDS = 300.0;
    public static final int MAX_BIN_COUNT = 1000;

    private final QualityFilterService qualityFilter;
    private final VenueAggregationService aggregationService;

    @ConfigProperty(name = "course-correct.distribution.bin-width-seconds", defaultValue = "300")
    double defaultBinWidthSeconds = DEFAULT_BIN_WIDTH_SECONDS;

    @Inject
    public DistributionService(QualityFilterService qualityFilter, VenueAggregationService aggregationService)
    {
        this.qualityFilter = qualityFilter;
        this.aggregationService = aggregationService;
    }

    /**
     * Histogram of the stored results.
     *
     * @param genders  genders to include, empty for all
     * @param venues   venues to include, empty for all
     * @param binWidth bin width in seconds, {@code null} for the configured default
     */
    public DistributionResponseDTO distribution(Set<Gender> genders, Set<String> venues, Double binWidth)
    {
        List<ResultRecord> records = RaceResult.findSelection(genders, venues).stream()
                .map(RaceResult::toRecord)
                .toList();
        return distribution(records, genders, venues, binWidth);
    }

    /**
     * Histogram of the given records.
     *
     * @param records  unfiltered records
     * @param genders  genders to include, empty for all
     * @param venues   venues to include, empty for all
     * @param binWidth bin width in seconds, {@code null} for the configured default
     * @return ordered bins including empty ones, with the selection's median and percentiles
     * @throws ValidationException if the bin width is not positive or yields more than
     *         {@link #MAX_BIN_COUNT} bins
     */
    public DistributionResponseDTO distribution(
            Collection<ResultRecord> records, Set<Gender> genders, Set<String> venues, Double binWidth)
    {
        double width = binWidth != null ? binWidth : defaultBinWidthSeconds;
        if (!(width > 0) || Double.isInfinite(width)) {
            throw ValidationException.invalidParameter("binWidth", binWidth, "positive number of seconds");
        }
        double range = qualityFilter.getUpperBoundSeconds() - qualityFilter.getLowerBoundSeconds();
        if (range / width > MAX_BIN_COUNT) {
            throw ValidationException.invalidParameter(
                    "binWidth", width, "at least " + (range / MAX_BIN_COUNT) + " seconds (" + MAX_BIN_COUNT + " bins)");
        }

        Set<Gender> selectedGenders = genders == null || genders.isEmpty()
                ? EnumSet.allOf(Gender.class)
                : EnumSet.copyOf(genders);
        Set<String> selectedVenues = venues == null ? Set.of() : new TreeSet<>(venues);

        List<ResultRecord> selected = records.stream()
                .filter(r -> selectedGenders.contains(r.gender()))
                .filter(r -> selectedVenues.isEmpty() || selectedVenues.contains(r.venue()))
                .toList();

        double[] retained = qualityFilter.filterAll(selected).values().stream()
                .flatMap(List::stream)
                .mapToDouble(ResultRecord::finishSeconds)
                .sorted()
                .toArray();

        List<HistogramBucketDTO> bins = histogram(retained, width);

        Double median = null;
        SortedMap<Integer, Double> percentiles = null;
        if (retained.length > 0) {
            median = VenueAggregationService.median(retained);
            percentiles = new TreeMap<>();
            for (Integer cutPoint : VenueAggregationService.PERCENTILE_CUT_POINTS) {
                percentiles.put(cutPoint, VenueAggregationService.percentile(retained, cutPoint));
            }
        }

        LOG.debugf("Distribution over %d of %d records (genders=%s, venues=%s, binWidth=%.0fs)",
                retained.length, records.size(), selectedGenders, selectedVenues, width);

        return new DistributionResponseDTO(
                bins,
                retained.length,
                width,
                selectedGenders.stream().map(Gender::name).toList(),
                new ArrayList<>(selectedVenues),
                median,
                median != null ? FinishTimes.format(median) : null,
                percentiles);
    }

    /**
     * Per-venue statistics of the stored results.
     *
     * @param gender gender to include, {@code null} for both
     */
    public List<VenueStat> venueStatistics(Gender gender)
    {
        Set<Gender> genders = gender == null ? Set.of() : Set.of(gender);
        List<ResultRecord> records = RaceResult.findSelection(genders, Set.of()).stream()
                .map(RaceResult::toRecord)
                .toList();
        return venueStatistics(records, gender);
    }

    /**
     * Per-venue statistics of the given records, ordered by venue then gender. Groups emptied by
     * quality filtering produce no statistic.
     */
    public List<VenueStat> venueStatistics(Collection<ResultRecord> records, Gender gender)
    {
        List<ResultRecord> selected = records.stream()
                .filter(r -> gender == null || r.gender() == gender)
                .toList();
        Map<VenueGender, List<ResultRecord>> groups = qualityFilter.filterAll(selected);
        return aggregationService.aggregate(groups);
    }

    /**
     * Counts sorted values into bins of {@code width} seconds spanning the quality bounds.
     */
    List<HistogramBucketDTO> histogram(double[] values, double width)
    {
        double lower = qualityFilter.getLowerBoundSeconds();
        double upper = qualityFilter.getUpperBoundSeconds();
        int binCount = Math.max(1, (int) Math.ceil((upper - lower) / width - 1e-9));

        int[] counts = new int[binCount];
        for (double value : values) {
            int index = (int) Math.floor((value - lower) / width);
            // upper bound belongs to the last bin
            counts[Math.min(Math.max(index, 0), binCount - 1)]++;
        }

        List<HistogramBucketDTO> bins = new ArrayList<>(binCount);
        for (int i = 0; i < binCount; i++) {
            double start = lower + i * width;
            double end = Math.min(start + width, upper);
            bins.add(new HistogramBucketDTO(start, end, counts[i]));
        }
        return bins;
    }
}
