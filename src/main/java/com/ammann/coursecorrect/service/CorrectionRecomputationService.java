/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.enumeration.JobStatus;
import com.ammann.coursecorrect.exception.InsufficientDataException;
import com.ammann.coursecorrect.model.BaselineSelection;
import com.ammann.coursecorrect.model.CorrectionEntry;
import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.model.CorrectionTable;
import com.ammann.coursecorrect.model.RaceResult;
import com.ammann.coursecorrect.model.ResultRecord;
import com.ammann.coursecorrect.model.VenueCorrection;
import com.ammann.coursecorrect.model.VenueGender;
import com.ammann.coursecorrect.model.VenueStat;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rebuilds the correction table from the stored results and publishes it.
 *
 * <p>A recomputation runs the batch stages (quality filter, aggregation, baseline selection,
 * correction calculation) in memory and then, in one new transaction, writes the entries and
 * marks the run COMPLETED. Only after that commit is the new table swapped into the
 * {@link CorrectionTableRegistry}. A failure at any stage marks the run FAILED and leaves the
 * previously published table untouched.
 *
 * <p>Transaction design: this service is not {@code @Transactional}. Each database write uses
 * {@link QuarkusTransaction#requiringNew()} so the run's RUNNING and FAILED states are
 * committed independently of the entries. Recomputations are serialized by a lock.
 */
@ApplicationScoped
public class CorrectionRecomputationService
{

    private static final Logger LOG = Logger.getLogger(CorrectionRecomputationService.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final QualityFilterService qualityFilter;
    private final VenueAggregationService aggregationService;
    private final BaselineSelectionService baselineSelection;
    private final CorrectionCalculationService calculationService;
    private final CorrectionTableRegistry registry;

    private final ReentrantLock recomputeLock = new ReentrantLock();

    @Inject MeterRegistry meterRegistry;

    private Counter completedCounter;
    private Counter failedCounter;

    @Inject
    public CorrectionRecomputationService(
            QualityFilterService qualityFilter,
            VenueAggregationService aggregationService,
            BaselineSelectionService baselineSelection,
            CorrectionCalculationService calculationService,
            CorrectionTableRegistry registry)
    {
        this.qualityFilter = qualityFilter;
        this.aggregationService = aggregationService;
        this.baselineSelection = baselineSelection;
        this.calculationService = calculationService;
        this.registry = registry;
    }

    @PostConstruct
    void initMetrics()
    {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - recomputation metrics disabled");
            return;
        }
        completedCounter = Counter.builder("course_correct_recomputations_total")
                .description("Correction table recomputations")
                .tag("outcome", "completed")
                .register(meterRegistry);
        failedCounter = Counter.builder("course_correct_recomputations_total")
                .description("Correction table recomputations")
                .tag("outcome", "failed")
                .register(meterRegistry);
    }

    /**
     * Recomputes the correction table from all stored results and publishes it.
     *
     * @param referenceVenue venue to force as baseline, or {@code null} for median selection
     * @return the COMPLETED run
     * @throws com.ammann.coursecorrect.exception.NoEligibleBaselineException if no baseline can be chosen
     */
    public CorrectionRun recompute(String referenceVenue)
    {
        recomputeLock.lock();
        try {
            return doRecompute(blankToNull(referenceVenue));
        } finally {
            recomputeLock.unlock();
        }
    }

    private CorrectionRun doRecompute(String referenceVenue)
    {
        LOG.infof("Starting correction recomputation (reference=%s)", referenceVenue);
        long start = System.currentTimeMillis();

        Long runId = QuarkusTransaction.requiringNew().call(() -> createAndPersistRun(referenceVenue));

        try {
            List<ResultRecord> records = QuarkusTransaction.requiringNew().call(this::loadRecords);
            Computation computation = compute(records, referenceVenue);

            Instant completedAt = QuarkusTransaction.requiringNew().call(() -> persistAndComplete(runId, computation));

            CorrectionTable table = new CorrectionTable(
                    runId,
                    computation.baseline().venue(),
                    computation.baseline().medianByGender(),
                    computation.entries(),
                    completedAt);
            registry.publish(table);
            increment(completedCounter);

            LOG.infof("Correction run %d completed in %dms: baseline=%s entries=%d retained=%d/%d skipped=%d",
                    runId, System.currentTimeMillis() - start, table.getBaselineVenue(), table.size(),
                    computation.retainedCount(), computation.recordCount(), computation.skippedGroups());

            return QuarkusTransaction.requiringNew().call(() -> CorrectionRun.<CorrectionRun>findById(runId));

        } catch (RuntimeException e) {
            LOG.errorf(e, "Correction run %d failed", runId);
            QuarkusTransaction.requiringNew().run(() -> markFailed(runId, e));
            increment(failedCounter);
            throw e;
        }
    }

    /**
     * Runs the batch stages over a record set without touching the database or the registry.
     *
     * @param records        unfiltered records of all venues and genders
     * @param referenceVenue venue to force as baseline, or {@code null}
     * @return selection, entries and counters of the computation
     */
    public Computation compute(Collection<ResultRecord> records, String referenceVenue)
    {
        Map<VenueGender, List<ResultRecord>> groups = qualityFilter.filterAll(records);

        List<VenueStat> stats = new ArrayList<>();
        int retained = 0;
        int skipped = 0;
        for (Map.Entry<VenueGender, List<ResultRecord>> group : groups.entrySet()) {
            try {
                stats.add(aggregationService.aggregateGroup(
                        group.getKey().venue(), group.getKey().gender(), group.getValue()));
                retained += group.getValue().size();
            } catch (InsufficientDataException e) {
                LOG.warnf("Skipping %s/%s: no records left after quality filtering",
                        group.getKey().venue(), group.getKey().gender());
                skipped++;
            }
        }

        BaselineSelection baseline = baselineSelection.select(stats, referenceVenue);
        List<CorrectionEntry> entries = calculationService.calculate(stats, baseline);

        return new Computation(baseline, entries, records.size(), retained, skipped);
    }

    /**
     * Publishes the latest COMPLETED run from the database, if there is one.
     *
     * @return the published table
     */
    public Optional<CorrectionTable> loadLatestCompleted()
    {
        Optional<CorrectionTable> table = QuarkusTransaction.requiringNew().call(this::readLatestCompleted);
        table.ifPresentOrElse(
                registry::publish,
                () -> LOG.info("No completed correction run found"));
        return table;
    }

    /**
     * Returns the most recent runs, newest first.
     */
    public List<CorrectionRun> getRecentRuns(int limit)
    {
        return CorrectionRun.findRecent(limit);
    }

    private Optional<CorrectionTable> readLatestCompleted()
    {
        return CorrectionRun.findLatestCompleted().map(run -> {
            List<CorrectionEntry> entries = VenueCorrection.findByRunId(run.id).stream()
                    .map(VenueCorrection::toEntry)
                    .toList();
            Map<Gender, Double> medians = new EnumMap<>(Gender.class);
            medians.put(Gender.M, run.baselineMedianMen);
            medians.put(Gender.W, run.baselineMedianWomen);
            LOG.infof("Loaded correction run %d (baseline=%s, %d entries)", run.id, run.baselineVenue, entries.size());
            return new CorrectionTable(run.id, run.baselineVenue, medians, entries, run.completedAt);
        });
    }

    // -------------------------------------------------------------------------
    // Run lifecycle helpers
    // -------------------------------------------------------------------------

    private List<ResultRecord> loadRecords()
    {
        return RaceResult.<RaceResult>listAll().stream()
                .map(RaceResult::toRecord)
                .toList();
    }

    private Long createAndPersistRun(String referenceVenue)
    {
        CorrectionRun run = new CorrectionRun();
        run.status = JobStatus.RUNNING;
        run.requestedReferenceVenue = referenceVenue;
        run.createdAt = Instant.now();
        run.persist();
        LOG.debugf("Created correction run id=%d", run.id);
        return run.id;
    }

    private Instant persistAndComplete(Long runId, Computation computation)
    {
        CorrectionRun run = CorrectionRun.findById(runId);
        if (run == null) {
            throw new IllegalStateException("Correction run " + runId + " disappeared before completion");
        }

        for (CorrectionEntry entry : computation.entries()) {
            VenueCorrection.from(runId, entry).persist();
        }

        Instant completedAt = Instant.now();
        run.status = JobStatus.COMPLETED;
        run.completedAt = completedAt;
        run.baselineVenue = computation.baseline().venue();
        run.baselineMedianMen = computation.baseline().medianFor(Gender.M);
        run.baselineMedianWomen = computation.baseline().medianFor(Gender.W);
        run.recordCount = computation.recordCount();
        run.retainedCount = computation.retainedCount();
        run.entryCount = computation.entries().size();
        run.skippedGroups = computation.skippedGroups();
        run.persist();
        return completedAt;
    }

    private void markFailed(Long runId, Exception e)
    {
        CorrectionRun run = CorrectionRun.findById(runId);
        if (run == null) return;
        run.status = JobStatus.FAILED;
        run.completedAt = Instant.now();
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        run.errorMessage = message.length() > MAX_ERROR_MESSAGE_LENGTH
                ? message.substring(0, MAX_ERROR_MESSAGE_LENGTH)
                : message;
        run.persist();
    }

    private void increment(Counter counter)
    {
        if (counter != null) {
            counter.increment();
        }
    }

    private static String blankToNull(String value)
    {
        return value == null || value.isBlank() ? null : value.strip();
    }

    /**
     * In-memory outcome of the batch stages.
     *
     * @param baseline      selected baseline and its medians
     * @param entries       one entry per venue/gender with data
     * @param recordCount   records read
     * @param retainedCount records that survived quality filtering
     * @param skippedGroups groups emptied by quality filtering
     */
    public record Computation(
            BaselineSelection baseline,
            List<CorrectionEntry> entries,
            int recordCount,
            int retainedCount,
            int skippedGroups) {}
}
