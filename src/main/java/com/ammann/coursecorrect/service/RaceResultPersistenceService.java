/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.dto.CorrectionRunDTO;
import com.ammann.coursecorrect.dto.IngestionResultDTO;
import com.ammann.coursecorrect.dto.ResultRecordDTO;
import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.ValidationException;
import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.model.RaceResult;
import com.ammann.coursecorrect.time.FinishTimes;
import com.ammann.coursecorrect.time.TimeParseResult;
import io.quarkus.hibernate.orm.panache.Panache;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores cleaned finish times and serves them back for inspection.
 *
 * <p>Ingestion is all-or-nothing: every row is validated before the first one is written, and
 * the rows are persisted in one transaction using the EntityManager flush/clear pattern to keep
 * memory bounded for large uploads.
 */
@ApplicationScoped
public class RaceResultPersistenceService {

    private static final Logger LOG = Logger.getLogger(RaceResultPersistenceService.class);
    private static final int FLUSH_BATCH_SIZE = 100;

    private final CorrectionRecomputationService recomputationService;

    @Inject
    public RaceResultPersistenceService(CorrectionRecomputationService recomputationService) {
        this.recomputationService = recomputationService;
    }

    /**
     * Validates and stores submitted results, optionally recomputing the corrections afterwards.
     *
     * @param records   submitted rows
     * @param recompute whether to rebuild the correction table once the rows are committed
     * @return counts and the triggered run, if any
     * @throws ValidationException if any row is invalid; nothing is stored in that case
     */
    public IngestionResultDTO ingest(List<ResultRecordDTO> records, boolean recompute) {
        if (records == null || records.isEmpty()) {
            throw ValidationException.invalidParameter("records", "[]", "at least one result record");
        }

        List<RaceResult> entities = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            entities.add(toEntity(i, records.get(i)));
        }

        int persisted = QuarkusTransaction.requiringNew().call(() -> persistAll(entities));
        long total = QuarkusTransaction.requiringNew().call(() -> RaceResult.count());

        CorrectionRunDTO run = null;
        if (recompute) {
            CorrectionRun completed = recomputationService.recompute(null);
            run = CorrectionRunDTO.from(completed);
        }

        return new IngestionResultDTO(records.size(), persisted, total, run);
    }

    /**
     * Stored results ordered by venue, gender and finish time.
     */
    public List<RaceResult> findResults(String venue, Gender gender, int limit) {
        return RaceResult.findByVenueAndGender(venue, gender, limit);
    }

    /**
     * Distinct venue names of the stored results, sorted.
     */
    public List<String> listVenueNames() {
        return RaceResult.findVenueNames();
    }

    private int persistAll(List<RaceResult> batch) {
        EntityManager em = Panache.getEntityManager();
        int count = 0;
        long startTime = System.currentTimeMillis();

        try {
            for (RaceResult result : batch) {
                em.persist(result);
                count++;

                if (count % FLUSH_BATCH_SIZE == 0) {
                    em.flush();
                    em.clear();
                    LOG.debugf("Flushed %d results to database", count);
                }
            }

            em.flush();

            long duration = System.currentTimeMillis() - startTime;
            LOG.infof("Persisted %d race results in %dms", count, duration);
            return count;

        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to persist batch after %d results", count);
            throw e;
        }
    }

    /**
     * Validates one submitted row and converts it to an entity.
     *
     * @throws ValidationException naming the row index on any violation
     */
    RaceResult toEntity(int index, ResultRecordDTO dto) {
        if (dto == null) {
            throw ValidationException.invalidRecord(index, "record is null");
        }
        if (dto.venue() == null || dto.venue().isBlank()) {
            throw ValidationException.invalidRecord(index, "venue must not be blank");
        }

        Gender gender;
        try {
            gender = Gender.fromCode(dto.gender());
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidRecord(index, e.getMessage());
        }

        double seconds;
        if (dto.finishSeconds() != null) {
            double value = dto.finishSeconds();
            if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
                throw ValidationException.invalidRecord(index, "finishSeconds must be positive: " + value);
            }
            seconds = value;
        } else if (dto.finishTime() != null) {
            TimeParseResult parsed = FinishTimes.parse(dto.finishTime());
            if (parsed instanceof TimeParseResult.Invalid invalid) {
                throw ValidationException.invalidRecord(
                        index, "finishTime '" + dto.finishTime() + "' rejected: " + invalid.reason());
            }
            seconds = parsed.orElseThrow();
        } else {
            throw ValidationException.invalidRecord(index, "either finishSeconds or finishTime is required");
        }

        RaceResult result = new RaceResult(dto.venue().strip(), gender, seconds);
        result.finishTime = dto.finishTime() != null ? dto.finishTime().strip() : null;
        result.ingestedAt = Instant.now();
        return result;
    }
}
