/* (C)2026 */
package com.ammann.coursecorrect.service;

import com.ammann.coursecorrect.exception.CorrectionTableUnavailableException;
import com.ammann.coursecorrect.model.CorrectionTable;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published correction table.
 *
 * <p>The table itself is immutable; publishing a new run replaces the reference in a single
 * atomic step. Readers fetch the reference once per request and work on that snapshot, so they
 * see either the complete previous table or the complete new one.
 */
@ApplicationScoped
public class CorrectionTableRegistry
{

    private static final Logger LOG = Logger.getLogger(CorrectionTableRegistry.class);

    private final AtomicReference<CorrectionTable> current = new AtomicReference<>();

    /**
     * Publishes a table, replacing the previous one.
     *
     * @param table fully built table
     * @return the table that was replaced, if any
     */
    public Optional<CorrectionTable> publish(CorrectionTable table)
    {
        if (table == null) {
            throw new IllegalArgumentException("Cannot publish a null correction table");
        }
        CorrectionTable previous = current.getAndSet(table);
        LOG.infof("Published correction table run=%s baseline=%s entries=%d (previous run=%s)",
                table.getRunId(), table.getBaselineVenue(), table.size(),
                previous != null ? previous.getRunId() : null);
        return Optional.ofNullable(previous);
    }

    public Optional<CorrectionTable> current()
    {
        return Optional.ofNullable(current.get());
    }

    /**
     * Returns the published table.
     *
     * @throws CorrectionTableUnavailableException if nothing has been published yet
     */
    public CorrectionTable require()
    {
        CorrectionTable table = current.get();
        if (table == null) {
            throw new CorrectionTableUnavailableException();
        }
        return table;
    }

    public boolean isPublished()
    {
        return current.get() != null;
    }
}
