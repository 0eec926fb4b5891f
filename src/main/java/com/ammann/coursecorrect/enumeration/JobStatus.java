/* (C)2026 */
package com.ammann.coursecorrect.enumeration;

/**
 * Status of a correction recomputation run.
 * <p>
 * A run is created RUNNING and ends as either COMPLETED or FAILED. Only COMPLETED runs are ever
 * published to readers.
 */
public enum JobStatus {
    /** Run is computing or persisting its entries */
    RUNNING,
    /** Run committed its entries and is eligible as the current table */
    COMPLETED,
    /** Run aborted; its entries (if any) were never committed */
    FAILED
}
