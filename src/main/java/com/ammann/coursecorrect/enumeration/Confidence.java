/* (C)2026 */
package com.ammann.coursecorrect.enumeration;

/**
 * Advisory reliability flag of a correction entry, derived from its sample size.
 *
 * <p>A {@link #LOW} entry is still used for conversion; the flag only informs display.
 */
public enum Confidence {
    NORMAL,
    LOW;

    /**
     * Classifies a sample size against the low-confidence threshold.
     *
     * @param sampleCount number of filtered records behind the entry
     * @param lowConfidenceThreshold sample counts below this value are {@link #LOW}
     * @return the confidence for the sample
     */
    public static Confidence fromSampleCount(int sampleCount, int lowConfidenceThreshold) {
        return sampleCount < lowConfidenceThreshold ? LOW : NORMAL;
    }
}
