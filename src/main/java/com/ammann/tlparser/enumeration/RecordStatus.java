/* (C)2026 */
package com.ammann.tlparser.enumeration;

/**
 * Outcome of computing the statistics of one dataset row.
 * <p>
 * A row is either OK with a complete statistics record or FAILED with an error and no
 * statistics at all.
 */
public enum RecordStatus {
    /** Statistics computed */
    OK,
    /** Formula rejected or processing did not finish */
    FAILED
}
