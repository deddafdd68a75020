package com.player.matching.bulk;

/**
 * Result of a report export.
 *
 * @param rowsWritten number of result rows written, excluding the header
 */
public record ExportResult(long rowsWritten) {
    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + '}';
    }
}
