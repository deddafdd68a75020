package com.player.matching.bulk;

import com.player.matching.core.model.PlayerRecord;

import java.util.List;

/**
 * Result of loading a player file.
 *
 * @param players loaded records in input order
 * @param errors  rows that were skipped
 */
public record ImportResult(
        List<PlayerRecord> players,
        List<ImportError> errors
) {
    public ImportResult {
        players = players != null ? List.copyOf(players) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /**
     * Number of data records seen, loaded or skipped.
     */
    public long totalRecords() {
        return (long) players.size() + errors.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Represents a record that could not be loaded.
     *
     * @param lineNumber the line number in the input (1-based), or element index for JSON arrays
     * @param rawInput   the raw input of the record
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String rawInput, String message) {}

    @Override
    public String toString() {
        return "ImportResult{players=" + players.size() +
                ", errors=" + errors.size() + '}';
    }
}
