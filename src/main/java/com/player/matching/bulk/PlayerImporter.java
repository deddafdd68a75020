package com.player.matching.bulk;

import java.io.InputStream;
import java.io.Reader;

/**
 * Interface for loading player records from an external representation.
 * Implementations own every encoding and delimiter concern of their format.
 */
public interface PlayerImporter {

    /**
     * Loads players from an input stream, detecting the text encoding where the format allows.
     *
     * @param input    the input stream to read
     * @param callback optional progress callback
     * @return loaded players and skipped rows
     * @throws PlayerImportException if the input cannot be loaded at all
     */
    ImportResult importPlayers(InputStream input, ProgressCallback callback);

    /**
     * Loads players from already decoded text.
     *
     * @param reader   the reader to read
     * @param callback optional progress callback
     * @return loaded players and skipped rows
     * @throws PlayerImportException if the input cannot be loaded at all
     */
    ImportResult importPlayers(Reader reader, ProgressCallback callback);

    /**
     * Returns the format handled by this importer (e.g., "tsv", "json").
     */
    String getFormat();
}
