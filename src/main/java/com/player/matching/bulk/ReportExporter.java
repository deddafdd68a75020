package com.player.matching.bulk;

import com.player.matching.core.model.MatchResult;

import java.io.OutputStream;
import java.io.Writer;
import java.util.List;

/**
 * Interface for writing match results in a specific format.
 */
public interface ReportExporter {

    /**
     * Exports results to an output stream.
     *
     * @param results  the results to write, in output order
     * @param output   the output stream to write to
     * @param callback optional progress callback
     * @return the export result
     */
    ExportResult exportResults(List<MatchResult> results, OutputStream output, ProgressCallback callback);

    /**
     * Exports results to a writer.
     *
     * @param results  the results to write, in output order
     * @param writer   the writer to write to
     * @param callback optional progress callback
     * @return the export result
     */
    ExportResult exportResults(List<MatchResult> results, Writer writer, ProgressCallback callback);

    /**
     * Returns the format produced by this exporter (e.g., "csv").
     */
    String getFormat();
}
