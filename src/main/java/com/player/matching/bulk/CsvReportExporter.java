package com.player.matching.bulk;

import com.player.matching.core.model.MatchResult;
import com.player.matching.core.model.PlayerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * CSV report exporter.
 * Writes one semicolon-separated row per match result, event columns first.
 *
 * <p>Output format:</p>
 * <pre>
 * Event_ExternID;Event_LastName;...;Ref_YoB;Match_Type;Confidence;Issues
 * E001;Muller;Jan;M;GER;12;5;1990;1;Müller;Jan;M;GER;12;5;1990;FUZZY;0.9500;
 * </pre>
 *
 * <p>Stream output is UTF-8 with a byte order mark so spreadsheet applications detect
 * the encoding.</p>
 */
public class CsvReportExporter implements ReportExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvReportExporter.class);
    private static final int PROGRESS_INTERVAL = 500;
    private static final char DELIMITER = ';';

    static final List<String> COLUMNS = List.of(
            "Event_ExternID", "Event_LastName", "Event_FirstName", "Event_Sex",
            "Event_Association", "Event_DoB", "Event_MoB", "Event_YoB",
            "Ref_ExternID", "Ref_LastName", "Ref_FirstName", "Ref_Sex",
            "Ref_Association", "Ref_DoB", "Ref_MoB", "Ref_YoB",
            "Match_Type", "Confidence", "Issues");

    @Override
    public ExportResult exportResults(List<MatchResult> results, OutputStream output, ProgressCallback callback) {
        try {
            output.write(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write match report", e);
        }
        return exportResults(results, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    @Override
    public ExportResult exportResults(List<MatchResult> results, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));

        pw.print(String.join(String.valueOf(DELIMITER), COLUMNS));
        pw.print("\r\n");

        long rows = 0;
        for (MatchResult result : results) {
            StringBuilder row = new StringBuilder();
            appendPlayer(row, result.eventRecord());
            row.append(DELIMITER);
            appendPlayer(row, result.referenceRecord());
            row.append(DELIMITER).append(result.tier().name());
            row.append(DELIMITER).append(String.format(Locale.ROOT, "%.4f", result.confidence()));
            row.append(DELIMITER).append(csvEscape(String.join(", ", result.issueCodes())));
            pw.print(row);
            pw.print("\r\n");
            rows++;

            if (rows % PROGRESS_INTERVAL == 0) {
                cb.onProgress(rows, results.size(), "Exported " + rows + " rows");
            }
        }

        pw.flush();
        if (pw.checkError()) {
            throw new UncheckedIOException(new IOException("Failed to write match report"));
        }

        ExportResult result = new ExportResult(rows);
        cb.onProgress(rows, results.size(), "Export completed");
        log.info("export.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private void appendPlayer(StringBuilder row, PlayerRecord player) {
        if (player == null) {
            row.append(String.valueOf(DELIMITER).repeat(7));
            return;
        }
        row.append(csvEscape(player.externalId())).append(DELIMITER)
                .append(csvEscape(player.lastName())).append(DELIMITER)
                .append(csvEscape(player.firstName())).append(DELIMITER)
                .append(csvEscape(player.sex())).append(DELIMITER)
                .append(csvEscape(player.association())).append(DELIMITER)
                .append(number(player.dayOfBirth())).append(DELIMITER)
                .append(number(player.monthOfBirth())).append(DELIMITER)
                .append(number(player.yearOfBirth()));
    }

    private static String number(Integer value) {
        return value != null ? value.toString() : "";
    }

    /**
     * Quotes a value containing the delimiter, a quote or a line break.
     */
    private static String csvEscape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(DELIMITER) >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
