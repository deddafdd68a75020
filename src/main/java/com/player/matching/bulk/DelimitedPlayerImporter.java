package com.player.matching.bulk;

import com.player.matching.core.model.PlayerRecord;
import com.player.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Delimited (tab-separated by default) player file importer.
 *
 * <p>Expected format:</p>
 * <pre>
 * Extern ID	Last Name	First Name	Sex	Association	DoB	MoB	YoB
 * P001	MUELLER	Hans	M	GER	15	6	1985
 * </pre>
 *
 * <p>The header row is required and column order is free; extra columns are ignored.
 * Stream input is decoded as UTF-16 when it starts with a UTF-16 byte order mark and as
 * UTF-8 otherwise. Every value is whitespace-normalized. Rows with a non-numeric birth
 * field are skipped and reported as {@link ImportResult.ImportError}.</p>
 */
public class DelimitedPlayerImporter implements PlayerImporter {
    private static final Logger log = LoggerFactory.getLogger(DelimitedPlayerImporter.class);
    private static final int PROGRESS_INTERVAL = 100;
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final char BOM = '\uFEFF';

    static final String COL_EXTERN_ID = "Extern ID";
    static final String COL_LAST_NAME = "Last Name";
    static final String COL_FIRST_NAME = "First Name";
    static final String COL_SEX = "Sex";
    static final String COL_ASSOCIATION = "Association";
    static final String COL_DOB = "DoB";
    static final String COL_MOB = "MoB";
    static final String COL_YOB = "YoB";

    static final List<String> REQUIRED_COLUMNS = List.of(
            COL_EXTERN_ID, COL_LAST_NAME, COL_FIRST_NAME, COL_SEX,
            COL_ASSOCIATION, COL_DOB, COL_MOB, COL_YOB);

    private final char delimiter;

    public DelimitedPlayerImporter() {
        this('\t');
    }

    public DelimitedPlayerImporter(char delimiter) {
        if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid delimiter: " + (int) delimiter);
        }
        this.delimiter = delimiter;
    }

    @Override
    public ImportResult importPlayers(InputStream input, ProgressCallback callback) {
        BufferedInputStream in = new BufferedInputStream(input);
        Charset charset;
        try {
            charset = detectCharset(in);
        } catch (IOException e) {
            throw new PlayerImportException("Unable to read player input: " + e.getMessage(), e);
        }
        log.debug("import.encoding charset={}", charset);
        return importPlayers(new InputStreamReader(in, charset), callback);
    }

    @Override
    public ImportResult importPlayers(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<PlayerRecord> players = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();

        try (LogContext ctx = LogContext.forImport(getFormat());
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null || header.isBlank()) {
                throw new PlayerImportException("Player input is empty or has no header row");
            }
            if (header.charAt(0) == BOM) {
                header = header.substring(1);
            }
            Map<String, Integer> columns = indexColumns(header);

            String line;
            long lineNumber = 1;
            long processed = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                processed++;
                try {
                    players.add(parseRow(splitLine(line), columns));
                } catch (IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, line, e.getMessage()));
                    log.warn("import.row.skipped line={} error={}", lineNumber, e.getMessage());
                }

                if (processed % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(processed, -1, "Processed " + processed + " records");
                }
            }
        } catch (IOException e) {
            throw new PlayerImportException("Unable to read player input: " + e.getMessage(), e);
        }

        ImportResult result = new ImportResult(players, errors);
        cb.onProgress(result.totalRecords(), result.totalRecords(), "Import completed");
        log.info("import.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "tsv";
    }

    /**
     * Picks the charset from a byte order mark and rewinds the stream.
     */
    static Charset detectCharset(BufferedInputStream in) throws IOException {
        in.mark(3);
        byte[] bom = in.readNBytes(3);
        in.reset();
        if (bom.length >= 2) {
            int b0 = bom[0] & 0xFF;
            int b1 = bom[1] & 0xFF;
            if (b0 == 0xFF && b1 == 0xFE) {
                return StandardCharsets.UTF_16LE;
            }
            if (b0 == 0xFE && b1 == 0xFF) {
                return StandardCharsets.UTF_16BE;
            }
        }
        return StandardCharsets.UTF_8;
    }

    /**
     * Collapses any whitespace run, including Unicode spaces, to one space and trims.
     */
    static String normalizeWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    private Map<String, Integer> indexColumns(String header) {
        Map<String, Integer> columns = new HashMap<>();
        List<String> names = splitLine(header);
        for (int i = 0; i < names.size(); i++) {
            columns.putIfAbsent(normalizeWhitespace(names.get(i)), i);
        }

        Set<String> missing = new TreeSet<>(REQUIRED_COLUMNS);
        missing.removeAll(columns.keySet());
        if (!missing.isEmpty()) {
            throw new PlayerImportException("Missing columns in player input: " + String.join(", ", missing));
        }
        return columns;
    }

    private PlayerRecord parseRow(List<String> values, Map<String, Integer> columns) {
        return PlayerRecord.builder()
                .externalId(value(values, columns, COL_EXTERN_ID))
                .lastName(value(values, columns, COL_LAST_NAME))
                .firstName(value(values, columns, COL_FIRST_NAME))
                .sex(value(values, columns, COL_SEX))
                .association(value(values, columns, COL_ASSOCIATION))
                .dayOfBirth(parseBirthField(values, columns, COL_DOB))
                .monthOfBirth(parseBirthField(values, columns, COL_MOB))
                .yearOfBirth(parseBirthField(values, columns, COL_YOB))
                .build();
    }

    private String value(List<String> values, Map<String, Integer> columns, String column) {
        int index = columns.get(column);
        return index < values.size() ? normalizeWhitespace(values.get(index)) : "";
    }

    private Integer parseBirthField(List<String> values, Map<String, Integer> columns, String column) {
        String raw = value(values, columns, column);
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + column + " value '" + raw + "'", e);
        }
    }

    /**
     * Splits a line on the delimiter. A field wrapped in double quotes may contain the
     * delimiter; a doubled quote inside it stands for one quote.
     */
    List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == delimiter) {
                fields.add(current.toString());
                current.setLength(0);
                fieldStart = true;
                continue;
            } else if (c == '"' && fieldStart) {
                quoted = true;
            } else {
                current.append(c);
            }
            fieldStart = false;
        }
        fields.add(current.toString());
        return fields;
    }
}
