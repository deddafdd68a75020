package com.player.matching.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.player.matching.core.model.PlayerRecord;
import com.player.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON player importer.
 *
 * <p>Accepts a JSON array:</p>
 * <pre>
 * [
 *   {"externId": "P001", "lastName": "MUELLER", "firstName": "Hans", "sex": "M",
 *    "association": "GER", "dob": 15, "mob": 6, "yob": 1985}
 * ]
 * </pre>
 *
 * <p>or JSON Lines, one object per line. Birth values may be numbers or numeric strings.
 * Elements that are not objects or carry an invalid birth value are skipped and reported.</p>
 */
public class JsonPlayerImporter implements PlayerImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonPlayerImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final ObjectMapper objectMapper;

    public JsonPlayerImporter() {
        this(new ObjectMapper());
    }

    public JsonPlayerImporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ImportResult importPlayers(InputStream input, ProgressCallback callback) {
        return importPlayers(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    @Override
    public ImportResult importPlayers(Reader reader, ProgressCallback callback) {
        try (LogContext ctx = LogContext.forImport(getFormat())) {
            return readPlayers(reader, callback);
        }
    }

    private ImportResult readPlayers(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String content = readFully(reader).strip();
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
            content = content.substring(1).strip();
        }
        if (content.isEmpty()) {
            throw new PlayerImportException("Player input is empty");
        }

        List<PlayerRecord> players = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();

        if (content.startsWith("[")) {
            JsonNode root;
            try {
                root = objectMapper.readTree(content);
            } catch (JsonProcessingException e) {
                throw new PlayerImportException("Malformed JSON player array: " + e.getOriginalMessage(), e);
            }
            int index = 0;
            for (JsonNode element : root) {
                index++;
                addElement(element, index, element.toString(), players, errors);
                reportProgress(cb, index);
            }
        } else {
            String[] lines = content.split("\\R");
            long processed = 0;
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i].strip();
                if (line.isEmpty()) {
                    continue;
                }
                processed++;
                long lineNumber = i + 1L;
                try {
                    addElement(objectMapper.readTree(line), lineNumber, line, players, errors);
                } catch (JsonProcessingException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, line, "Malformed JSON: " + e.getOriginalMessage()));
                    log.warn("import.row.skipped line={} error={}", lineNumber, e.getOriginalMessage());
                }
                reportProgress(cb, processed);
            }
        }

        ImportResult result = new ImportResult(players, errors);
        cb.onProgress(result.totalRecords(), result.totalRecords(), "Import completed");
        log.info("import.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private void addElement(JsonNode node, long position, String raw,
                            List<PlayerRecord> players, List<ImportResult.ImportError> errors) {
        try {
            players.add(toPlayer(node));
        } catch (IllegalArgumentException e) {
            errors.add(new ImportResult.ImportError(position, raw, e.getMessage()));
            log.warn("import.row.skipped line={} error={}", position, e.getMessage());
        }
    }

    private PlayerRecord toPlayer(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object");
        }
        return PlayerRecord.builder()
                .externalId(text(node, "externId"))
                .lastName(text(node, "lastName"))
                .firstName(text(node, "firstName"))
                .sex(text(node, "sex"))
                .association(text(node, "association"))
                .dayOfBirth(birthField(node, "dob"))
                .monthOfBirth(birthField(node, "mob"))
                .yearOfBirth(birthField(node, "yob"))
                .build();
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return DelimitedPlayerImporter.normalizeWhitespace(value.asText());
    }

    private Integer birthField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.intValue();
        }
        String raw = value.asText().strip();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + field + " value '" + raw + "'", e);
        }
    }

    private static void reportProgress(ProgressCallback cb, long processed) {
        if (processed % PROGRESS_INTERVAL == 0) {
            cb.onProgress(processed, -1, "Processed " + processed + " records");
        }
    }

    private static String readFully(Reader reader) {
        try (Reader r = reader) {
            StringWriter writer = new StringWriter();
            r.transferTo(writer);
            return writer.toString();
        } catch (IOException e) {
            throw new PlayerImportException("Unable to read player input: " + e.getMessage(), e);
        }
    }
}
