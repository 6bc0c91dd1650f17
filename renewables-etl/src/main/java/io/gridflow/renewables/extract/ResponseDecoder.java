package io.gridflow.renewables.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gridflow.core.Table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes response bodies into tables. Column names are kept exactly as received; cleaning them up is the
 * transform's job.
 */
public class ResponseDecoder {
    private final ObjectMapper mapper;

    public ResponseDecoder() {
        this(new ObjectMapper());
    }

    public ResponseDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Table decode(String resourcePath, String body, ResponseFormat format) throws DecodeException {
        if (body == null || body.isBlank()) throw new DecodeException(resourcePath, "empty body");
        return switch (format) {
            case ROW_TABULAR -> decodeCsv(resourcePath, body);
            case RECORD_LIST -> decodeRecords(resourcePath, body);
        };
    }

    Table decodeCsv(String resourcePath, String body) throws DecodeException {
        List<List<String>> lines = splitCsv(resourcePath, body);
        if (lines.isEmpty()) throw new DecodeException(resourcePath, "missing header row");
        List<String> header = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String name : lines.get(0)) {
            String col = name == null ? "" : name;
            if (!seen.add(col)) throw new DecodeException(resourcePath, "duplicate column '" + col + "'");
            header.add(col);
        }
        Table.Builder b = Table.builder(header);
        for (int i = 1; i < lines.size(); i++) {
            List<String> cells = lines.get(i);
            if (cells.size() > header.size()) {
                throw new DecodeException(resourcePath, "line " + (i + 1) + " has " + cells.size() + " fields, header has " + header.size());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < cells.size(); c++) row.put(header.get(c), cells.get(c));
            b.addRow(row);
        }
        return b.build();
    }

    // RFC 4180 style: comma separated, double-quoted fields may hold commas, quotes ("") and newlines.
    // Empty unquoted fields are null; blank lines are skipped.
    private static List<List<String>> splitCsv(String resourcePath, String body) throws DecodeException {
        List<List<String>> out = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        boolean cellWasQuoted = false;
        int i = 0;
        int n = body.length();
        while (i < n) {
            char ch = body.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < n && body.charAt(i + 1) == '"') {
                        cell.append('"');
                        i += 2;
                        continue;
                    }
                    quoted = false;
                } else {
                    cell.append(ch);
                }
                i++;
                continue;
            }
            switch (ch) {
                case '"' -> {
                    if (cell.length() > 0) throw new DecodeException(resourcePath, "stray quote in field '" + cell + "'");
                    quoted = true;
                    cellWasQuoted = true;
                }
                case ',' -> {
                    current.add(finishCell(cell, cellWasQuoted));
                    cellWasQuoted = false;
                }
                case '\r' -> { }
                case '\n' -> {
                    current.add(finishCell(cell, cellWasQuoted));
                    cellWasQuoted = false;
                    addLine(out, current);
                    current = new ArrayList<>();
                }
                default -> cell.append(ch);
            }
            i++;
        }
        if (quoted) throw new DecodeException(resourcePath, "unterminated quoted field");
        if (cell.length() > 0 || cellWasQuoted || !current.isEmpty()) {
            current.add(finishCell(cell, cellWasQuoted));
            addLine(out, current);
        }
        return out;
    }

    private static String finishCell(StringBuilder cell, boolean wasQuoted) {
        String v = cell.toString();
        cell.setLength(0);
        return v.isEmpty() && !wasQuoted ? null : v;
    }

    private static void addLine(List<List<String>> out, List<String> cells) {
        if (cells.size() == 1 && cells.get(0) == null) return; // blank line
        out.add(cells);
    }

    Table decodeRecords(String resourcePath, String body) throws DecodeException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DecodeException(resourcePath, "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) throw new DecodeException(resourcePath, "expected a JSON array of records");

        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>(root.size());
        int idx = 0;
        for (JsonNode element : root) {
            if (!element.isObject()) {
                throw new DecodeException(resourcePath, "record " + idx + " is not an object");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                columns.add(f.getKey());
                row.put(f.getKey(), scalar(resourcePath, idx, f.getKey(), f.getValue()));
            }
            rows.add(row);
            idx++;
        }
        Table.Builder b = Table.builder(new ArrayList<>(columns));
        for (Map<String, Object> row : rows) b.addRow(row);
        return b.build();
    }

    private static Object scalar(String resourcePath, int idx, String field, JsonNode v) throws DecodeException {
        if (v == null || v.isNull()) return null;
        if (v.isTextual()) return v.textValue();
        if (v.isBoolean()) return v.booleanValue();
        if (v.isIntegralNumber()) {
            if (!v.canConvertToLong()) throw new DecodeException(resourcePath, "record " + idx + " field '" + field + "' overflows a long");
            return v.longValue();
        }
        if (v.isNumber()) return v.doubleValue();
        throw new DecodeException(resourcePath, "record " + idx + " field '" + field + "' is not a scalar");
    }
}
