package ai.attackframework.tools.bulkloader.dataset;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import ai.attackframework.tools.bulkloader.utils.Logger;

/**
 * Reads header-first CSV into a {@link Dataset}.
 *
 * <p>Cells are typed the way a dataframe reader would: empty becomes {@code null}, integral
 * text becomes {@link Long}, decimal text becomes {@link Double}, {@code true}/{@code false}
 * (any case) becomes {@link Boolean}; anything else stays a {@link String}.</p>
 */
public final class CsvDatasetReader {

    private static final CsvMapper MAPPER = new CsvMapper();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private static final Pattern INTEGRAL = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL =
            Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private CsvDatasetReader() {}

    /** Reads a UTF-8 CSV file. */
    public static Dataset read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Dataset dataset = read(reader);
            Logger.logInfo("[Dataset] Read " + dataset.size() + " rows from " + file);
            return dataset;
        }
    }

    /** Reads CSV from {@code reader}; the caller owns and closes it. */
    public static Dataset read(Reader reader) throws IOException {
        List<Row> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = MAPPER
                .readerForMapOf(String.class)
                .with(HEADER_SCHEMA)
                .readValues(reader)) {
            while (it.hasNextValue()) {
                Map<String, String> raw = it.nextValue();
                Map<String, Object> typed = new LinkedHashMap<>();
                for (Map.Entry<String, String> e : raw.entrySet()) {
                    typed.put(e.getKey(), typedValue(e.getValue()));
                }
                rows.add(Row.of(typed));
            }
        }
        return Dataset.of(rows);
    }

    static Object typedValue(String cell) {
        if (cell == null) return null;
        String v = cell.trim();
        if (v.isEmpty()) return null;
        if (INTEGRAL.matcher(v).matches()) {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                // too large for a long; fall through to decimal
                return Double.parseDouble(v);
            }
        }
        if (DECIMAL.matcher(v).matches()) return Double.parseDouble(v);
        if (v.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (v.equalsIgnoreCase("false")) return Boolean.FALSE;
        return cell;
    }
}
