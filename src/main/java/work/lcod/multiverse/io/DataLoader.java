package work.lcod.multiverse.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import work.lcod.multiverse.runtime.Values;
import work.lcod.multiverse.table.Table;

/**
 * Loads input data bound into the shared input scope. CSV files become tables; JSON arrays of objects become
 * tables; any other JSON document is bound as a plain value.
 */
public final class DataLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private DataLoader() {}

    public static Object load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read data file: " + path, ex);
        }
        var name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return fromCsv(new StringReader(text), path);
        }
        if (name.endsWith(".json")) {
            return fromJson(text, path);
        }
        throw new IllegalArgumentException("Unsupported data file (expected .csv or .json): " + path);
    }

    /**
     * First record is the header. Empty cells become {@code null}, numeric cells become numbers.
     */
    static Table fromCsv(Reader reader, Path origin) {
        CSVFormat format = CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim(true);
        try (CSVParser parser = new CSVParser(reader, format)) {
            List<String> headers = parser.getHeaderNames();
            var rows = new ArrayList<Map<String, Object>>();
            for (CSVRecord record : parser) {
                var row = new LinkedHashMap<String, Object>();
                for (String header : headers) {
                    row.put(header, record.isSet(header) ? cell(record.get(header)) : null);
                }
                rows.add(row);
            }
            return new Table(headers, rows);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse CSV " + origin + ": " + ex.getMessage(), ex);
        }
    }

    static Object cell(String raw) {
        if (raw == null || raw.isEmpty() || raw.equals("NA")) {
            return null;
        }
        if (NUMBER.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        return raw;
    }

    static Object fromJson(String text, Path origin) {
        Object value;
        try {
            value = JSON.readValue(text, Object.class);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse JSON " + origin + ": " + ex.getMessage(), ex);
        }
        if (value instanceof List<?> list && !list.isEmpty() && list.stream().allMatch(item -> item instanceof Map<?, ?>)) {
            var columns = new LinkedHashSet<String>();
            var rows = new ArrayList<Map<String, Object>>(list.size());
            for (var item : list) {
                var row = new LinkedHashMap<String, Object>();
                ((Map<?, ?>) item).forEach((key, cell) -> row.put(String.valueOf(key), cell));
                columns.addAll(row.keySet());
                rows.add(row);
            }
            return Values.normalize(new Table(new ArrayList<>(columns), rows));
        }
        return Values.normalize(value);
    }
}
