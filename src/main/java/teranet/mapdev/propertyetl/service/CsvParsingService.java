package teranet.mapdev.propertyetl.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.config.EtlConfig;
import teranet.mapdev.propertyetl.exception.DatasetReadException;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.util.ColumnNameUtil;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Service responsible for turning CSV files into datasets.
 *
 * Features:
 * - UTF-8 input, a leading byte-order mark is ignored
 * - Parse CSV rows handling quoted fields and delimiters within quotes
 * - Empty cells and common NA markers read as missing values
 * - Per-column typing: integer columns become Long, decimal columns Double,
 *   everything else String
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class CsvParsingService {

    private static final Logger logger = LoggerFactory.getLogger(CsvParsingService.class);

    private static final char BOM = '\uFEFF';

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    // Cell contents treated as missing, in addition to the empty string
    private static final Set<String> MISSING_MARKERS = Set.of(
            "NA", "N/A", "n/a", "#N/A", "NULL", "null", "NaN", "nan", "-NaN", "None", "<NA>");

    private final EtlConfig etlConfig;

    public CsvParsingService(EtlConfig etlConfig) {
        this.etlConfig = etlConfig;
    }

    /**
     * Read a whole CSV file into memory.
     *
     * @param path the CSV file, first line is the header
     * @return the typed dataset
     * @throws DatasetReadException if the file cannot be read, is empty, has no
     *                              header or a row has more values than headers
     */
    public Dataset readDataset(Path path) {
        logger.debug("Reading CSV file: {}", path);

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine != null && !headerLine.isEmpty() && headerLine.charAt(0) == BOM) {
                headerLine = headerLine.substring(1);
            }
            if (headerLine == null || headerLine.trim().isEmpty()) {
                throw new DatasetReadException(path, "CSV file is empty or has no header");
            }

            List<String> headers = new ArrayList<>();
            for (String header : parseCsvRow(headerLine)) {
                headers.add(header.trim());
            }
            if (ColumnNameUtil.hasDuplicates(headers)) {
                List<String> unique = ColumnNameUtil.uniqueNames(headers);
                logger.warn("Repeated column names in {} renamed: {} -> {}", path, headers, unique);
                headers = unique;
            }

            List<List<String>> rawRows = new ArrayList<>();
            String line;
            long lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                List<String> values = parseCsvRow(line);
                if (values.size() > headers.size()) {
                    throw new DatasetReadException(path, String.format(
                            "Line %d has %d values but the header declares %d columns",
                            lineNumber, values.size(), headers.size()));
                }
                rawRows.add(values);
            }

            Dataset dataset = toTypedDataset(headers, rawRows);
            logger.debug("Read {} rows and {} columns from {}", dataset.size(), dataset.columnCount(), path);
            return dataset;

        } catch (IOException e) {
            throw new DatasetReadException(path, "Failed to read CSV file", e);
        }
    }

    /**
     * Parse CSV row handling quoted fields and delimiters within quotes.
     * Follows RFC 4180 CSV specification for quote handling.
     *
     * Examples:
     *   "PROP-1,Casa,250000" → ["PROP-1", "Casa", "250000"]
     *   "PROP-1,\"Casa, amplia\",250000" → ["PROP-1", "Casa, amplia", "250000"]
     *   "\"O'Higgins\",\"Depto \"\"A\"\"\",50" → ["O'Higgins", "Depto \"A\"", "50"]
     *
     * @param csvLine the CSV line to parse
     * @return list of field values
     */
    public List<String> parseCsvRow(String csvLine) {
        char delimiter = etlConfig.getCsv().getDelimiter();
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < csvLine.length(); i++) {
            char c = csvLine.charAt(i);

            if (c == '"') {
                // Handle escaped quotes (double quotes "" represent a single quote)
                if (inQuotes && i + 1 < csvLine.length() && csvLine.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++; // Skip next quote
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                // End of field
                values.add(currentValue.toString());
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }

        // Add the last field
        values.add(currentValue.toString());

        return values;
    }

    /**
     * Decide each column's type from all its present cells, then convert.
     */
    private Dataset toTypedDataset(List<String> headers, List<List<String>> rawRows) {
        List<ColumnType> types = new ArrayList<>();
        for (int col = 0; col < headers.size(); col++) {
            types.add(inferType(rawRows, col));
        }

        Dataset.Builder builder = Dataset.builder(headers);
        for (List<String> raw : rawRows) {
            List<Object> values = new ArrayList<>(headers.size());
            for (int col = 0; col < headers.size(); col++) {
                String cell = col < raw.size() ? raw.get(col) : null;
                values.add(convert(cell, types.get(col)));
            }
            builder.addRow(values);
        }
        return builder.build();
    }

    private ColumnType inferType(List<List<String>> rawRows, int col) {
        boolean allIntegers = true;
        boolean allDecimals = true;
        for (List<String> raw : rawRows) {
            String cell = col < raw.size() ? raw.get(col) : null;
            if (isMissing(cell)) {
                continue;
            }
            String trimmed = cell.trim();
            if (!INTEGER_PATTERN.matcher(trimmed).matches()) {
                allIntegers = false;
            }
            if (!DECIMAL_PATTERN.matcher(trimmed).matches()) {
                allDecimals = false;
                break;
            }
        }
        if (allIntegers) {
            return ColumnType.INTEGER;
        }
        return allDecimals ? ColumnType.DECIMAL : ColumnType.TEXT;
    }

    private Object convert(String cell, ColumnType type) {
        if (isMissing(cell)) {
            return null;
        }
        switch (type) {
            case INTEGER:
                try {
                    return Long.parseLong(cell.trim());
                } catch (NumberFormatException e) {
                    // Beyond long range
                    return Double.parseDouble(cell.trim());
                }
            case DECIMAL:
                return Double.parseDouble(cell.trim());
            default:
                return cell;
        }
    }

    private boolean isMissing(String cell) {
        return cell == null || cell.isEmpty() || MISSING_MARKERS.contains(cell.trim());
    }

    private enum ColumnType {
        INTEGER,
        DECIMAL,
        TEXT
    }
}
