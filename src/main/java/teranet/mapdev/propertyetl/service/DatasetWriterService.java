package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.config.EtlConfig;
import teranet.mapdev.propertyetl.exception.UnsupportedFormatException;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.util.FileFormatUtil;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Persists a dataset as CSV.
 *
 * - Missing destination directories are created
 * - UTF-8 with a byte-order mark (configurable) so spreadsheet tools detect the encoding
 * - RFC 4180 quoting for values containing the delimiter, quotes or line breaks
 * - Missing values are written as empty cells
 *
 * Only .csv destinations are supported.
 */
@Service
@Slf4j
public class DatasetWriterService {

    private static final String BOM = "\uFEFF";
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // Doubles at or above this magnitude are written without the ".0" shortcut
    private static final double PLAIN_INTEGRAL_LIMIT = 1e15;

    private final EtlConfig etlConfig;

    public DatasetWriterService(EtlConfig etlConfig) {
        this.etlConfig = etlConfig;
    }

    /**
     * @throws UnsupportedFormatException when the destination is not a .csv file;
     *                                    nothing is created in that case
     */
    public void write(Dataset dataset, Path path) throws IOException {
        log.info("Loading data into: {}", path);

        if (!FileFormatUtil.isCsv(path)) {
            throw new UnsupportedFormatException(FileFormatUtil.getExtension(path));
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            log.debug("Created output directory: {}", parent);
        }

        char delimiter = etlConfig.getCsv().getDelimiter();
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            if (etlConfig.getCsv().isWriteBom()) {
                writer.write(BOM);
            }

            List<String> columns = dataset.getColumns();
            writeLine(writer, columns, delimiter);

            for (Map<String, Object> row : dataset.getRows()) {
                String[] cells = new String[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    cells[i] = formatValue(row.get(columns.get(i)));
                }
                writeLine(writer, List.of(cells), delimiter);
            }
        }

        log.info("Data loaded successfully: {} records written", dataset.size());
    }

    /**
     * Text form of a cell value as written to CSV.
     */
    public String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(DATE_TIME_FORMAT);
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return "";
            }
            if (number == Math.rint(number) && Math.abs(number) < PLAIN_INTEGRAL_LIMIT) {
                return (long) number + ".0";
            }
            return BigDecimal.valueOf(number).toPlainString();
        }
        return value.toString();
    }

    private void writeLine(BufferedWriter writer, List<String> cells, char delimiter) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(delimiter);
            }
            line.append(quoteIfNeeded(cells.get(i), delimiter));
        }
        writer.write(line.toString());
        writer.write('\n');
    }

    private String quoteIfNeeded(String cell, char delimiter) {
        if (cell.indexOf(delimiter) >= 0 || cell.indexOf('"') >= 0
                || cell.indexOf('\n') >= 0 || cell.indexOf('\r') >= 0) {
            return '"' + cell.replace("\"", "\"\"") + '"';
        }
        return cell;
    }
}
