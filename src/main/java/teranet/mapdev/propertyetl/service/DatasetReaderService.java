package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.exception.UnsupportedFormatException;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.util.FileFormatUtil;

import java.nio.file.Path;

/**
 * Picks the reader for a source file by its extension.
 * Supported: .csv, .xlsx, .xls.
 */
@Service
@Slf4j
public class DatasetReaderService {

    private final CsvParsingService csvParsingService;
    private final ExcelReaderService excelReaderService;

    public DatasetReaderService(CsvParsingService csvParsingService, ExcelReaderService excelReaderService) {
        this.csvParsingService = csvParsingService;
        this.excelReaderService = excelReaderService;
    }

    /**
     * @throws UnsupportedFormatException for any other extension
     */
    public Dataset read(Path path) {
        log.info("Extracting data from: {}", path);

        Dataset dataset;
        if (FileFormatUtil.isCsv(path)) {
            dataset = csvParsingService.readDataset(path);
        } else if (FileFormatUtil.isExcel(path)) {
            dataset = excelReaderService.readDataset(path);
        } else {
            throw new UnsupportedFormatException(FileFormatUtil.getExtension(path));
        }

        log.info("Data extracted: {} records, {} columns", dataset.size(), dataset.columnCount());
        return dataset;
    }
}
