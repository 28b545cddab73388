package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.exception.DatasetReadException;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.util.ColumnNameUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the first sheet of an .xlsx or .xls workbook into a dataset.
 * The first row holds the column names; blank cells read as missing.
 */
@Service
@Slf4j
public class ExcelReaderService {

    public Dataset readDataset(Path path) {
        try (InputStream is = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(is)) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new DatasetReadException(path, "Workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new DatasetReadException(path, "Excel sheet has no header row");
            }

            List<String> headers = new ArrayList<>();
            for (int j = 0; j < headerRow.getLastCellNum(); j++) {
                headers.add(getCellStringValue(headerRow.getCell(j)).trim());
            }
            if (ColumnNameUtil.hasDuplicates(headers)) {
                List<String> unique = ColumnNameUtil.uniqueNames(headers);
                log.warn("Repeated column names in {} renamed: {} -> {}", path, headers, unique);
                headers = unique;
            }

            Dataset.Builder builder = Dataset.builder(headers);
            int rowCount = 0;
            for (int i = headerRow.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }

                Map<String, Object> record = new LinkedHashMap<>();
                for (int j = 0; j < headers.size(); j++) {
                    record.put(headers.get(j), getCellValue(row.getCell(j)));
                }
                builder.addRow(record);
                rowCount++;
            }

            log.debug("Read {} rows from Excel sheet '{}'", rowCount, sheet.getSheetName());
            return builder.build();

        } catch (IOException e) {
            throw new DatasetReadException(path, "Failed to read Excel file", e);
        }
    }

    private String getCellStringValue(Cell cell) {
        if (cell == null) {
            return "";
        }
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                return String.valueOf((long) cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }

    private Object getCellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text.isEmpty() ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                double num = cell.getNumericCellValue();
                if (num == Math.floor(num) && !Double.isInfinite(num)) {
                    return (long) num;
                }
                return num;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }
}
