package teranet.mapdev.propertyetl.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import teranet.mapdev.propertyetl.exception.UnsupportedFormatException;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.util.TestDataFactory;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatasetReaderServiceTest {

    @Mock
    private CsvParsingService csvParsingService;

    @Mock
    private ExcelReaderService excelReaderService;

    @InjectMocks
    private DatasetReaderService readerService;

    @Test
    void testRead_CsvDispatchesToCsvParser() {
        Path path = Path.of("data", "raw", "propiedades.CSV");
        Dataset dataset = TestDataFactory.cleanDataset();
        when(csvParsingService.readDataset(path)).thenReturn(dataset);

        assertSame(dataset, readerService.read(path));
        verifyNoInteractions(excelReaderService);
    }

    @Test
    void testRead_ExcelDispatchesToWorkbookReader() {
        Path xlsx = Path.of("propiedades.xlsx");
        Path xls = Path.of("propiedades.xls");
        when(excelReaderService.readDataset(any(Path.class))).thenReturn(Dataset.empty());

        readerService.read(xlsx);
        readerService.read(xls);

        verify(excelReaderService).readDataset(xlsx);
        verify(excelReaderService).readDataset(xls);
        verifyNoInteractions(csvParsingService);
    }

    @Test
    void testRead_OtherExtensionIsUnsupported() {
        UnsupportedFormatException e = assertThrows(UnsupportedFormatException.class,
                () -> readerService.read(Path.of("propiedades.json")));

        assertEquals(".json", e.getExtension());
        assertThat(e.getMessage()).isEqualTo("Unsupported file format: .json");
        verifyNoInteractions(csvParsingService, excelReaderService);
    }

    @Test
    void testRead_NoExtensionIsUnsupported() {
        assertThrows(UnsupportedFormatException.class, () -> readerService.read(Path.of("propiedades")));
    }
}
