package teranet.mapdev.propertyetl.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryReportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SummaryReport sampleReport(Map<String, ColumnStatistics> statistics) {
        return SummaryReport.builder()
                .processedAt("2024-06-30 12:00:00")
                .originalRecords(3)
                .processedRecords(2)
                .columns(4)
                .failedValidations(1)
                .error(ViolationRecord.duplicateKeys(ListingColumns.ID, 1))
                .statistics(statistics)
                .build();
    }

    private ColumnStatistics priceStatistics() {
        return ColumnStatistics.builder()
                .count(2).mean(75000.0).std(35355.34).min(50000.0)
                .percentile25(62500.0).median(75000.0).percentile75(87500.0).max(100000.0)
                .build();
    }

    @Test
    void testToMap_UsesFixedKeysInOrder() {
        SummaryReport report = sampleReport(Map.of("precio", priceStatistics()));

        assertThat(report.toMap().keySet()).containsExactly(
                "fecha_procesamiento", "registros_originales", "registros_procesados",
                "columnas", "validaciones_fallidas", "errores", "estadisticas");
    }

    @Test
    void testToPlainTextLines_ExcludesStatistics() {
        SummaryReport report = sampleReport(Map.of("precio", priceStatistics()));

        List<String> lines = report.toPlainTextLines();

        assertThat(lines).containsExactly(
                "fecha_procesamiento: 2024-06-30 12:00:00",
                "registros_originales: 3",
                "registros_procesados: 2",
                "columnas: 4",
                "validaciones_fallidas: 1",
                "errores: [Duplicate records found: 1]");
    }

    @Test
    void testJson_SerializesViolationsAsDescriptionsAndStatisticsKeys() throws Exception {
        SummaryReport report = sampleReport(Map.of("precio", priceStatistics()));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(report));

        assertThat(json.get("registros_procesados").asInt()).isEqualTo(2);
        assertThat(json.get("errores").get(0).asText()).isEqualTo("Duplicate records found: 1");
        JsonNode price = json.get("estadisticas").get("precio");
        assertThat(price.get("count").asLong()).isEqualTo(2);
        assertThat(price.get("25%").asDouble()).isEqualTo(62500.0);
        assertThat(price.get("50%").asDouble()).isEqualTo(75000.0);
        assertThat(price.get("75%").asDouble()).isEqualTo(87500.0);
    }

    @Test
    void testJson_OmitsStatisticsWhenAbsent() throws Exception {
        SummaryReport report = sampleReport(null);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(report));

        assertThat(json.has("estadisticas")).isFalse();
        assertThat(report.toMap()).doesNotContainKey("estadisticas");
    }
}
