package teranet.mapdev.propertyetl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline configuration bound from application.properties (prefix "etl").
 *
 * - etl.input-path / etl.output-path / etl.report-path
 * - etl.run-on-startup
 * - etl.sample.*  synthetic input generation
 * - etl.csv.*     CSV reading and writing
 */
@Configuration
@ConfigurationProperties(prefix = "etl")
@Data
public class EtlConfig {

    /** Source file (.csv, .xlsx or .xls) */
    private String inputPath = "data/raw/propiedades_raw.csv";

    /** Destination file for the processed dataset */
    private String outputPath = "data/processed/propiedades_procesadas.csv";

    /** Optional JSON copy of the summary report; blank disables it */
    private String reportPath = "";

    /** Run the pipeline once when the application starts */
    private boolean runOnStartup = true;

    private Sample sample = new Sample();

    private Csv csv = new Csv();

    // ========================================
    // SAMPLE DATA (etl.sample.*)
    // ========================================

    @Data
    public static class Sample {
        /** Write a synthetic dataset to the input path before the run */
        private boolean enabled = false;

        private int records = 150;

        /** Seed for reproducible samples */
        private long seed = 42L;

        /** Share of records whose description is left missing */
        private double nullDescriptionRatio = 0.05;
    }

    // ========================================
    // CSV SETTINGS (etl.csv.*)
    // ========================================

    @Data
    public static class Csv {
        private char delimiter = ',';

        /** Prefix written CSV files with a UTF-8 byte-order mark */
        private boolean writeBom = true;
    }

    public boolean hasReportPath() {
        return reportPath != null && !reportPath.trim().isEmpty();
    }
}
