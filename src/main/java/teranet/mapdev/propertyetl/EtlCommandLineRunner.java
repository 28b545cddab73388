package teranet.mapdev.propertyetl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import teranet.mapdev.propertyetl.config.EtlConfig;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.SummaryReport;
import teranet.mapdev.propertyetl.service.DatasetWriterService;
import teranet.mapdev.propertyetl.service.EtlPipeline;
import teranet.mapdev.propertyetl.service.EtlPipelineFactory;
import teranet.mapdev.propertyetl.service.SampleDataGenerator;
import teranet.mapdev.propertyetl.util.RunIdUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Runs the pipeline once at startup and prints the processing report.
 *
 * Disable with etl.run-on-startup=false. When etl.sample.enabled=true a
 * synthetic listing file is written to the input path first.
 */
@Component
@ConditionalOnProperty(prefix = "etl", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
@Slf4j
public class EtlCommandLineRunner implements CommandLineRunner {

    private final EtlConfig etlConfig;
    private final EtlPipelineFactory pipelineFactory;
    private final SampleDataGenerator sampleDataGenerator;
    private final DatasetWriterService writerService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EtlCommandLineRunner(EtlConfig etlConfig,
                                EtlPipelineFactory pipelineFactory,
                                SampleDataGenerator sampleDataGenerator,
                                DatasetWriterService writerService,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.etlConfig = etlConfig;
        this.pipelineFactory = pipelineFactory;
        this.sampleDataGenerator = sampleDataGenerator;
        this.writerService = writerService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void run(String... args) throws Exception {
        // One run id covers sample generation, the pipeline and the report output
        String runId = RunIdUtil.startRun();
        log.debug("Startup run {}", runId);
        try {
            if (etlConfig.getSample().isEnabled()) {
                generateSampleInput();
            }

            EtlPipeline pipeline = pipelineFactory.create();
            SummaryReport report = pipeline.run();

            printReport(report);

            if (etlConfig.hasReportPath()) {
                writeJsonReport(report, Path.of(etlConfig.getReportPath()));
            }
        } finally {
            RunIdUtil.clearRunId();
        }
    }

    private void generateSampleInput() throws IOException {
        EtlConfig.Sample sample = etlConfig.getSample();
        Dataset dataset = sampleDataGenerator.generate(
                sample.getRecords(), sample.getSeed(), LocalDateTime.now(clock), sample.getNullDescriptionRatio());
        writerService.write(dataset, Path.of(etlConfig.getInputPath()));
        log.info("Sample data written to {}", etlConfig.getInputPath());
    }

    private void printReport(SummaryReport report) {
        log.info("=".repeat(60));
        log.info("PROCESSING REPORT");
        log.info("=".repeat(60));
        for (String line : report.toPlainTextLines()) {
            log.info(line);
        }
    }

    /**
     * Full report including the statistics block, as pretty-printed JSON.
     */
    void writeJsonReport(SummaryReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(path.toFile(), report);
        log.info("Summary report written to {}", path);
    }
}
