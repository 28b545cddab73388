package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.propertyetl.exception.PipelineOrderingException;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.SummaryReport;
import teranet.mapdev.propertyetl.model.ValidationResult;
import teranet.mapdev.propertyetl.model.ViolationRecord;
import teranet.mapdev.propertyetl.util.RunIdUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One extract → validate → transform → validate → load → report run over a
 * single listing file.
 *
 * Quality violations never stop the run; they are logged and reported.
 * Stage misuse (transforming before extracting, loading or reporting before
 * transforming) raises {@link PipelineOrderingException}.
 *
 * Not thread-safe. An instance holds the state of exactly one run (raw
 * dataset, processed dataset, last validation result) and must not be shared
 * between threads or reused for another dataset concurrently; obtain a new
 * instance from {@link EtlPipelineFactory} per run.
 */
@Slf4j
public class EtlPipeline {

    private static final String BANNER = "=".repeat(60);

    private final Path inputPath;
    private final Path outputPath;
    private final DatasetReaderService readerService;
    private final DataQualityValidator validator;
    private final TransformEngine transformEngine;
    private final DatasetWriterService writerService;
    private final SummaryReportService reportService;
    private final Clock clock;

    private Dataset rawDataset;
    private Dataset processedDataset;
    private ValidationResult lastValidation;

    EtlPipeline(Path inputPath, Path outputPath,
                DatasetReaderService readerService,
                DataQualityValidator validator,
                TransformEngine transformEngine,
                DatasetWriterService writerService,
                SummaryReportService reportService,
                Clock clock) {
        this.inputPath = inputPath;
        this.outputPath = outputPath;
        this.readerService = readerService;
        this.validator = validator;
        this.transformEngine = transformEngine;
        this.writerService = writerService;
        this.reportService = reportService;
        this.clock = clock;
    }

    public Dataset extract() {
        rawDataset = readerService.read(inputPath);
        return rawDataset;
    }

    /**
     * Validate a dataset. The result replaces the one from the previous pass.
     */
    public ValidationResult validate(Dataset dataset) {
        lastValidation = validator.validate(dataset);
        return lastValidation;
    }

    /**
     * @throws PipelineOrderingException if {@link #extract()} has not run
     */
    public Dataset transform() {
        if (rawDataset == null) {
            throw new PipelineOrderingException("extract() must run before transform()");
        }
        processedDataset = transformEngine.transform(rawDataset, getLastViolations());
        return processedDataset;
    }

    /**
     * @throws PipelineOrderingException if {@link #transform()} has not run
     */
    public void load() throws IOException {
        if (processedDataset == null) {
            throw new PipelineOrderingException("transform() must run before load()");
        }
        writerService.write(processedDataset, outputPath);
    }

    /**
     * @throws PipelineOrderingException if {@link #transform()} has not run
     */
    public SummaryReport generateSummaryReport() {
        if (processedDataset == null) {
            throw new PipelineOrderingException("transform() must run before generateSummaryReport()");
        }
        return reportService.generate(rawDataset, processedDataset, getLastViolations(), LocalDateTime.now(clock));
    }

    /**
     * Execute the whole pipeline. Any failure is logged and re-thrown unchanged.
     *
     * Log lines carry the caller's run id when one is already set; otherwise a
     * new id is started here and cleared when the run ends.
     *
     * @return the summary report of the run
     */
    public SummaryReport run() throws IOException {
        boolean ownsRunId = !RunIdUtil.hasRunId();
        String runId = ownsRunId ? RunIdUtil.startRun() : RunIdUtil.getCurrentRunId();
        log.info(BANNER);
        log.info("STARTING ETL PIPELINE (run {})", runId);
        log.info(BANNER);

        try {
            extract();

            ValidationResult rawValidation = validate(rawDataset);
            if (!rawValidation.isPassed()) {
                log.warn("Data quality issues detected, continuing with transformation...");
            }

            transform();

            validate(processedDataset);

            load();

            SummaryReport report = generateSummaryReport();

            log.info(BANNER);
            log.info("ETL PIPELINE COMPLETED SUCCESSFULLY");
            log.info(BANNER);
            return report;

        } catch (IOException | RuntimeException e) {
            log.error("ETL pipeline failed: {}", e.getMessage(), e);
            throw e;
        } finally {
            if (ownsRunId) {
                RunIdUtil.clearRunId();
            }
        }
    }

    public Path getInputPath() {
        return inputPath;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public Dataset getRawDataset() {
        return rawDataset;
    }

    public Dataset getProcessedDataset() {
        return processedDataset;
    }

    public ValidationResult getLastValidation() {
        return lastValidation;
    }

    private List<ViolationRecord> getLastViolations() {
        return lastValidation != null ? lastValidation.getViolations() : List.of();
    }
}
