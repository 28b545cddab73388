package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.config.EtlConfig;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Creates a fresh {@link EtlPipeline} per run, wired with the shared stateless services.
 */
@Service
@Slf4j
public class EtlPipelineFactory {

    private final EtlConfig etlConfig;
    private final DatasetReaderService readerService;
    private final DataQualityValidator validator;
    private final TransformEngine transformEngine;
    private final DatasetWriterService writerService;
    private final SummaryReportService reportService;
    private final Clock clock;

    public EtlPipelineFactory(EtlConfig etlConfig,
                              DatasetReaderService readerService,
                              DataQualityValidator validator,
                              TransformEngine transformEngine,
                              DatasetWriterService writerService,
                              SummaryReportService reportService,
                              Clock clock) {
        this.etlConfig = etlConfig;
        this.readerService = readerService;
        this.validator = validator;
        this.transformEngine = transformEngine;
        this.writerService = writerService;
        this.reportService = reportService;
        this.clock = clock;
    }

    /**
     * Pipeline over the configured input and output paths.
     */
    public EtlPipeline create() {
        return create(Path.of(etlConfig.getInputPath()), Path.of(etlConfig.getOutputPath()));
    }

    public EtlPipeline create(Path inputPath, Path outputPath) {
        log.debug("Creating pipeline: {} -> {}", inputPath, outputPath);
        return new EtlPipeline(inputPath, outputPath, readerService, validator,
                transformEngine, writerService, reportService, clock);
    }
}
