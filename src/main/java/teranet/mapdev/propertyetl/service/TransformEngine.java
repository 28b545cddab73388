package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.exception.PipelineOrderingException;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.TransformContext;
import teranet.mapdev.propertyetl.model.ViolationRecord;
import teranet.mapdev.propertyetl.transformer.DatasetTransformer;
import teranet.mapdev.propertyetl.transformer.DeduplicationTransformer;
import teranet.mapdev.propertyetl.transformer.PriceCategoryTransformer;
import teranet.mapdev.propertyetl.transformer.PriceNormalizationTransformer;
import teranet.mapdev.propertyetl.transformer.PricePerAreaTransformer;
import teranet.mapdev.propertyetl.transformer.PublicationDateTransformer;
import teranet.mapdev.propertyetl.transformer.TextNormalizationTransformer;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Applies the listing cleaning and enrichment steps in a fixed order.
 *
 * Order matters: prices must be numeric before they are divided or
 * categorized, and deduplication runs last so derived columns are computed
 * for every record first. A step whose source columns are absent is skipped.
 *
 * The input dataset is never modified; the engine returns a derived copy.
 */
@Service
@Slf4j
public class TransformEngine {

    private final Clock clock;
    private final List<DatasetTransformer> steps;

    @Autowired
    public TransformEngine(Clock clock) {
        this(clock, defaultSteps());
    }

    public TransformEngine(Clock clock, List<DatasetTransformer> steps) {
        this.clock = clock;
        this.steps = List.copyOf(steps);
    }

    /**
     * The listing pipeline steps, in execution order.
     */
    public static List<DatasetTransformer> defaultSteps() {
        return List.of(
                new TextNormalizationTransformer(),
                new PriceNormalizationTransformer(),
                new PricePerAreaTransformer(ListingColumns.PRICE_PER_M2),
                new PriceCategoryTransformer(),
                new PublicationDateTransformer(),
                new PricePerAreaTransformer(ListingColumns.PRICE_AREA_RATIO),
                new DeduplicationTransformer(ListingColumns.ID));
    }

    public List<DatasetTransformer> getSteps() {
        return steps;
    }

    public Dataset transform(Dataset dataset) {
        return transform(dataset, List.of());
    }

    /**
     * Run every step over the dataset.
     *
     * @param dataset             the extracted dataset
     * @param precedingViolations findings of the validation pass that ran before
     * @return the transformed copy
     * @throws PipelineOrderingException if no dataset has been extracted
     */
    public Dataset transform(Dataset dataset, List<ViolationRecord> precedingViolations) {
        if (dataset == null) {
            throw new PipelineOrderingException("No dataset has been extracted; run extract() first");
        }

        log.info("Starting data transformation on {} records", dataset.size());
        TransformContext context = new TransformContext(LocalDateTime.now(clock), List.copyOf(precedingViolations));

        Dataset current = dataset;
        for (DatasetTransformer step : steps) {
            if (!step.appliesTo(current)) {
                log.debug("Skipping step '{}': missing columns {}", step.getName(), step.getRequiredColumns());
                continue;
            }
            current = step.transform(current, context);
            log.debug("Step '{}' done: {} records, {} columns", step.getName(), current.size(), current.columnCount());
        }

        log.info("Transformation completed: {} records processed", current.size());
        return current;
    }
}
