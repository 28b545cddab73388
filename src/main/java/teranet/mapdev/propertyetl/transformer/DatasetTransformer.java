package teranet.mapdev.propertyetl.transformer;

import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.TransformContext;

import java.util.List;

/**
 * One cleaning or enrichment step of the transform engine.
 *
 * Implementations:
 * - Never modify the dataset they receive; they return a derived copy
 * - Never throw on malformed field values; those become missing values
 * - Are skipped by the engine when any required column is absent
 *
 * Steps are stateless and may be shared between engine instances.
 */
public interface DatasetTransformer {

    /**
     * Short name used in logs.
     */
    String getName();

    /**
     * Columns that must be present for this step to run.
     *
     * @return required column names (empty when the step always applies)
     */
    List<String> getRequiredColumns();

    /**
     * Apply this step.
     *
     * @param dataset the current dataset state
     * @param context run-scoped state such as the run timestamp
     * @return the transformed copy
     */
    Dataset transform(Dataset dataset, TransformContext context);

    /**
     * Check if this step has its source columns in the given dataset.
     *
     * @return true if {@link #transform} should run, false to skip the step
     */
    default boolean appliesTo(Dataset dataset) {
        return dataset.getColumns().containsAll(getRequiredColumns());
    }
}
