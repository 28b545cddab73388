package teranet.mapdev.propertyetl.transformer;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.TransformContext;

import java.util.List;

/**
 * Trims and title-cases every text-typed column.
 *
 * The set of columns is not fixed: any column holding at least one String is
 * normalized. Non-string values in such a column are converted to their text
 * form first (plain notation for decimals); missing values stay missing.
 */
@Slf4j
public class TextNormalizationTransformer implements DatasetTransformer {

    @Override
    public String getName() {
        return "text-normalization";
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of();
    }

    @Override
    public Dataset transform(Dataset dataset, TransformContext context) {
        Dataset result = dataset;
        for (String column : dataset.getColumns()) {
            if (!TransformerUtils.isTextColumn(dataset, column)) {
                continue;
            }
            log.debug("Normalizing text column '{}'", column);
            result = result.withColumn(column, row -> {
                Object value = row.get(column);
                return TransformerUtils.toTitleCase(TransformerUtils.toText(value));
            });
        }
        return result;
    }
}
