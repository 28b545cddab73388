package teranet.mapdev.propertyetl.transformer;

import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.TransformContext;

import java.util.List;

/**
 * Rewrites the price column as numbers: every character that is not a digit or
 * a decimal point is dropped before parsing. Unparseable prices become missing.
 */
public class PriceNormalizationTransformer implements DatasetTransformer {

    @Override
    public String getName() {
        return "price-normalization";
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(ListingColumns.PRICE);
    }

    @Override
    public Dataset transform(Dataset dataset, TransformContext context) {
        return dataset.withColumn(ListingColumns.PRICE,
                row -> TransformerUtils.normalizePrice(row.get(ListingColumns.PRICE)));
    }
}
