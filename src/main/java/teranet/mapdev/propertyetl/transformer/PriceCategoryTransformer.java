package teranet.mapdev.propertyetl.transformer;

import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.PriceCategory;
import teranet.mapdev.propertyetl.model.TransformContext;

import java.util.List;

/**
 * Labels each listing with its price band in {@code categoria_precio}.
 */
public class PriceCategoryTransformer implements DatasetTransformer {

    @Override
    public String getName() {
        return "price-category";
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(ListingColumns.PRICE);
    }

    @Override
    public Dataset transform(Dataset dataset, TransformContext context) {
        return dataset.withColumn(ListingColumns.PRICE_CATEGORY, row -> PriceCategory
                .of(TransformerUtils.toDouble(row.get(ListingColumns.PRICE)))
                .getLabel());
    }
}
