package teranet.mapdev.propertyetl.transformer;

import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.TransformContext;

import java.util.List;

/**
 * Derives price divided by area into a target column.
 *
 * The engine runs this twice, once for {@code precio_m2} and once for
 * {@code ratio_precio_superficie}. Both columns are published because
 * downstream consumers read either name. A non-positive or missing area, or a
 * missing price, yields a missing value.
 */
public class PricePerAreaTransformer implements DatasetTransformer {

    private final String targetColumn;

    public PricePerAreaTransformer(String targetColumn) {
        this.targetColumn = targetColumn;
    }

    public String getTargetColumn() {
        return targetColumn;
    }

    @Override
    public String getName() {
        return "price-per-area[" + targetColumn + "]";
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(ListingColumns.PRICE, ListingColumns.AREA_M2);
    }

    @Override
    public Dataset transform(Dataset dataset, TransformContext context) {
        return dataset.withColumn(targetColumn, row -> TransformerUtils.pricePerArea(
                row.get(ListingColumns.PRICE), row.get(ListingColumns.AREA_M2)));
    }
}
