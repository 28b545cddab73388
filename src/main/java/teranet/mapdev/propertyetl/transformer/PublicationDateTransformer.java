package teranet.mapdev.propertyetl.transformer;

import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.TransformContext;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Parses the publication date and derives listing age, month and year.
 *
 * Transformations applied:
 * 1. fecha_publicacion parsed to a date-time (unparseable becomes missing)
 * 2. antiguedad_dias = whole days from publication to the run start; negative
 *    for future dates, no clamping
 * 3. mes_publicacion / año_publicacion = month and year of publication
 *
 * All three derived values are missing when the date is missing.
 */
public class PublicationDateTransformer implements DatasetTransformer {

    @Override
    public String getName() {
        return "publication-date";
    }

    @Override
    public List<String> getRequiredColumns() {
        return List.of(ListingColumns.PUBLISHED_AT);
    }

    @Override
    public Dataset transform(Dataset dataset, TransformContext context) {
        LocalDateTime now = context.getRunStartedAt();

        Dataset parsed = dataset.withColumn(ListingColumns.PUBLISHED_AT,
                row -> TransformerUtils.parseDateTime(row.get(ListingColumns.PUBLISHED_AT)));

        return parsed
                .withColumn(ListingColumns.DAYS_LISTED,
                        row -> TransformerUtils.daysBetween(publishedAt(row.get(ListingColumns.PUBLISHED_AT)), now))
                .withColumn(ListingColumns.PUBLICATION_MONTH, row -> {
                    LocalDateTime publishedAt = publishedAt(row.get(ListingColumns.PUBLISHED_AT));
                    return publishedAt == null ? null : publishedAt.getMonthValue();
                })
                .withColumn(ListingColumns.PUBLICATION_YEAR, row -> {
                    LocalDateTime publishedAt = publishedAt(row.get(ListingColumns.PUBLISHED_AT));
                    return publishedAt == null ? null : publishedAt.getYear();
                });
    }

    private static LocalDateTime publishedAt(Object value) {
        return value instanceof LocalDateTime ? (LocalDateTime) value : null;
    }
}
