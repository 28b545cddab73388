package teranet.mapdev.propertyetl.transformer;

import org.junit.jupiter.api.Test;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.TransformContext;
import teranet.mapdev.propertyetl.model.ViolationRecord;
import teranet.mapdev.propertyetl.util.TestDataFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeduplicationTransformerTest {

    private final DeduplicationTransformer transformer = new DeduplicationTransformer(ListingColumns.ID);
    private final TransformContext context = TransformContext.startingAt(TestDataFactory.NOW);

    private Dataset listings() {
        return TestDataFactory.dataset(List.of(ListingColumns.ID, ListingColumns.PRICE),
                new Object[]{"A", 1L},
                new Object[]{"B", 2L},
                new Object[]{"A", 3L},
                new Object[]{null, 4L},
                new Object[]{"C", 5L},
                new Object[]{null, 6L});
    }

    @Test
    void testTransform_KeepsFirstOccurrenceInOrder() {
        Dataset result = transformer.transform(listings(), context);

        assertThat(result.getColumnValues(ListingColumns.ID)).containsExactly("A", "B", null, "C");
        assertThat(result.getColumnValues(ListingColumns.PRICE)).containsExactly(1L, 2L, 4L, 5L);
    }

    @Test
    void testTransform_IsIdempotent() {
        Dataset once = transformer.transform(listings(), context);
        Dataset twice = transformer.transform(once, context);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void testTransform_NoDuplicatesKeepsEverything() {
        Dataset dataset = TestDataFactory.cleanDataset();

        assertThat(transformer.transform(dataset, context)).isEqualTo(dataset);
    }

    @Test
    void testTransform_PrecedingViolationsDoNotChangeResult() {
        // Given: the earlier validation pass reported a different duplicate count
        TransformContext reported = new TransformContext(TestDataFactory.NOW,
                List.of(ViolationRecord.duplicateKeys(ListingColumns.ID, 7)));

        // When
        Dataset result = transformer.transform(listings(), reported);

        // Then
        assertThat(result).isEqualTo(transformer.transform(listings(), context));
    }
}
