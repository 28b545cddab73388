package teranet.mapdev.propertyetl.transformer;

import org.junit.jupiter.api.Test;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.model.TransformContext;
import teranet.mapdev.propertyetl.util.TestDataFactory;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PublicationDateTransformerTest {

    private final PublicationDateTransformer transformer = new PublicationDateTransformer();
    private final TransformContext context = TransformContext.startingAt(TestDataFactory.NOW);

    @Test
    void testTransform_DerivesAgeMonthAndYear() {
        // Given: run starts 2024-06-30 12:00
        Dataset dataset = TestDataFactory.dataset(List.of(ListingColumns.PUBLISHED_AT),
                new Object[]{"2024-06-20"},
                new Object[]{"2024-05-30 09:15:00"},
                new Object[]{"garbage"},
                new Object[]{null});

        // When
        Dataset result = transformer.transform(dataset, context);

        // Then
        assertThat(result.getColumnValues(ListingColumns.PUBLISHED_AT)).containsExactly(
                LocalDateTime.of(2024, 6, 20, 0, 0), LocalDateTime.of(2024, 5, 30, 9, 15), null, null);
        assertThat(result.getColumnValues(ListingColumns.DAYS_LISTED)).containsExactly(10L, 31L, null, null);
        assertThat(result.getColumnValues(ListingColumns.PUBLICATION_MONTH)).containsExactly(6, 5, null, null);
        assertThat(result.getColumnValues(ListingColumns.PUBLICATION_YEAR)).containsExactly(2024, 2024, null, null);
    }

    @Test
    void testTransform_FutureDateGivesNegativeAge() {
        Dataset dataset = TestDataFactory.dataset(List.of(ListingColumns.PUBLISHED_AT),
                new Object[]{TestDataFactory.NOW.plusHours(6)},
                new Object[]{TestDataFactory.NOW.plusDays(3)});

        Dataset result = transformer.transform(dataset, context);

        assertThat(result.getColumnValues(ListingColumns.DAYS_LISTED)).containsExactly(-1L, -3L);
    }

    @Test
    void testTransform_DerivedColumnsAppendedInOrder() {
        Dataset dataset = TestDataFactory.dataset(List.of("id_propiedad", ListingColumns.PUBLISHED_AT),
                new Object[]{"PROP-0001", "2024-06-20"});

        Dataset result = transformer.transform(dataset, context);

        assertThat(result.getColumns()).containsExactly("id_propiedad", ListingColumns.PUBLISHED_AT,
                ListingColumns.DAYS_LISTED, ListingColumns.PUBLICATION_MONTH, ListingColumns.PUBLICATION_YEAR);
    }
}
