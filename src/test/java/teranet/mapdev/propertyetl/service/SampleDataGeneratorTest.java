package teranet.mapdev.propertyetl.service;

import org.junit.jupiter.api.Test;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;
import teranet.mapdev.propertyetl.util.TestDataFactory;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleDataGeneratorTest {

    private final SampleDataGenerator generator = new SampleDataGenerator();

    @Test
    void testGenerate_ShapeAndMissingDescriptions() {
        // When
        Dataset dataset = generator.generate(150, 42L, TestDataFactory.NOW, 0.05);

        // Then
        assertThat(dataset.size()).isEqualTo(150);
        assertThat(dataset.getColumns()).containsExactlyElementsOf(SampleDataGenerator.COLUMNS);
        assertThat(dataset.getColumnValues(SampleDataGenerator.DESCRIPTION)).filteredOn(v -> v == null).hasSize(7);
        assertThat(dataset.getValue(0, ListingColumns.ID)).isEqualTo("PROP-0001");
        assertThat(dataset.getValue(149, ListingColumns.ID)).isEqualTo("PROP-0150");
    }

    @Test
    void testGenerate_ValueRanges() {
        Dataset dataset = generator.generate(200, 7L, TestDataFactory.NOW, 0.0);

        for (int i = 0; i < dataset.size(); i++) {
            assertThat((Long) dataset.getValue(i, ListingColumns.PRICE)).isNotNegative();
            assertThat((Long) dataset.getValue(i, ListingColumns.AREA_M2)).isNotNegative();
            assertThat((Long) dataset.getValue(i, SampleDataGenerator.BEDROOMS)).isBetween(1L, 5L);
            assertThat((Long) dataset.getValue(i, SampleDataGenerator.BATHROOMS)).isBetween(1L, 4L);
            LocalDateTime publishedAt = (LocalDateTime) dataset.getValue(i, ListingColumns.PUBLISHED_AT);
            assertThat(publishedAt).isBetween(TestDataFactory.NOW.minusDays(365), TestDataFactory.NOW.minusDays(1));
        }
        assertThat(dataset.getColumnValues(SampleDataGenerator.DESCRIPTION)).doesNotContainNull();
    }

    @Test
    void testGenerate_SameSeedSameDataset() {
        Dataset first = generator.generate(50, 42L, TestDataFactory.NOW, 0.1);
        Dataset second = generator.generate(50, 42L, TestDataFactory.NOW, 0.1);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void testGenerate_NegativeCountRejected() {
        assertThatThrownBy(() -> generator.generate(-1, 42L, TestDataFactory.NOW, 0.05))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
