package teranet.mapdev.propertyetl.model;

import org.junit.jupiter.api.Test;
import teranet.mapdev.propertyetl.util.TestDataFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    @Test
    void testWithColumn_AppendsNewColumnWithoutTouchingSource() {
        // Given
        Dataset source = TestDataFactory.cleanDataset();

        // When: deriving a column
        Dataset derived = source.withColumn("flag", row -> row.get(ListingColumns.ID) + "!");

        // Then: new column at the end, source unchanged
        assertThat(derived.getColumns()).endsWith("flag");
        assertThat(derived.getValue(0, "flag")).isEqualTo("PROP-0001!");
        assertThat(source.hasColumn("flag")).isFalse();
        assertThat(source.getRow(0)).doesNotContainKey("flag");
    }

    @Test
    void testWithColumn_ReplacesExistingColumnInPlace() {
        Dataset source = TestDataFactory.cleanDataset();

        Dataset derived = source.withColumn(ListingColumns.PRICE, row -> null);

        assertThat(derived.getColumns()).isEqualTo(source.getColumns());
        assertThat(derived.getColumnValues(ListingColumns.PRICE)).containsOnlyNulls();
        assertThat(source.getValue(0, ListingColumns.PRICE)).isEqualTo(150000L);
    }

    @Test
    void testSelectRows_KeepsGivenOrder() {
        Dataset source = TestDataFactory.cleanDataset();

        Dataset selected = source.selectRows(List.of(2, 0));

        assertThat(selected.getColumnValues(ListingColumns.ID)).containsExactly("PROP-0003", "PROP-0001");
        assertThat(source.size()).isEqualTo(3);
    }

    @Test
    void testRowViews_AreReadOnly() {
        Dataset dataset = TestDataFactory.cleanDataset();

        assertThatThrownBy(() -> dataset.getRow(0).put(ListingColumns.PRICE, 1L))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> dataset.getColumns().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testBuilder_MapRowsAddUnknownColumns() {
        // Given: a builder declaring one column
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("a", 1L);
        row.put("b", "x");

        // When
        Dataset dataset = Dataset.builder(List.of("a")).addRow(row).build();

        // Then
        assertThat(dataset.getColumns()).containsExactly("a", "b");
        assertThat(dataset.columnCount()).isEqualTo(2);
    }

    @Test
    void testBuilder_ShortPositionalRowsPadWithMissing() {
        Dataset dataset = Dataset.builder(List.of("a", "b", "c"))
                .addRow(Arrays.<Object>asList("x"))
                .build();

        assertThat(dataset.getRow(0)).containsEntry("a", "x").containsEntry("b", null).containsEntry("c", null);
    }

    @Test
    void testBuilder_TooManyPositionalValuesThrows() {
        Dataset.Builder builder = Dataset.builder(List.of("a"));

        assertThatThrownBy(() -> builder.addRow(Arrays.<Object>asList("x", "y")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEmpty() {
        Dataset dataset = Dataset.empty();

        assertThat(dataset.isEmpty()).isTrue();
        assertThat(dataset.columnCount()).isZero();
    }
}
