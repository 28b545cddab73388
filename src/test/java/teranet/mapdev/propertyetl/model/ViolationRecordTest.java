package teranet.mapdev.propertyetl.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ViolationRecordTest {

    @Test
    void testFactoryDescriptions() {
        assertThat(ViolationRecord.criticalNulls("precio", 3).getDescription())
                .isEqualTo("Column 'precio': 3 null values found");
        assertThat(ViolationRecord.negativePrices("precio", 2).getDescription())
                .isEqualTo("Negative prices found: 2");
        assertThat(ViolationRecord.duplicateKeys("id_propiedad", 1).getDescription())
                .isEqualTo("Duplicate records found: 1");
    }

    @Test
    void testFactoryTypesAndCounts() {
        ViolationRecord violation = ViolationRecord.negativePrices("precio", 2);

        assertThat(violation.getType()).isEqualTo(ViolationRecord.ViolationType.NEGATIVE_PRICE);
        assertThat(violation.getColumn()).isEqualTo("precio");
        assertThat(violation.getCount()).isEqualTo(2);
        assertThat(violation.toString()).isEqualTo("Negative prices found: 2");
    }
}
