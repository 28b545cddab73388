package teranet.mapdev.propertyetl.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Price bands must partition the price domain: every present price gets
 * exactly one of Económico / Medio / Premium, and missing gets No definido.
 */
class PriceCategoryTest {

    @Test
    void testOf_Boundaries() {
        assertThat(PriceCategory.of(99999.99)).isEqualTo(PriceCategory.ECONOMIC);
        assertThat(PriceCategory.of(100000.0)).isEqualTo(PriceCategory.MEDIUM);
        assertThat(PriceCategory.of(299999.99)).isEqualTo(PriceCategory.MEDIUM);
        assertThat(PriceCategory.of(300000.0)).isEqualTo(PriceCategory.PREMIUM);
    }

    @Test
    void testOf_MissingIsUndefined() {
        assertThat(PriceCategory.of(null)).isEqualTo(PriceCategory.UNDEFINED);
        assertThat(PriceCategory.of(Double.NaN)).isEqualTo(PriceCategory.UNDEFINED);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-1e9, -0.01, 0.0, 1.0, 50000.0, 99999.99, 100000.0, 150000.0,
            299999.999, 300000.0, 1e12, Double.MAX_VALUE, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY})
    void testOf_EveryPresentPriceGetsADefinedBand(double price) {
        PriceCategory category = PriceCategory.of(price);

        assertThat(category).isIn(PriceCategory.ECONOMIC, PriceCategory.MEDIUM, PriceCategory.PREMIUM);
    }

    @Test
    void testLabels() {
        assertThat(PriceCategory.ECONOMIC.getLabel()).isEqualTo("Económico");
        assertThat(PriceCategory.MEDIUM.getLabel()).isEqualTo("Medio");
        assertThat(PriceCategory.PREMIUM.getLabel()).isEqualTo("Premium");
        assertThat(PriceCategory.UNDEFINED.getLabel()).isEqualTo("No definido");
    }
}
