package teranet.mapdev.propertyetl.transformer;

import org.junit.jupiter.api.Test;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.TransformContext;
import teranet.mapdev.propertyetl.util.TestDataFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DatasetTransformerTest {

    private final DatasetTransformer needsAB = new DatasetTransformer() {
        @Override
        public String getName() {
            return "needs-a-b";
        }

        @Override
        public List<String> getRequiredColumns() {
            return List.of("a", "b");
        }

        @Override
        public Dataset transform(Dataset dataset, TransformContext context) {
            return dataset;
        }
    };

    @Test
    void testAppliesTo_AllRequiredColumnsPresent() {
        Dataset dataset = TestDataFactory.dataset(List.of("b", "x", "a"));

        assertThat(needsAB.appliesTo(dataset)).isTrue();
    }

    @Test
    void testAppliesTo_AnyRequiredColumnMissing() {
        Dataset dataset = TestDataFactory.dataset(List.of("a", "x"));

        assertThat(needsAB.appliesTo(dataset)).isFalse();
    }
}
