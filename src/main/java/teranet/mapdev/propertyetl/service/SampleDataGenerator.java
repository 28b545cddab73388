package teranet.mapdev.propertyetl.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.propertyetl.model.Dataset;
import teranet.mapdev.propertyetl.model.ListingColumns;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Generates synthetic listing data for demos and local runs.
 *
 * Output is fully determined by the record count, the seed and the supplied
 * "now", so two runs with the same inputs produce the same dataset.
 */
@Service
@Slf4j
public class SampleDataGenerator {

    public static final String COMMUNE = "comuna";
    public static final String BEDROOMS = "habitaciones";
    public static final String BATHROOMS = "banos";
    public static final String STATUS = "estado";
    public static final String DESCRIPTION = "descripcion";

    private static final List<String> PROPERTY_TYPES = List.of(
            "Departamento", "Casa", "Oficina", "Local Comercial", "Terreno");
    private static final List<String> COMMUNES = List.of(
            "Las Condes", "Providencia", "Ñuñoa", "Vitacura", "La Reina",
            "Santiago Centro", "Maipú", "Puente Alto", "San Miguel", "La Florida");
    private static final List<String> STATUSES = List.of(
            "Disponible", "Reservado", "Vendido", "En Remodelación");

    private static final double[] BEDROOM_WEIGHTS = {0.1, 0.3, 0.3, 0.2, 0.1};
    private static final double[] BATHROOM_WEIGHTS = {0.2, 0.4, 0.3, 0.1};
    private static final double[] STATUS_WEIGHTS = {0.6, 0.15, 0.2, 0.05};

    private static final double PRICE_MEAN = 250_000;
    private static final double PRICE_STD = 100_000;
    private static final double AREA_MEAN = 80;
    private static final double AREA_STD = 30;
    private static final int MAX_AGE_DAYS = 365;

    public static final List<String> COLUMNS = List.of(
            ListingColumns.ID, ListingColumns.PROPERTY_TYPE, COMMUNE, ListingColumns.PRICE,
            ListingColumns.AREA_M2, BEDROOMS, BATHROOMS, STATUS, ListingColumns.PUBLISHED_AT, DESCRIPTION);

    /**
     * Build a synthetic listing dataset.
     *
     * @param records              number of listings
     * @param seed                 random seed
     * @param now                  reference time for publication dates
     * @param nullDescriptionRatio share of descriptions left missing
     */
    public Dataset generate(int records, long seed, LocalDateTime now, double nullDescriptionRatio) {
        if (records < 0) {
            throw new IllegalArgumentException("Record count must not be negative: " + records);
        }
        Random random = new Random(seed);
        Set<Integer> missingDescriptions = pickIndexes(random, records, (int) (records * nullDescriptionRatio));

        Dataset.Builder builder = Dataset.builder(COLUMNS);
        for (int i = 0; i < records; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ListingColumns.ID, String.format("PROP-%04d", i + 1));
            row.put(ListingColumns.PROPERTY_TYPE, pick(random, PROPERTY_TYPES));
            row.put(COMMUNE, pick(random, COMMUNES));
            row.put(ListingColumns.PRICE, Math.abs((long) (PRICE_MEAN + PRICE_STD * random.nextGaussian())));
            row.put(ListingColumns.AREA_M2, Math.abs((long) (AREA_MEAN + AREA_STD * random.nextGaussian())));
            row.put(BEDROOMS, 1L + weightedIndex(random, BEDROOM_WEIGHTS));
            row.put(BATHROOMS, 1L + weightedIndex(random, BATHROOM_WEIGHTS));
            row.put(STATUS, STATUSES.get(weightedIndex(random, STATUS_WEIGHTS)));
            row.put(ListingColumns.PUBLISHED_AT, now.minusDays(1 + random.nextInt(MAX_AGE_DAYS)));
            row.put(DESCRIPTION, missingDescriptions.contains(i)
                    ? null
                    : String.format("Propiedad %d en excelente ubicación", i + 1));
            builder.addRow(row);
        }

        log.info("Generated {} sample listing records (seed={})", records, seed);
        return builder.build();
    }

    private static String pick(Random random, List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    private static int weightedIndex(Random random, double[] weights) {
        double draw = random.nextDouble();
        double cumulative = 0;
        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (draw < cumulative) {
                return i;
            }
        }
        return weights.length - 1;
    }

    private static Set<Integer> pickIndexes(Random random, int bound, int count) {
        List<Integer> all = new ArrayList<>();
        for (int i = 0; i < bound; i++) {
            all.add(i);
        }
        Collections.shuffle(all, random);
        return new HashSet<>(all.subList(0, Math.min(count, bound)));
    }
}
