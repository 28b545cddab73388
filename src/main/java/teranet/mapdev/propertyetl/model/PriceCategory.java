package teranet.mapdev.propertyetl.model;

/**
 * Price bands for listings. Bands are checked in declaration order and the
 * first match wins; a missing price falls through to {@link #UNDEFINED}.
 */
public enum PriceCategory {

    ECONOMIC("Económico"),
    MEDIUM("Medio"),
    PREMIUM("Premium"),
    UNDEFINED("No definido");

    public static final double MEDIUM_LOWER_BOUND = 100_000d;
    public static final double PREMIUM_LOWER_BOUND = 300_000d;

    private final String label;

    PriceCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static PriceCategory of(Double price) {
        if (price == null || price.isNaN()) {
            return UNDEFINED;
        }
        if (price < MEDIUM_LOWER_BOUND) {
            return ECONOMIC;
        }
        if (price >= MEDIUM_LOWER_BOUND && price < PREMIUM_LOWER_BOUND) {
            return MEDIUM;
        }
        if (price >= PREMIUM_LOWER_BOUND) {
            return PREMIUM;
        }
        return UNDEFINED;
    }
}
