package teranet.mapdev.propertyetl.model;

import java.util.List;

/**
 * Column names the pipeline recognises. Input files may carry any other
 * columns; these are only checked by name.
 */
public final class ListingColumns {

    // Source columns
    public static final String ID = "id_propiedad";
    public static final String PRICE = "precio";
    public static final String PROPERTY_TYPE = "tipo_propiedad";
    public static final String AREA_M2 = "superficie_m2";
    public static final String PUBLISHED_AT = "fecha_publicacion";

    // Derived columns
    public static final String PRICE_PER_M2 = "precio_m2";
    public static final String PRICE_CATEGORY = "categoria_precio";
    public static final String DAYS_LISTED = "antiguedad_dias";
    public static final String PUBLICATION_MONTH = "mes_publicacion";
    public static final String PUBLICATION_YEAR = "año_publicacion";
    public static final String PRICE_AREA_RATIO = "ratio_precio_superficie";

    /** Columns whose missing values count as a data-quality violation */
    public static final List<String> CRITICAL = List.of(ID, PRICE, PROPERTY_TYPE);

    private ListingColumns() {
    }
}
