package teranet.mapdev.propertyetl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Real-estate listing ETL: validates, cleans and enriches a listing file and
 * writes the processed result plus a summary report.
 */
@SpringBootApplication
public class PropertyEtlApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertyEtlApplication.class, args);
    }
}
