package teranet.mapdev.propertyetl.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide beans.
 */
@Configuration
public class AppConfig {

    /**
     * Source of "now" for temporal enrichment and report timestamps.
     * Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
