package com.example.careplan.util;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.config.properties.FlagSchemaProperties;
import com.example.careplan.config.properties.IntakeCatalogProperties;
import com.example.careplan.config.properties.JourneyProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Binds the shipped application.yml without starting a Spring context, so unit tests run
 * against the real question catalog, flag schema and cost tables.
 */
public final class CarePlanTestProperties {

    private static final Binder BINDER = createBinder();

    private CarePlanTestProperties() {}

    /**
     * Returns a fresh, mutable copy on every call.
     */
    public static CarePlanProperties carePlanProperties() {
        return BINDER.bind("careplan", CarePlanProperties.class).get();
    }

    public static IntakeCatalogProperties intakeCatalog() {
        return BINDER.bind("careplan.intake", IntakeCatalogProperties.class).get();
    }

    public static FlagSchemaProperties flagSchema() {
        return BINDER.bind("careplan.flags", FlagSchemaProperties.class).get();
    }

    public static JourneyProperties journey() {
        return BINDER.bind("careplan.journey", JourneyProperties.class).get();
    }

    private static Binder createBinder() {
        StandardEnvironment environment = new StandardEnvironment();
        try {
            List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                    .load("application", new ClassPathResource("application.yml"));
            sources.forEach(source -> environment.getPropertySources().addLast(source));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read application.yml", e);
        }
        return Binder.get(environment);
    }
}
