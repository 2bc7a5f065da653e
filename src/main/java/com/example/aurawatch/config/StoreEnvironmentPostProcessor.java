package com.example.aurawatch.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * With {@code monitor.store.enabled=false} the data source, Hibernate and the
 * repositories are left out of the context, so no database is ever opened.
 */
public class StoreEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String EXCLUDE_PROPERTY = "spring.autoconfigure.exclude";
    static final String PROPERTY_SOURCE_NAME = "monitorStoreDisabled";

    private static final String STORE_EXCLUDES = String.join(",",
        DataSourceAutoConfiguration.class.getName(),
        HibernateJpaAutoConfiguration.class.getName(),
        JpaRepositoriesAutoConfiguration.class.getName());

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        if (environment.getProperty("monitor.store.enabled", Boolean.class, true)) {
            return;
        }
        String existing = environment.getProperty(EXCLUDE_PROPERTY);
        String excludes = existing == null || existing.isBlank() ? STORE_EXCLUDES : existing + "," + STORE_EXCLUDES;
        environment.getPropertySources().addFirst(
            new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(EXCLUDE_PROPERTY, excludes)));
    }
}
