package com.boxoffice.enrichment;

import com.boxoffice.config.EnricherConfig;
import com.boxoffice.config.PipelineConfigurationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates {@link Enricher} instances from configuration using reflection.
 * Keeps the job agnostic to concrete enricher implementations.
 */
@Slf4j
public final class EnricherFactory {

    private EnricherFactory() {
        // utility class
    }

    /**
     * Instantiates the enricher named by {@code className}, then initialises it.
     *
     * @throws PipelineConfigurationException if the class is missing or not an {@link Enricher}
     */
    @SuppressWarnings("unchecked")
    public static <T> Enricher<T> create(EnricherConfig config) {
        try {
            Class<?> clazz = Class.forName(config.getClassName());
            if (!Enricher.class.isAssignableFrom(clazz)) {
                throw new PipelineConfigurationException(
                        "Class " + config.getClassName() + " does not implement Enricher");
            }
            Enricher<T> enricher = (Enricher<T>) clazz.getDeclaredConstructor().newInstance();
            enricher.init(config);
            log.info("Created enricher '{}' from class {}", config.getName(), config.getClassName());
            return enricher;
        } catch (ReflectiveOperationException e) {
            throw new PipelineConfigurationException("Failed to create enricher: " + config.getName(), e);
        }
    }
}
