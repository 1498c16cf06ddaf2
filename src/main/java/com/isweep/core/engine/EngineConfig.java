package com.isweep.core.engine;

import com.isweep.core.rules.FilterRules;
import com.isweep.core.rules.FilterRulesLoader;
import com.isweep.core.rules.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring {@link Configuration} for the decision engine: the validated
 * {@link FilterRules} and the bounded executor used for preference lookups.
 * <p>
 * An invalid or missing rules document fails the application context, so the
 * service never starts with partial rules.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String LOOKUP_EXECUTOR = "preferencesLookupExecutor";

    @Bean
    public FilterRules filterRules(EngineProperties properties, ResourceLoader resourceLoader) {
        String location = properties.getRulesLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new InvalidConfigurationException("Rules document not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return FilterRulesLoader.load(in, location);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read rules document " + location, e);
        }
    }

    @Bean(name = LOOKUP_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService preferencesLookupExecutor(EngineProperties properties) {
        int threads = Math.max(1, properties.getLookupThreads());
        log.info("Preferences lookups: {} threads, timeout {} ms",
                threads, properties.getPreferencesTimeout().toMillis());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "preferences-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
