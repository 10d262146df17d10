package com.formulagrid.app.config;

import com.formulagrid.app.services.RecalculationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Puts a three-cell chain into the grid at startup when grid.seed-sample is on,
 * so a fresh instance has something to recalculate.
 */
@Component
public class GridSeeder implements ApplicationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(GridSeeder.class);

    static final Map<String, String> SAMPLE = new LinkedHashMap<>();

    static {
        SAMPLE.put("A1", "5");
        SAMPLE.put("B1", "=A1+3");
        SAMPLE.put("C1", "=B1*2");
    }

    private final RecalculationEngine engine;
    private final GridProperties properties;

    public GridSeeder(RecalculationEngine engine, GridProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isSeedSample()) {
            return;
        }
        SAMPLE.forEach(engine::applyEdit);
        LOG.info("Seeded sample cells {}", SAMPLE.keySet());
    }
}
