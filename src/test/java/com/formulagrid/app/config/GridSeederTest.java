package com.formulagrid.app.config;

import com.formulagrid.app.FormulaGridApplication;
import com.formulagrid.app.services.RecalculationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application with seeding switched on.
 */
@SpringBootTest(
        classes = FormulaGridApplication.class,
        properties = "grid.seed-sample=true"
)
@ActiveProfiles("test")
class GridSeederTest {

    @Autowired
    private RecalculationEngine engine;

    @Autowired
    private GridProperties properties;

    @Test
    void testSampleIsSeeded() {
        assertTrue(properties.isSeedSample());

        Map<String, String> data = engine.getAllCellValues();
        assertEquals("5", data.get("A1"));
        assertEquals("8", data.get("B1"));
        assertEquals("16", data.get("C1"));
        assertEquals(GridSeeder.SAMPLE.size(), data.size());
    }
}
