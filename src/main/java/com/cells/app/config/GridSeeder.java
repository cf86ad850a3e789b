package com.cells.app.config;

import com.cells.app.models.CellKey;
import com.cells.app.services.GridService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the configured seed cells into the grid once the application has started.
 */
@Component
public class GridSeeder implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(GridSeeder.class);

    private final GridProperties properties;
    private final GridService gridService;

    public GridSeeder(GridProperties properties, GridService gridService) {
        this.properties = properties;
        this.gridService = gridService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getSeed().isEmpty()) {
            logger.info("No seed cells configured, starting with an empty grid");
            return;
        }
        // Invalid addresses fail startup with InvalidCellKeyException
        Map<CellKey, String> inputs = new LinkedHashMap<>();
        properties.getSeed().forEach((key, text) -> inputs.put(CellKey.parse(key), text));
        gridService.seed(inputs);
    }
}
