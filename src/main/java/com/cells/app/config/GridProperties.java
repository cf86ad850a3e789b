package com.cells.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under "cells.grid".
 * seed: initial cell texts keyed by address, e.g. cells.grid.seed.A1=Some values
 */
@ConfigurationProperties(prefix = "cells.grid")
public class GridProperties {

    private Map<String, String> seed = new LinkedHashMap<>();

    public Map<String, String> getSeed() {
        return seed;
    }

    public void setSeed(Map<String, String> seed) {
        this.seed = seed;
    }
}
