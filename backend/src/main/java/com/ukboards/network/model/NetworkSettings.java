package com.ukboards.network.model;

import java.util.Map;

/**
 * Crawl policy shared by both registries.
 */
public interface NetworkSettings {

    int branches();

    boolean resetCache();

    boolean composeQueriedNetworks();

    /**
     * Every option as an ordered map, recorded with each run to spot policy changes between runs.
     */
    Map<String, Object> parameterState();
}
