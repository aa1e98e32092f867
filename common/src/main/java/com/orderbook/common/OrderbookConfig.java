package com.orderbook.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Book sizing and instrumentation settings loaded from orderbook.yml (or classpath default).
 * All fields have sensible defaults so a book can be built without any file.
 */
public final class OrderbookConfig {

    private static final Logger log = LoggerFactory.getLogger(OrderbookConfig.class);

    // Sizing
    public int orderIndexCapacity = 1024;   // initial capacity of the id -> order index
    public int levelPoolCapacity = 1024;    // price levels kept for reuse once emptied

    // Instrumentation
    public boolean trackLatency = false;

    public static OrderbookConfig defaults() {
        return new OrderbookConfig();
    }

    public static OrderbookConfig load(String path) {
        OrderbookConfig cfg = new OrderbookConfig();
        try (InputStream is = path != null && Files.exists(Paths.get(path))
                ? Files.newInputStream(Paths.get(path))
                : OrderbookConfig.class.getResourceAsStream("/orderbook.yml")) {
            if (is == null) return cfg;
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
        } catch (Exception e) {
            log.warn("Failed to load orderbook config from {}, using defaults: {}", path, e.getMessage());
            return new OrderbookConfig();
        }
        cfg.validate();
        return cfg;
    }

    private static void applyMap(OrderbookConfig cfg, Map<String, Object> map) {
        if (map.containsKey("orderIndexCapacity")) cfg.orderIndexCapacity = ((Number) map.get("orderIndexCapacity")).intValue();
        if (map.containsKey("levelPoolCapacity")) cfg.levelPoolCapacity = ((Number) map.get("levelPoolCapacity")).intValue();
        if (map.containsKey("trackLatency")) cfg.trackLatency = (Boolean) map.get("trackLatency");
    }

    /** Rejects values the book cannot be built with. */
    public void validate() {
        if (orderIndexCapacity < 0) {
            throw new IllegalArgumentException("orderIndexCapacity must be >= 0: " + orderIndexCapacity);
        }
        if (levelPoolCapacity < 0) {
            throw new IllegalArgumentException("levelPoolCapacity must be >= 0: " + levelPoolCapacity);
        }
    }

    @Override
    public String toString() {
        return "OrderbookConfig{orderIndexCapacity=" + orderIndexCapacity
                + ", levelPoolCapacity=" + levelPoolCapacity
                + ", trackLatency=" + trackLatency + '}';
    }
}
