package com.clob.infra;

import com.clob.core.EngineConfig;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Host configuration loaded from {@code clob.yml} (explicit path, else the
 * classpath default, else built-in defaults).
 */
public final class ServerConfig {

    // Sequencer
    public int ringBufferSize = 1024;
    public boolean busySpin = false;

    // Journal
    public String journalPath = "clob-journal";

    // Engine
    public EngineConfig engine = new EngineConfig();

    public static ServerConfig load(String path) {
        ServerConfig cfg = new ServerConfig();
        try (InputStream is = open(path)) {
            if (is == null) return cfg.validate();
            Map<String, Object> map = new Yaml().load(is);
            if (map != null) applyMap(cfg, map);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read configuration " + path, e);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException("malformed configuration " + path + ": " + e.getMessage(), e);
        }
        return cfg.validate();
    }

    private static InputStream open(String path) throws IOException {
        if (path != null) {
            Path file = Paths.get(path);
            if (!Files.exists(file)) {
                throw new IllegalArgumentException("configuration file not found: " + path);
            }
            return Files.newInputStream(file);
        }
        return ServerConfig.class.getResourceAsStream("/clob.yml");
    }

    @SuppressWarnings("unchecked")
    private static void applyMap(ServerConfig cfg, Map<String, Object> map) {
        if (map.containsKey("ringBufferSize")) cfg.ringBufferSize = ((Number) map.get("ringBufferSize")).intValue();
        if (map.containsKey("busySpin")) cfg.busySpin = (boolean) map.get("busySpin");
        if (map.containsKey("journalPath")) cfg.journalPath = (String) map.get("journalPath");

        Map<String, Object> engine = (Map<String, Object>) map.get("engine");
        if (engine == null) return;
        EngineConfig e = cfg.engine;
        if (engine.containsKey("precision")) e.precision = ((Number) engine.get("precision")).longValue();
        if (engine.containsKey("feeBps")) e.feeBps = ((Number) engine.get("feeBps")).intValue();
        if (engine.containsKey("escrowAccount")) e.escrowAccount = ((Number) engine.get("escrowAccount")).longValue();
        if (engine.containsKey("feeRecipient")) e.feeRecipient = ((Number) engine.get("feeRecipient")).longValue();
        if (engine.containsKey("maxOrdersPerMatch")) e.maxOrdersPerMatch = ((Number) engine.get("maxOrdersPerMatch")).intValue();
    }

    public ServerConfig validate() {
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("ringBufferSize must be a power of two: " + ringBufferSize);
        }
        engine.validate();
        return this;
    }
}
