package com.clob.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @TempDir
    Path dir;

    @Test
    void shouldLoadClasspathDefaults() {
        ServerConfig config = ServerConfig.load(null);

        assertEquals(1024, config.ringBufferSize);
        assertFalse(config.busySpin);
        assertEquals("clob-journal", config.journalPath);
        assertEquals(1_000_000_000_000_000_000L, config.engine.precision);
        assertEquals(1500, config.engine.maxOrdersPerMatch);
    }

    @Test
    void shouldOverrideFromFile() throws IOException {
        Path file = dir.resolve("clob.yml");
        Files.writeString(file, String.join("\n",
                "ringBufferSize: 4096",
                "busySpin: true",
                "journalPath: /var/clob/eth-usdc",
                "engine:",
                "  precision: 1000000",
                "  feeBps: 25",
                "  escrowAccount: 900",
                "  feeRecipient: 901",
                "  maxOrdersPerMatch: 200",
                ""));

        ServerConfig config = ServerConfig.load(file.toString());

        assertEquals(4096, config.ringBufferSize);
        assertTrue(config.busySpin);
        assertEquals("/var/clob/eth-usdc", config.journalPath);
        assertEquals(1_000_000, config.engine.precision);
        assertEquals(25, config.engine.feeBps);
        assertEquals(900, config.engine.escrowAccount);
        assertEquals(901, config.engine.feeRecipient);
        assertEquals(200, config.engine.maxOrdersPerMatch);
    }

    @Test
    void shouldKeepDefaultsForMissingKeys() throws IOException {
        Path file = dir.resolve("partial.yml");
        Files.writeString(file, "engine:\n  feeBps: 5\n");

        ServerConfig config = ServerConfig.load(file.toString());

        assertEquals(1024, config.ringBufferSize);
        assertEquals(5, config.engine.feeBps);
        assertEquals(1500, config.engine.maxOrdersPerMatch);
    }

    @Test
    void shouldRejectMissingFile() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.load(dir.resolve("absent.yml").toString()));
    }

    @Test
    void shouldRejectRingSizeNotPowerOfTwo() throws IOException {
        Path file = dir.resolve("ring.yml");
        Files.writeString(file, "ringBufferSize: 1000\n");

        assertThrows(IllegalArgumentException.class, () -> ServerConfig.load(file.toString()));
    }

    @Test
    void shouldRejectInvalidEngineSettings() throws IOException {
        Path file = dir.resolve("fee.yml");
        Files.writeString(file, "engine:\n  feeBps: 20000\n");

        assertThrows(IllegalArgumentException.class, () -> ServerConfig.load(file.toString()));
    }

    @Test
    void shouldRejectMistypedValue() throws IOException {
        Path file = dir.resolve("typed.yml");
        Files.writeString(file, "journalPath: 5\n");

        assertThrows(IllegalArgumentException.class, () -> ServerConfig.load(file.toString()));
    }
}
