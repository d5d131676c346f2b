package com.raditha.hygiene.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineSettingsTest {

    @Test
    void testLoadResource() {
        PipelineConfig config = PipelineSettings.loadResource("hygiene.yml");

        assertEquals("MyApp", config.rootModule());
        assertEquals(Set.of("Repo", "Accounts"), config.appModules());
        assertEquals(Set.of("Logger", "Ecto.Query"), config.macroModules());
        assertTrue(config.fixpoint());
        assertEquals(6, config.maxIterations());
        assertEquals(Set.of("clause-grouping"), config.disabledPasses());
        assertFalse(config.traceDiffs());
    }

    @Test
    void testMissingResourceGivesDefaults() {
        assertEquals(PipelineConfig.defaults(), PipelineSettings.loadResource("absent.yml"));
    }

    @Test
    void testMissingFileGivesDefaults(@TempDir Path dir) {
        assertEquals(PipelineConfig.defaults(), PipelineSettings.loadConfig(dir.resolve("absent.yml"), null, null, 0));
        assertEquals(PipelineConfig.defaults(), PipelineSettings.loadConfig(null, null, null, 0));
    }

    @Test
    void testOverridesWin(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("hygiene.yml");
        Files.writeString(file, String.join("\n",
                "hygiene:",
                "  preset: strict",
                "  root_module: Shop",
                "  app_modules: [Cart]",
                "  max_iterations: 6",
                ""));

        PipelineConfig fromFile = PipelineSettings.loadConfig(file, null, null, 0);
        assertEquals("Shop", fromFile.rootModule());
        assertEquals(6, fromFile.maxIterations());
        assertTrue(fromFile.traceDiffs());

        PipelineConfig overridden = PipelineSettings.loadConfig(file, "fast", "Store", 2);
        assertEquals("Store", overridden.rootModule());
        assertEquals(Set.of("Cart"), overridden.appModules());
        assertEquals(2, overridden.maxIterations());
        assertFalse(overridden.fixpoint());
        assertFalse(overridden.traceDiffs());
    }

    @Test
    void testOtherSectionsAreIgnored() throws IOException {
        byte[] yaml = "other:\n  preset: fast\n".getBytes(StandardCharsets.UTF_8);

        assertTrue(PipelineSettings.readSection(new ByteArrayInputStream(yaml)).isEmpty());
    }

    @Test
    void testUnknownPreset() {
        assertThrows(IllegalArgumentException.class,
                () -> PipelineSettings.fromMap(Map.of("preset", "turbo"), null, null, 0));
    }
}
