package com.hoopsbot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldPreferWorkingDirOverrides() throws Exception {
        Files.writeString(tempDir.resolve("config.properties"),
                "lineup.bench_slots=4\nuntouchables.weekday=  \n", StandardCharsets.UTF_8);

        Config config = Config.load(tempDir);

        assertEquals(4, config.getInt("lineup.bench_slots"));
        assertEquals("override", config.sourceOf("lineup.bench_slots"));
        assertEquals("resource", config.sourceOf("lineup.il_slots"));
        assertEquals("", config.getString("untouchables.weekday"));
    }

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMaps() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "lineup", Map.of("flex_slots", List.of("C", "UTIL"), "low_confidence_rank", 75),
                "scores", Map.of("cache", Map.of("enabled", false))
        ));

        assertEquals(List.of("C", "UTIL"), config.getList("lineup.flex_slots"));
        assertEquals(75, config.getInt("lineup.low_confidence_rank"));
        assertFalse(config.getBoolean("scores.cache.enabled", true));
        assertEquals(List.of("C", "PG", "SG", "SF", "PF"), config.getList("lineup.stable_slots"));
    }

    @Test
    void getters_shouldFallBackOnUnparseableValues() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "waiver", Map.of("max_swaps", "many"),
                "value", Map.of("untouchable_bonus", "lots")
        ));

        assertEquals(10, config.getInt("waiver.max_swaps"));
        assertEquals(10_000.0, config.getDouble("value.untouchable_bonus"), 1e-9);
        assertTrue(config.getBoolean("waiver.require_position_fit"));
    }

    @Test
    void getPath_shouldResolveAgainstWorkingDir() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of());

        assertEquals(tempDir.resolve("outputs/cache/score_cache.json"), config.getPath("scores.cache.path"));
        assertEquals(tempDir, config.getPath("no.such.key"));
    }

    @Test
    void resolve_shouldReportValueSource() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of("waiver", Map.of("max_swaps", 3)));

        Config.ResolvedValue overridden = config.resolve("waiver.max_swaps");
        Config.ResolvedValue builtIn = config.resolve("waiver.disqualify_statuses");

        assertEquals("3", overridden.value);
        assertEquals("override", overridden.source);
        assertEquals("INJ,O,NA,SUSP,IL", builtIn.value);
        assertEquals("default", builtIn.source);
    }
}
