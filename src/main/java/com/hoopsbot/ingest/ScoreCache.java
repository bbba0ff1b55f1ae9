package com.hoopsbot.ingest;

import com.hoopsbot.config.Config;
import com.hoopsbot.model.ScoreLookup;
import com.hoopsbot.model.ScoreRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Last known score rows on disk, so a snapshot taken without a score pull can still be valued.
 *
 * <pre>
 * {"timestamp": "2024-01-15T12:00:00Z", "scores": [{"name": ..., "category_score": ...}]}
 * </pre>
 */
public final class ScoreCache {
    private static final Logger LOG = LogManager.getLogger(ScoreCache.class);

    private final Path path;
    private final Duration maxAge;
    private final Clock clock;

    public ScoreCache(Config config, Clock clock) {
        this(
                config.getPath("scores.cache.path"),
                Duration.ofHours(Math.max(0L, config.getLong("scores.cache.max_age_hours", 20L))),
                clock
        );
    }

    public ScoreCache(Path path, Duration maxAge, Clock clock) {
        this.path = path;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    /**
     * Fresh snapshot rows win and are written through; without them the cache is used while it
     * is younger than the configured age.
     */
    public ScoreLookup resolve(ScoreLookup snapshotScores) {
        if (snapshotScores != null && !snapshotScores.isEmpty()) {
            try {
                save(snapshotScores.records());
            } catch (IOException e) {
                LOG.warn("score cache write failed {}: {}", path, e.getMessage());
            }
            return snapshotScores;
        }
        Optional<List<ScoreRecord>> cached = loadFresh();
        if (cached.isPresent()) {
            LOG.info("snapshot has no score rows, using {} cached row(s) from {}", cached.get().size(), path);
            return ScoreLookup.of(cached.get());
        }
        LOG.warn("no score rows in snapshot and no fresh cache at {}; values fall back to ranks", path);
        return ScoreLookup.of(List.of());
    }

    public void save(List<ScoreRecord> records) throws IOException {
        JSONObject root = new JSONObject();
        root.put("timestamp", clock.instant().toString());
        root.put("scores", ScoreRows.toJson(records));
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, root.toString(2), StandardCharsets.UTF_8);
        LOG.info("cached {} score row(s) to {}", records.size(), path);
    }

    public Optional<List<ScoreRecord>> loadFresh() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JSONObject root = new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
            Instant stamp = Instant.parse(root.optString("timestamp", ""));
            Duration age = Duration.between(stamp, clock.instant());
            if (age.isNegative() || age.compareTo(maxAge) >= 0) {
                LOG.info("score cache {} is stale (age {}h, limit {}h)", path, age.toHours(), maxAge.toHours());
                return Optional.empty();
            }
            return Optional.of(ScoreRows.parse(root.optJSONArray("scores"), "cache"));
        } catch (IOException | JSONException | DateTimeParseException e) {
            LOG.warn("score cache {} unreadable, ignored: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
