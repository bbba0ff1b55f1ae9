package com.hoopsbot.lineup;

import com.hoopsbot.config.Config;
import com.hoopsbot.model.BenchCategory;
import com.hoopsbot.model.BenchShape;
import com.hoopsbot.model.RosterPlayer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares the bench's G/F/C make-up with {@code lineup.bench_target}
 * (for example {@code G:1,F:1,C:1}).
 */
public final class BenchShapeCheck {
    private static final Logger LOG = LogManager.getLogger(BenchShapeCheck.class);

    private final Map<BenchCategory, Integer> target;

    public BenchShapeCheck(Config config) {
        this(parseTarget(config.getList("lineup.bench_target")));
    }

    public BenchShapeCheck(Map<BenchCategory, Integer> target) {
        this.target = new EnumMap<>(BenchCategory.class);
        if (target != null) {
            this.target.putAll(target);
        }
    }

    public BenchShape check(List<RosterPlayer> bench) {
        Map<BenchCategory, Integer> actual = new EnumMap<>(BenchCategory.class);
        for (BenchCategory category : BenchCategory.values()) {
            actual.put(category, 0);
        }
        if (bench != null) {
            for (RosterPlayer player : bench) {
                BenchCategory category = BenchCategory.classify(player);
                if (category != null) {
                    actual.merge(category, 1, Integer::sum);
                }
            }
        }

        boolean met = true;
        List<String> parts = new ArrayList<>();
        for (BenchCategory category : BenchCategory.values()) {
            int have = actual.get(category);
            int want = target.getOrDefault(category, 0);
            boolean ok = have >= want;
            met &= ok;
            parts.add(String.format(Locale.ROOT, "%s: %d/%d (%s)", category.name(), have, want, ok ? "OK" : "NEED"));
        }
        BenchShape shape = new BenchShape(actual, target, met, String.join(" | ", parts));
        LOG.info("bench shape: {}", shape.description);
        return shape;
    }

    static Map<BenchCategory, Integer> parseTarget(List<String> entries) {
        Map<BenchCategory, Integer> out = new EnumMap<>(BenchCategory.class);
        for (String entry : entries) {
            String[] kv = entry.split(":", 2);
            if (kv.length != 2) {
                LOG.warn("ignored bench target entry '{}', expected CATEGORY:COUNT", entry);
                continue;
            }
            try {
                BenchCategory category = BenchCategory.valueOf(kv[0].trim().toUpperCase(Locale.ROOT));
                out.put(category, Math.max(0, Integer.parseInt(kv[1].trim())));
            } catch (IllegalArgumentException e) {
                LOG.warn("ignored bench target entry '{}': {}", entry, e.getMessage());
            }
        }
        return out;
    }
}
