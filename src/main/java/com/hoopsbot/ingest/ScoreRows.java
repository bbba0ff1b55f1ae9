package com.hoopsbot.ingest;

import com.hoopsbot.identity.InvalidNameException;
import com.hoopsbot.model.PlayerIdentity;
import com.hoopsbot.model.ScoreRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of score rows, shared by the snapshot and the score cache:
 * {@code {"name", "category_score", "rank_30d", "rank_14d"}}.
 */
final class ScoreRows {
    private static final Logger LOG = LogManager.getLogger(ScoreRows.class);

    private ScoreRows() {
    }

    static List<ScoreRecord> parse(JSONArray rows, String origin) {
        List<ScoreRecord> out = new ArrayList<>();
        if (rows == null) {
            return out;
        }
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.optJSONObject(i);
            if (row == null) {
                LOG.warn("{} score row {} is not an object, skipped", origin, i);
                continue;
            }
            try {
                out.add(ScoreRecord.builder()
                        .identity(PlayerIdentity.of(row.optString("name", "")))
                        .categoryScore(optDouble(row, "category_score"))
                        .rank30d(optPositiveInt(row, "rank_30d"))
                        .rank14d(optPositiveInt(row, "rank_14d"))
                        .build());
            } catch (InvalidNameException e) {
                LOG.warn("{} score row {} skipped: {}", origin, i, e.getMessage());
            }
        }
        return out;
    }

    static JSONArray toJson(List<ScoreRecord> records) {
        JSONArray rows = new JSONArray();
        for (ScoreRecord record : records) {
            JSONObject row = new JSONObject();
            row.put("name", record.identity.rawName);
            if (record.hasCategoryScore()) {
                row.put("category_score", record.categoryScore);
            }
            if (record.rank30d != null) {
                row.put("rank_30d", record.rank30d);
            }
            if (record.rank14d != null) {
                row.put("rank_14d", record.rank14d);
            }
            rows.put(row);
        }
        return rows;
    }

    static Double optDouble(JSONObject row, String key) {
        if (!row.has(key) || row.isNull(key)) {
            return null;
        }
        double value = row.optDouble(key, Double.NaN);
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }

    /**
     * Ranks are 1-based; zero, negative and non-numeric values count as missing.
     */
    static Integer optPositiveInt(JSONObject row, String key) {
        if (!row.has(key) || row.isNull(key)) {
            return null;
        }
        int value = row.optInt(key, 0);
        return value > 0 ? value : null;
    }
}
