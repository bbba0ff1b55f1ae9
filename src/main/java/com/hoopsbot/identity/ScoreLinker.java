package com.hoopsbot.identity;

import com.hoopsbot.model.FreeAgentPlayer;
import com.hoopsbot.model.PoolPlayer;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.ScoreLookup;
import com.hoopsbot.model.ScoreRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches score rows to roster players and free agents.
 *
 * <p>Rows are processed in source order; a player claimed by an earlier row is removed from
 * the pool for later rows so two rows never share one player.
 */
public final class ScoreLinker {
    private static final Logger LOG = LogManager.getLogger(ScoreLinker.class);
    private static final int UNMATCHED_LOG_LIMIT = 15;

    private final IdentityMatcher matcher;

    public ScoreLinker(IdentityMatcher matcher) {
        this.matcher = matcher;
    }

    public LinkResult link(List<RosterPlayer> roster, List<FreeAgentPlayer> freeAgents, ScoreLookup scores) {
        List<PoolPlayer> pool = new ArrayList<>(roster.size() + freeAgents.size());
        pool.addAll(roster);
        pool.addAll(freeAgents);

        Map<PoolPlayer, ScoreRecord> claimed = new IdentityHashMap<>();
        Map<MatchTier, Integer> tierCounts = new EnumMap<>(MatchTier.class);
        for (MatchTier tier : MatchTier.values()) {
            tierCounts.put(tier, 0);
        }
        List<String> unmatched = new ArrayList<>();

        for (ScoreRecord record : scores.records()) {
            List<PoolPlayer> open = new ArrayList<>(pool.size());
            for (PoolPlayer candidate : pool) {
                if (!claimed.containsKey(candidate)) {
                    open.add(candidate);
                }
            }
            MatchResult<PoolPlayer> result = matcher.matchKey(record.identity.normalizedKey, open);
            tierCounts.merge(result.tier, 1, Integer::sum);
            if (result.isMatched()) {
                claimed.put(result.candidate, record);
                if (result.tier != MatchTier.EXACT) {
                    LOG.debug("score row '{}' resolved {}", record.identity.displayName, result);
                }
            } else {
                unmatched.add(record.identity.displayName);
            }
        }

        List<RosterPlayer> linkedRoster = new ArrayList<>(roster.size());
        List<RosterPlayer> unscored = new ArrayList<>();
        for (RosterPlayer player : roster) {
            ScoreRecord record = claimed.get(player);
            if (record == null) {
                linkedRoster.add(player);
                unscored.add(player);
            } else {
                linkedRoster.add(player.withScoreRecord(record));
            }
        }
        List<FreeAgentPlayer> linkedFreeAgents = new ArrayList<>(freeAgents.size());
        for (FreeAgentPlayer player : freeAgents) {
            ScoreRecord record = claimed.get(player);
            linkedFreeAgents.add(record == null ? player : player.withScoreRecord(record));
        }

        LOG.info("Matched {} / {} score rows (exact={}, fuzzy={}, initial={}); {} roster player(s) unscored",
                claimed.size(),
                scores.records().size(),
                tierCounts.get(MatchTier.EXACT),
                tierCounts.get(MatchTier.FUZZY),
                tierCounts.get(MatchTier.INITIAL),
                unscored.size());
        if (!unmatched.isEmpty()) {
            LOG.info("Unmatched score rows (first {}): {}",
                    Math.min(UNMATCHED_LOG_LIMIT, unmatched.size()),
                    unmatched.subList(0, Math.min(UNMATCHED_LOG_LIMIT, unmatched.size())));
        }

        return new LinkResult(linkedRoster, linkedFreeAgents, unmatched, unscored, tierCounts);
    }

    public static final class LinkResult {
        public final List<RosterPlayer> roster;
        public final List<FreeAgentPlayer> freeAgents;
        public final List<String> unmatchedSourceNames;
        public final List<RosterPlayer> unscoredRoster;
        public final Map<MatchTier, Integer> tierCounts;

        public LinkResult(
                List<RosterPlayer> roster,
                List<FreeAgentPlayer> freeAgents,
                List<String> unmatchedSourceNames,
                List<RosterPlayer> unscoredRoster,
                Map<MatchTier, Integer> tierCounts
        ) {
            this.roster = Collections.unmodifiableList(roster);
            this.freeAgents = Collections.unmodifiableList(freeAgents);
            this.unmatchedSourceNames = Collections.unmodifiableList(unmatchedSourceNames);
            this.unscoredRoster = Collections.unmodifiableList(unscoredRoster);
            this.tierCounts = Collections.unmodifiableMap(tierCounts);
        }

        public int matchedCount() {
            return tierCounts.get(MatchTier.EXACT) + tierCounts.get(MatchTier.FUZZY) + tierCounts.get(MatchTier.INITIAL);
        }
    }
}
