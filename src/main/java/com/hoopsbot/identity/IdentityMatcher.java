package com.hoopsbot.identity;

import com.hoopsbot.config.Config;
import com.hoopsbot.model.PoolPlayer;
import me.xdrop.fuzzywuzzy.FuzzySearch;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a scoring-source name to one player of a candidate pool.
 *
 * <p>Tiers run in order and the first unique hit wins: exact key, fuzzy ratio at or above
 * the threshold, then last name plus first initial. A tier that finds more than one
 * candidate counts as no hit, and a name no tier resolves ends in {@link MatchTier#NONE}.
 */
public final class IdentityMatcher {
    public static final int DEFAULT_FUZZY_THRESHOLD = 90;

    private final int fuzzyThreshold;

    public IdentityMatcher(Config config) {
        this(config.getInt("match.fuzzy_threshold", DEFAULT_FUZZY_THRESHOLD));
    }

    public IdentityMatcher(int fuzzyThreshold) {
        this.fuzzyThreshold = Math.max(0, Math.min(100, fuzzyThreshold));
    }

    /**
     * @throws InvalidNameException when {@code sourceName} cannot be normalized
     */
    public <T extends PoolPlayer> MatchResult<T> match(String sourceName, List<T> pool) {
        return matchKey(NameNormalizer.normalize(sourceName), pool);
    }

    public <T extends PoolPlayer> MatchResult<T> matchKey(String sourceKey, List<T> pool) {
        if (pool == null || pool.isEmpty()) {
            return MatchResult.none("empty pool");
        }

        List<T> exact = new ArrayList<>();
        for (T candidate : pool) {
            if (sourceKey.equals(candidate.key())) {
                exact.add(candidate);
            }
        }
        if (exact.size() == 1) {
            return MatchResult.exact(exact.get(0));
        }

        T fuzzyHit = null;
        int fuzzyScore = 0;
        int fuzzyHits = 0;
        for (T candidate : pool) {
            int ratio = FuzzySearch.ratio(sourceKey, candidate.key());
            if (ratio >= fuzzyThreshold) {
                fuzzyHits++;
                fuzzyHit = candidate;
                fuzzyScore = ratio;
            }
        }
        if (fuzzyHits == 1) {
            return MatchResult.fuzzy(fuzzyHit, fuzzyScore);
        }

        String sourceInitialKey = NameNormalizer.lastNameFirstInitial(sourceKey);
        List<T> initials = new ArrayList<>();
        if (sourceKey.contains(" ")) {
            for (T candidate : pool) {
                if (sourceInitialKey.equals(NameNormalizer.lastNameFirstInitial(candidate.key()))) {
                    initials.add(candidate);
                }
            }
        }
        if (initials.size() == 1) {
            return MatchResult.initial(initials.get(0));
        }

        if (exact.size() > 1 || fuzzyHits > 1 || initials.size() > 1) {
            return MatchResult.none("ambiguous exact=" + exact.size() + " fuzzy=" + fuzzyHits + " initial=" + initials.size());
        }
        return MatchResult.none("no candidate");
    }
}
