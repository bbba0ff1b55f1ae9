package com.hoopsbot.model;

import com.hoopsbot.identity.NameNormalizer;
import lombok.Value;

/**
 * A player's name as one data source spells it, with its comparison key.
 */
@Value
public final class PlayerIdentity {
    public final String rawName;
    public final String normalizedKey;
    public final String displayName;

    /**
     * @throws com.hoopsbot.identity.InvalidNameException when the name is blank or has no letters
     */
    public static PlayerIdentity of(String rawName) {
        String key = NameNormalizer.normalize(rawName);
        String display = rawName.trim().replaceAll("\\s+", " ");
        return new PlayerIdentity(rawName, key, display);
    }
}
