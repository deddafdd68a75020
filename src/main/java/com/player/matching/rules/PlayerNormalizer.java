package com.player.matching.rules;

import com.player.matching.core.model.PlayerRecord;

import java.util.List;
import java.util.Objects;

/**
 * Derives the {@link NormalizedPlayer} view of player records.
 */
public class PlayerNormalizer {

    private final NormalizationEngine engine;

    public PlayerNormalizer() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public PlayerNormalizer(NormalizationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
    }

    public NormalizedPlayer normalize(PlayerRecord player) {
        Objects.requireNonNull(player, "player is required");
        return new NormalizedPlayer(
                player,
                engine.normalize(player.lastName(), PlayerField.LAST_NAME),
                engine.normalize(player.firstName(), PlayerField.FIRST_NAME),
                engine.normalize(player.sex(), PlayerField.SEX),
                engine.normalize(player.association(), PlayerField.ASSOCIATION),
                knownOrNull(player.dayOfBirth()),
                knownOrNull(player.monthOfBirth()),
                knownOrNull(player.yearOfBirth()));
    }

    /**
     * Normalizes a list of records, preserving order.
     */
    public List<NormalizedPlayer> normalizeAll(List<PlayerRecord> players) {
        Objects.requireNonNull(players, "players is required");
        return players.stream().map(this::normalize).toList();
    }

    private static Integer knownOrNull(Integer value) {
        return value != null && value > 0 ? value : null;
    }
}
