package com.player.matching.rules;

import com.player.matching.core.model.PlayerRecord;

import java.util.Objects;

/**
 * Comparable view of a {@link PlayerRecord}. Birth components that are missing or
 * not positive are {@code null}, meaning unknown.
 */
public record NormalizedPlayer(
        PlayerRecord source,
        String lastName,
        String firstName,
        String sex,
        String association,
        Integer dayOfBirth,
        Integer monthOfBirth,
        Integer yearOfBirth
) {
    public NormalizedPlayer {
        Objects.requireNonNull(source, "source is required");
    }
}
