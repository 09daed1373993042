package com.arkhamsim.deck;

import com.arkhamsim.common.IEnvGetter;

import java.util.Optional;
import java.util.Random;

/**
 * How decks obtain their randomness.
 *
 * @param seed fixed seed for reproducible shuffles; empty for a fresh unseeded {@link Random}
 */
public record ShuffleConfig(Optional<Long> seed) {
    public static final String SEED_ENV = "ARKHAM_SHUFFLE_SEED";

    public ShuffleConfig {
        seed = seed == null ? Optional.empty() : seed;
    }

    public static ShuffleConfig unseeded() {
        return new ShuffleConfig(Optional.empty());
    }

    public static ShuffleConfig seeded(long seed) {
        return new ShuffleConfig(Optional.of(seed));
    }

    /** Reads {@value #SEED_ENV}; unset or blank means unseeded, anything that is not a long is an error. */
    public static ShuffleConfig fromEnv(IEnvGetter env) {
        return new ShuffleConfig(IEnvGetter.getOptionalLong(env, SEED_ENV));
    }

    public Random newRandom() {
        return seed.map(Random::new).orElseGet(Random::new);
    }
}
