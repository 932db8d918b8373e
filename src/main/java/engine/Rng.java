package engine;

import java.util.Random;
import java.util.function.DoubleSupplier;

public final class Rng {
    private Rng() {}

    /** Uniform draws in [0,1) from a seeded {@link Random}. */
    public static DoubleSupplier seeded(long seed) {
        Random random = new Random(seed);
        return random::nextDouble;
    }
}
