package lane.escape.common;

import java.util.List;

/**
 * Reproducible 32-bit PRNG (mulberry32 variant). The state is advanced once before the first
 * output, so two generators built from the same seed emit identical sequences on every platform.
 * Not thread-safe; each generation attempt owns its own instance.
 */
public class SeededRandom {
    private static final int GOLDEN = 0x6D2B79F5;
    private static final double TWO_POW_32 = 4294967296.0;

    private final int seed;
    private int state;

    public SeededRandom(int seed) {
        this.seed = seed;
        this.state = seed + GOLDEN;
    }

    public SeededRandom(long seed) {
        this((int) seed);
    }

    /**
     * @return a double in [0, 1)
     */
    public double nextDouble() {
        state += GOLDEN;
        int x = (state ^ (state >>> 15)) * (1 | state);
        x ^= x + (x ^ (x >>> 7)) * (61 | x);
        return ((x ^ (x >>> 14)) & 0xFFFFFFFFL) / TWO_POW_32;
    }

    public float nextFloat() {
        return (float) nextDouble();
    }

    /**
     * @return an int in [0, bound)
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) Math.floor(nextDouble() * bound);
    }

    /** Centered jitter in [-amplitude / 2, amplitude / 2). */
    public float jitter(float amplitude) {
        return (float) ((nextDouble() - 0.5) * amplitude);
    }

    /** In-place Fisher-Yates shuffle. */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = nextInt(i + 1);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }

    public int getSeed() {
        return seed;
    }
}
