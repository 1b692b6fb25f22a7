package lane.escape.common;

/**
 * Closed interval [min, max].
 */
public final class FloatRange {
    private final float min;
    private final float max;

    public FloatRange(float min, float max) {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
        this.min = min;
        this.max = max;
    }

    public boolean contains(float value) {
        return value >= min && value <= max;
    }

    public float getMin() {
        return min;
    }

    public float getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
