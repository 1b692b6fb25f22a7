package lane.escape.board.generators;

import com.badlogic.gdx.math.Rectangle;
import lane.escape.Constants;
import lane.escape.board.Lattice;
import lane.escape.board.LatticeCell;
import lane.escape.board.enums.LayoutProfileType;
import lane.escape.common.SeededRandom;

import java.util.List;

/**
 * Spatial weighting used by the placer. Higher weights are filled first.
 * The shape's centre, rotation and band sizes are drawn once from the attempt's random source.
 */
public class LayoutProfile {
    private static final float RING_SIGMA = 0.12f;

    private final LayoutProfileType type;
    private final float centerX, centerY;
    private final float maxRadius;
    private final float rotation;
    private final float ringBand;
    private final float bandWidth;
    private final float lumpsOffset;

    private LayoutProfile(LayoutProfileType type, float centerX, float centerY, float maxRadius,
                          float rotation, float ringBand, float bandWidth, float lumpsOffset) {
        this.type = type;
        this.centerX = centerX;
        this.centerY = centerY;
        this.maxRadius = maxRadius;
        this.rotation = rotation;
        this.ringBand = ringBand;
        this.bandWidth = bandWidth;
        this.lumpsOffset = lumpsOffset;
    }

    /**
     * Picks one of {@code candidates} at random (every type when empty) and draws its shape.
     */
    public static LayoutProfile create(List<LayoutProfileType> candidates, Lattice lattice, SeededRandom random) {
        LayoutProfileType type;
        if (candidates == null || candidates.isEmpty()) {
            LayoutProfileType[] all = LayoutProfileType.values();
            type = all[random.nextInt(all.length)];
        } else {
            type = candidates.get(random.nextInt(candidates.size()));
        }
        return create(type, lattice, random);
    }

    public static LayoutProfile create(LayoutProfileType type, Lattice lattice, SeededRandom random) {
        Rectangle safe = lattice.getSafeRect();
        float cx = lattice.getCenterX() + random.jitter(safe.width * 0.2f);
        float cy = lattice.getCenterY() + random.jitter(safe.height * 0.2f);
        float maxR = Math.max(safe.width, safe.height) * 0.5f;
        float rotation = (float) (random.nextDouble() * Math.PI * 2);
        float ringBand = 0.55f + random.nextFloat() * 0.2f;
        float bandWidth = maxR * (0.18f + random.nextFloat() * 0.08f);
        float lumpsOffset = maxR * (0.35f + random.nextFloat() * 0.1f);
        return new LayoutProfile(type, cx, cy, maxR, rotation, ringBand, bandWidth, lumpsOffset);
    }

    public float weight(LatticeCell cell) {
        return weight(cell.x, cell.y);
    }

    public float weight(float x, float y) {
        float dx = x - centerX;
        float dy = y - centerY;
        float r = (float) Math.sqrt(dx * dx + dy * dy) / (maxRadius > 0 ? maxRadius : 1f);

        switch (type) {
            case RING: {
                float d = r - ringBand;
                return (float) Math.exp(-(d * d) / (2 * RING_SIGMA * RING_SIGMA)) + Constants.LAYOUT_WEIGHT_FLOOR;
            }
            case DIAGONAL_BAND: {
                // distance from the rotated line through the centre
                float ny = (float) (dx * Math.sin(rotation) + dy * Math.cos(rotation));
                return Math.max(Constants.LAYOUT_WEIGHT_FLOOR, 1 - Math.abs(ny) / bandWidth);
            }
            case TWIN_CLUSTER: {
                float d1 = distance(x, y, centerX - lumpsOffset, centerY + lumpsOffset * 0.3f);
                float d2 = distance(x, y, centerX + lumpsOffset, centerY - lumpsOffset * 0.3f);
                float sigma = maxRadius * 0.35f;
                double twoSigmaSq = 2.0 * sigma * sigma;
                return (float) Math.max(Constants.LAYOUT_WEIGHT_FLOOR,
                    Math.exp(-(d1 * d1) / twoSigmaSq) + Math.exp(-(d2 * d2) / twoSigmaSq));
            }
            case HOLLOW_CENTER:
                return Math.max(Constants.LAYOUT_WEIGHT_FLOOR, r);
            case UNIFORM:
            default:
                return 1f;
        }
    }

    private static float distance(float x1, float y1, float x2, float y2) {
        float dx = x1 - x2;
        float dy = y1 - y2;
        return (float) Math.sqrt(dx * dx + dy * dy);
    }

    public LayoutProfileType getType() {
        return type;
    }
}
