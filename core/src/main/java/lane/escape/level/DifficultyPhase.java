package lane.escape.level;

/**
 * Stages of the difficulty curve, in the order a player meets them.
 */
public enum DifficultyPhase {
    TUTORIAL("Tutorial"),
    RAMP("Ramp"),
    CHALLENGE("Challenge"),
    MASTER("Master"),
    LEGENDARY("Legendary");

    private final String displayName;

    DifficultyPhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static DifficultyPhase forLevel(int level) {
        if (level <= 1) {
            return TUTORIAL;
        }
        if (level <= 10) {
            return RAMP;
        }
        if (level <= 30) {
            return CHALLENGE;
        }
        if (level <= 60) {
            return MASTER;
        }
        return LEGENDARY;
    }
}
