package lane.escape.level;

/**
 * Receives background generation events from {@link LevelService}. Callbacks run on the worker
 * thread.
 */
public interface GenerationListener {

    void onGenerationStarted(int level);

    void onGenerationCompleted(int level, GenerationResult result);

    void onGenerationFailed(int level, Throwable error);
}
