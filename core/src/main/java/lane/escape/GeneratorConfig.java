package lane.escape;

import com.esotericsoftware.minlog.Log;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Runtime configuration loaded from generator.properties on the classpath.
 * Every key is optional; missing or malformed values fall back to defaults.
 */
public class GeneratorConfig {
    public static final String CONFIG_FILE = "generator.properties";
    private static final String PROP_SCREEN_WIDTH = "screen.width";
    private static final String PROP_SCREEN_HEIGHT = "screen.height";
    private static final String PROP_SEED_SALT = "seed.salt";
    private static final String PROP_WORKER_THREADS = "worker.threads";
    private static final String PROP_LOG_LEVEL = "log.level";

    private final float screenWidth;
    private final float screenHeight;
    private final long seedSalt;
    private final int workerThreads;
    private final int logLevel;

    public GeneratorConfig() {
        this(CONFIG_FILE);
    }

    public GeneratorConfig(String resourceName) {
        Properties props = new Properties();
        try (InputStream input = GeneratorConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (input == null) {
                Log.warn("GeneratorConfig", "No " + resourceName + " found, using defaults");
            } else {
                props.load(input);
            }
        } catch (IOException e) {
            Log.error("GeneratorConfig", "Error loading " + resourceName + ": " + e.getMessage());
        }

        this.screenWidth = readFloat(props, PROP_SCREEN_WIDTH, Constants.DEFAULT_SCREEN_WIDTH);
        this.screenHeight = readFloat(props, PROP_SCREEN_HEIGHT, Constants.DEFAULT_SCREEN_HEIGHT);
        this.seedSalt = readLong(props, PROP_SEED_SALT, 0L);
        this.workerThreads = Math.max(1, (int) readLong(props, PROP_WORKER_THREADS, Constants.SERVICE_DEFAULT_WORKER_THREADS));
        this.logLevel = parseLogLevel(props.getProperty(PROP_LOG_LEVEL));
    }

    /**
     * Creates a configuration without touching the classpath, for tests and embedding.
     */
    public GeneratorConfig(float screenWidth, float screenHeight, long seedSalt, int workerThreads) {
        this.screenWidth = screenWidth;
        this.screenHeight = screenHeight;
        this.seedSalt = seedSalt;
        this.workerThreads = Math.max(1, workerThreads);
        this.logLevel = Log.LEVEL_INFO;
    }

    private static float readFloat(Properties props, String key, float fallback) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            Log.warn("GeneratorConfig", "No " + key + " found, using default: " + fallback);
            return fallback;
        }
        try {
            float parsed = Float.parseFloat(value.trim());
            Log.info("GeneratorConfig", "Loaded " + key + ": " + parsed);
            return parsed;
        } catch (NumberFormatException e) {
            Log.warn("GeneratorConfig", "Invalid " + key + " '" + value + "', using default: " + fallback);
            return fallback;
        }
    }

    private static long readLong(Properties props, String key, long fallback) {
        String value = props.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            Log.warn("GeneratorConfig", "No " + key + " found, using default: " + fallback);
            return fallback;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            Log.info("GeneratorConfig", "Loaded " + key + ": " + parsed);
            return parsed;
        } catch (NumberFormatException e) {
            Log.warn("GeneratorConfig", "Invalid " + key + " '" + value + "', using default: " + fallback);
            return fallback;
        }
    }

    static int parseLogLevel(String value) {
        if (value == null) {
            return Log.LEVEL_INFO;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none": return Log.LEVEL_NONE;
            case "error": return Log.LEVEL_ERROR;
            case "warn": return Log.LEVEL_WARN;
            case "debug": return Log.LEVEL_DEBUG;
            case "trace": return Log.LEVEL_TRACE;
            default: return Log.LEVEL_INFO;
        }
    }

    public float getScreenWidth() {
        return screenWidth;
    }

    public float getScreenHeight() {
        return screenHeight;
    }

    public long getSeedSalt() {
        return seedSalt;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getLogLevel() {
        return logLevel;
    }
}
