package lane.escape;

import com.esotericsoftware.minlog.Log;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorConfigTest {

    @Test
    void testLoadsValuesFromResource() {
        GeneratorConfig config = new GeneratorConfig("generator-test.properties");

        assertEquals(414f, config.getScreenWidth());
        assertEquals(896f, config.getScreenHeight());
        assertEquals(77L, config.getSeedSalt());
        assertEquals(Log.LEVEL_DEBUG, config.getLogLevel());
    }

    @Test
    void testMalformedValueFallsBackToDefault() {
        GeneratorConfig config = new GeneratorConfig("generator-test.properties");

        assertEquals(Constants.SERVICE_DEFAULT_WORKER_THREADS, config.getWorkerThreads());
    }

    @Test
    void testMissingResourceUsesDefaults() {
        GeneratorConfig config = new GeneratorConfig("does-not-exist.properties");

        assertEquals(Constants.DEFAULT_SCREEN_WIDTH, config.getScreenWidth());
        assertEquals(Constants.DEFAULT_SCREEN_HEIGHT, config.getScreenHeight());
        assertEquals(0L, config.getSeedSalt());
        assertEquals(Log.LEVEL_INFO, config.getLogLevel());
    }

    @Test
    void testWorkerThreadsNeverBelowOne() {
        GeneratorConfig config = new GeneratorConfig(375f, 667f, 0L, 0);

        assertEquals(1, config.getWorkerThreads());
    }

    @Test
    void testParseLogLevel() {
        assertEquals(Log.LEVEL_TRACE, GeneratorConfig.parseLogLevel(" TRACE "));
        assertEquals(Log.LEVEL_WARN, GeneratorConfig.parseLogLevel("warn"));
        assertEquals(Log.LEVEL_NONE, GeneratorConfig.parseLogLevel("none"));
        assertEquals(Log.LEVEL_INFO, GeneratorConfig.parseLogLevel("chatty"));
        assertEquals(Log.LEVEL_INFO, GeneratorConfig.parseLogLevel(null));
    }

    @Test
    void testParseLogLevelIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(Log.LEVEL_INFO, GeneratorConfig.parseLogLevel("INFO"));
            assertEquals(Log.LEVEL_DEBUG, GeneratorConfig.parseLogLevel("DEBUG"));
            assertEquals(Log.LEVEL_ERROR, GeneratorConfig.parseLogLevel("ERROR"));
            assertEquals(Log.LEVEL_TRACE, GeneratorConfig.parseLogLevel("Trace"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
