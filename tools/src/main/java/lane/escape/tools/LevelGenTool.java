package lane.escape.tools;

import com.esotericsoftware.minlog.Log;
import lane.escape.GeneratorConfig;
import lane.escape.common.DualLogger;
import lane.escape.level.GenerationResult;
import lane.escape.level.LevelCodec;
import lane.escape.level.LevelGenerator;

import java.io.File;
import java.io.IOException;

/**
 * Generates a range of levels headlessly and logs one summary line per level.
 * <p>
 * Usage: {@code LevelGenTool <fromLevel> <toLevel> [exportDir]}. With an export directory every
 * board is also written as {@code level-<n>.bin}.
 */
public class LevelGenTool {
    private static DualLogger dualLogger;

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: LevelGenTool <fromLevel> <toLevel> [exportDir]");
            System.exit(2);
            return;
        }

        int from;
        int to;
        try {
            from = Integer.parseInt(args[0]);
            to = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            System.err.println("Levels must be integers: " + args[0] + " " + args[1]);
            System.exit(2);
            return;
        }
        if (from < 1 || to < from) {
            System.err.println("Expected 1 <= fromLevel <= toLevel, got " + from + " " + to);
            System.exit(2);
            return;
        }
        File exportDir = args.length > 2 ? new File(args[2]) : null;

        GeneratorConfig config = new GeneratorConfig();
        setupLogging(config);
        int exitCode = run(config, from, to, exportDir);
        dualLogger.close();
        System.exit(exitCode);
    }

    private static void setupLogging(GeneratorConfig config) {
        dualLogger = new DualLogger("levelgen.log");
        Log.setLogger(dualLogger);
        Log.set(config.getLogLevel());
        Log.info("LevelGenTool", "File logging enabled: logs/levelgen.log");
    }

    static int run(GeneratorConfig config, int from, int to, File exportDir) {
        LevelGenerator generator = new LevelGenerator(config);
        LevelCodec codec = exportDir != null ? new LevelCodec() : null;
        Log.info("LevelGenTool", "Generating levels " + from + ".." + to + " for "
            + config.getScreenWidth() + "x" + config.getScreenHeight());

        int failures = 0;
        for (int level = from; level <= to; level++) {
            GenerationResult result = generator.generate(level);
            Log.info("LevelGenTool", String.format("level %3d | pieces %3d | score %5.1f | %s",
                level, result.getTotalCount(), result.difficultyScore, result.diagnostics));
            if (result.isEmpty()) {
                failures++;
            }
            if (codec != null) {
                File file = new File(exportDir, "level-" + level + ".bin");
                try {
                    codec.write(result, file);
                } catch (IOException e) {
                    Log.error("LevelGenTool", "Could not export level " + level + " to " + file, e);
                    failures++;
                }
            }
        }
        Log.info("LevelGenTool", "Done, " + failures + " problem level(s)");
        return failures == 0 ? 0 : 1;
    }
}
