package lane.escape.common;

import com.esotericsoftware.minlog.Log;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * MinLog logger that writes to both the console and a file under logs/.
 * The console keeps MinLog's plain format, the file gets a timestamp and level.
 * Thread-safe; background generation threads log through the same instance.
 */
public class DualLogger extends Log.Logger {
    private static final Object LOCK = new Object();

    private final SimpleDateFormat dateFormat = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss.SSS");
    private final File logsDir;
    private PrintWriter fileWriter;
    private String logFile;

    /**
     * @param logFileName name of the file inside logs/ (e.g. "levelgen.log")
     */
    public DualLogger(String logFileName) {
        this(new File("logs"), logFileName);
    }

    public DualLogger(File logsDir, String logFileName) {
        this.logsDir = logsDir;
        setLogFile(logFileName);
    }

    /**
     * Switches to a new log file, closing the previous one.
     */
    public void setLogFile(String logFileName) {
        synchronized (LOCK) {
            closeFileWriter();
            logFile = logFileName;
            fileWriter = openLogFile(logFileName);
        }
    }

    private PrintWriter openLogFile(String logFileName) {
        try {
            if (!logsDir.exists()) {
                logsDir.mkdirs();
            }

            File file = new File(logsDir, logFileName);
            PrintWriter writer = new PrintWriter(new FileWriter(file, true));

            writer.println("=".repeat(80));
            writer.println("Log session started: " + dateFormat.format(new Date()));
            writer.println("Log file: " + file.getAbsolutePath());
            writer.println("=".repeat(80));
            writer.flush();

            System.out.println("DualLogger: logging to " + file.getAbsolutePath());
            return writer;
        } catch (IOException e) {
            System.err.println("ERROR: Failed to create log file '" + logFileName + "': " + e.getMessage());
            return null; // console only
        }
    }

    private void closeFileWriter() {
        if (fileWriter != null) {
            fileWriter.println("=".repeat(80));
            fileWriter.println("Log session ended: " + dateFormat.format(new Date()));
            fileWriter.println("=".repeat(80));
            fileWriter.close();
            fileWriter = null;
        }
    }

    @Override
    public void log(int level, String category, String message, Throwable ex) {
        synchronized (LOCK) {
            StringBuilder consoleMsg = new StringBuilder();
            if (category != null) {
                consoleMsg.append("[").append(category).append("] ");
            }
            consoleMsg.append(message);

            if (level == Log.LEVEL_ERROR) {
                System.err.println(consoleMsg);
                if (ex != null) ex.printStackTrace(System.err);
            } else {
                System.out.println(consoleMsg);
            }

            if (fileWriter != null) {
                StringBuilder fileMsg = new StringBuilder();
                fileMsg.append(dateFormat.format(new Date())).append(" ");
                fileMsg.append("[").append(getLevelString(level)).append("] ");
                if (category != null) {
                    fileMsg.append("[").append(category).append("] ");
                }
                fileMsg.append(message);
                fileWriter.println(fileMsg);
                if (ex != null) ex.printStackTrace(fileWriter);
                fileWriter.flush();
            }
        }
    }

    static String getLevelString(int level) {
        switch (level) {
            case Log.LEVEL_ERROR: return "ERROR";
            case Log.LEVEL_WARN: return "WARN";
            case Log.LEVEL_INFO: return "INFO";
            case Log.LEVEL_DEBUG: return "DEBUG";
            case Log.LEVEL_TRACE: return "TRACE";
            default: return "UNKNOWN";
        }
    }

    public String getLogFile() {
        return logFile;
    }

    /**
     * Closes the log file. Call before shutdown.
     */
    public void close() {
        synchronized (LOCK) {
            closeFileWriter();
        }
    }
}
