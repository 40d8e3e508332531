package alpha.nomagicevents.testutil;

import org.assertj.core.groups.Tuple;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.tuple;

/**
 * Logging utilities.<p>
 * 
 * The library logs through {@link System.Logger}, which, absent any other
 * provider, is backed by {@code java.util.logging}. This class installs a JUL
 * handler on the logger of a component's package to record what is logged.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging
{
    private Logging() {
        // Empty
    }
    
    /**
     * Start recording all log records from the logger of the package that the
     * given component belongs to.<p>
     * 
     * The logger's level is set to {@code ALL} for as long as the recording
     * lasts. Recording should eventually be stopped using {@link
     * Recorder#stop()}.
     * 
     * @param component to extract package from
     * @return a recorder
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static Recorder startRecording(Class<?> component) {
        var logger = Logger.getLogger(component.getPackageName());
        var r = new Recorder(logger, logger.getLevel());
        logger.setLevel(Level.ALL);
        logger.addHandler(r);
        return r;
    }
    
    /**
     * Create an AssertJ Tuple consisting of a log- level and message.
     * 
     * @param level of log record
     * @param msg of log record
     * @return a tuple
     */
    public static Tuple rec(System.Logger.Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Translates a {@code System.Logger} level to a JUL level.
     * 
     * @param level to translate
     * @return the JUL level
     * @throws NullPointerException if {@code level} is {@code null}
     */
    public static Level toJUL(System.Logger.Level level) {
        switch (level) {
            case ALL:     return Level.ALL;
            case TRACE:   return Level.FINER;
            case DEBUG:   return Level.FINE;
            case INFO:    return Level.INFO;
            case WARNING: return Level.WARNING;
            case ERROR:   return Level.SEVERE;
            case OFF:     return Level.OFF;
            default:
                throw new AssertionError("Unexpected: " + level);
        }
    }
    
    /**
     * A JUL handler gathering all published records.
     */
    public static final class Recorder extends Handler {
        private final ConcurrentLinkedDeque<LogRecord> records;
        private final Logger logger;
        private final Level restore;
        
        Recorder(Logger logger, Level restore) {
            this.records = new ConcurrentLinkedDeque<>();
            this.logger  = logger;
            this.restore = restore;
        }
        
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            // Empty
        }
        
        /**
         * Stream a snapshot of all records observed.
         * 
         * @return a snapshot of all records observed (orderly; FIFO)
         */
        public Stream<LogRecord> records() {
            return List.copyOf(records).stream();
        }
        
        /**
         * Stop recording.<p>
         * 
         * The recorder's handler is removed and the logger's level restored.
         * Records observed until now remain available.
         */
        public void stop() {
            logger.removeHandler(this);
            logger.setLevel(restore);
        }
    }
}
