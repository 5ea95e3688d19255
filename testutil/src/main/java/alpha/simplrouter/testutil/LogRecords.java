package alpha.simplrouter.testutil;

import org.assertj.core.groups.Tuple;

import java.util.logging.LogRecord;

import static java.util.Arrays.stream;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Utils for JUL's {@link LogRecord} and related types.
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Create an AssertJ Tuple consisting of a log- level and message.
     * 
     * @param level of log record
     * @param msg of log record
     * @return a tuple
     * 
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     */
    public static Tuple rec(System.Logger.Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Convert {@code System.Logger.Level} to {@code java.util.logging.Level}.<p>
     * 
     * The two level types agree on severity for all levels except
     * {@code ALL} and {@code OFF}, which JUL represents using its integer
     * extremes.
     * 
     * @param level to convert
     * @return the converted value
     * @throws NullPointerException if {@code level} is {@code null}
     */
    static java.util.logging.Level toJUL(System.Logger.Level level) {
        requireNonNull(level);
        switch (level) {
            case ALL: return java.util.logging.Level.ALL;
            case OFF: return java.util.logging.Level.OFF;
            default:  break;
        }
        return stream(new java.util.logging.Level[]{
                    java.util.logging.Level.FINEST,
                    java.util.logging.Level.FINER,
                    java.util.logging.Level.FINE,
                    java.util.logging.Level.INFO,
                    java.util.logging.Level.WARNING,
                    java.util.logging.Level.SEVERE })
                .filter(l -> l.intValue() == level.getSeverity())
                .findAny().orElseThrow(() -> new IllegalArgumentException(
                        "No JUL match for this level: " + level));
    }
}
