package alpha.simplrouter.testutil;

import alpha.simplrouter.Router;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.stream.Stream;

import static alpha.simplrouter.testutil.LogRecords.rec;
import static alpha.simplrouter.testutil.LogRecords.toJUL;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Stream.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * A utility for asserting log records.<p>
 * 
 * Methods with an "assert" prefix throw an {@code AssertionError} if the
 * record can not be found.<p>
 * 
 * Methods with "remove" in their name will remove the earliest record which is
 * a match, meaning that the matched record will not be matched again. The
 * purpose is to limit subsequent assertions to what is left behind.<p>
 * 
 * For example:
 * <pre>
 *     // The test provoked an expected warning...
 *     recorder.assertRemove(WARNING, "There is no rule to override")
 *     // ...but no other warnings are expected
 *             .assertNoProblem();
 * </pre>
 * 
 * Create a log recorder using {@link #startRecording()}, and stop it using
 * {@link #stopRecording()}.
 */
public final class LogRecorder
{
    /**
     * Starts recording records from the loggers of the router's packages.<p>
     * 
     * An invocation of this method behaves in exactly the same way as the
     * invocation
     * <pre>
     *     LogRecorder.{@link #startRecording(Class, Class[])
     *       startRecording}(Router.class);
     * </pre>
     * 
     * Note that loggers are hierarchical; the logger of package
     * "alpha.simplrouter" is the parent of "alpha.simplrouter.core".
     * 
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        return startRecording(Router.class);
    }
    
    /**
     * Starts recording log records from the loggers of the packages that the
     * given components belong to.
     * 
     * @param firstComponent at least one
     * @param more may be provided
     * 
     * @return a new log recorder
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static LogRecorder startRecording(Class<?> firstComponent, Class<?>... more) {
        RecordHandler[] h = Stream.concat(of(firstComponent), of(more))
                .map(c -> {
                    var rh = new RecordHandler(c);
                    Logging.addHandler(c, rh);
                    return rh;
                }).toArray(RecordHandler[]::new);
        
        return new LogRecorder(h);
    }
    
    private final RecordHandler[] handlers;
    
    private LogRecorder(RecordHandler[] handlers) {
        this.handlers = handlers;
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public LogRecorder assertRemove(System.Logger.Level level, String messageStartsWith) {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith));
        return this;
    }
    
    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     * 
     * @return this for chaining/fluency
     * 
     * @throws AssertionError
     *             if a record has a throwable
     *             or a level greater than {@code INFO}
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .noneMatch(v -> v.getLevel().intValue() > java.util.logging.Level.INFO.intValue())
            .noneMatch(v -> v.getThrown() != null);
        return this;
    }
    
    /**
     * Asserts that only one record has the given values.
     * 
     * @param level record's level predicate
     * @param message record's message predicate
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if not exactly one record is found
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(
                LogRecord::getLevel,
                LogRecord::getMessage)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * Stop recording log records.
     */
    public void stopRecording() {
        of(handlers).forEach(h -> Logging.removeHandler(h.component(), h));
    }
    
    private Stream<LogRecord> records() {
        return of(handlers).flatMap(h -> h.records().stream());
    }
    
    private void assertRemoveIf(Predicate<LogRecord> test) {
        LogRecord match = null;
        search: for (var h : handlers) {
            var it = h.records().iterator();
            while (it.hasNext()) {
                var r = it.next();
                if (test.test(r)) {
                    it.remove();
                    match = r;
                    break search;
                }
            }
        }
        assertNotNull(match);
    }
    
    private static final class RecordHandler extends Handler {
        private final Class<?> cmp;
        private final Deque<LogRecord> deq;
        
        RecordHandler(Class<?> component) {
            cmp = component;
            deq = new ConcurrentLinkedDeque<>();
            super.setLevel(java.util.logging.Level.ALL);
        }
        
        Class<?> component() {
            return cmp;
        }
        
        Deque<LogRecord> records() {
            return deq;
        }
        
        @Override
        public void publish(LogRecord record) {
            deq.add(record);
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            // Empty
        }
    }
}
