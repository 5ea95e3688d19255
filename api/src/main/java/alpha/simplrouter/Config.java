package alpha.simplrouter;

import alpha.simplrouter.route.Requisite;
import alpha.simplrouter.route.RequisiteException;
import alpha.simplrouter.route.RuleTable;

/**
 * Router configuration.<p>
 * 
 * The implementation is immutable and thread-safe.<p>
 * 
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 * 
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 * <pre>
 *   Router r = Router.create(Config.configuration()
 *           .prefix("/app")
 *           .strictRequisites(true)
 *           .build());
 * </pre>
 */
public interface Config
{
    /**
     * Values used:<p>
     * 
     * Prefix = "" (none) <br>
     * Strict requisites = false <br>
     * Not-found pattern = "404"
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns the initial prefix of the router's rule table.<p>
     * 
     * The prefix is prepended to each pattern registered thereafter that starts
     * with a forward slash. The prefix can be changed later using {@link
     * RuleTable#setPrefix(String)}.<p>
     * 
     * The default value is the empty string.
     * 
     * @return the initial prefix (never {@code null})
     */
    String prefix();
    
    /**
     * Returns whether a requisite answering {@code null} fails the match.<p>
     * 
     * If {@code false}, a {@link Requisite} returning {@code null} is logged
     * as a warning and treated as passed. If {@code true}, the match attempt
     * fails with a {@link RequisiteException}.<p>
     * 
     * The default value is {@code false}.
     * 
     * @return whether a requisite answering {@code null} fails the match
     */
    boolean strictRequisites();
    
    /**
     * Returns the pattern matched by {@link Router#dispatch(String)} when the
     * request URI itself matched no rule.<p>
     * 
     * The pattern is matched verbatim. So that it is never prefixed and never
     * matched by a real request path, it must not start with a forward slash.
     * 
     * @return the not-found pattern (never {@code null} or empty)
     */
    String notFoundPattern();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder pre-populated with the values of this configuration
     */
    Config.Builder toBuilder();
    
    /**
     * Is a shortcut for {@code Config.DEFAULT.toBuilder()}.
     * 
     * @return a builder with default values
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The implementation is immutable and thread-safe. Each setter returns a
     * new builder instance.
     */
    interface Builder {
        /**
         * Sets a new prefix value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code newVal} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code newVal} is non-empty and does not start with
         *             a forward slash, or if it ends with a forward slash
         * 
         * @see #prefix()
         */
        Builder prefix(String newVal);
        
        /**
         * Sets a new strict requisites value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * 
         * @see #strictRequisites()
         */
        Builder strictRequisites(boolean newVal);
        
        /**
         * Sets a new not-found pattern.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code newVal} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code newVal} is empty or starts with a forward slash
         * 
         * @see #notFoundPattern()
         */
        Builder notFoundPattern(String newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return the configuration
         */
        Config build();
    }
    
    /**
     * Validates a rule table prefix.<p>
     * 
     * A valid prefix is either empty, or starts- but does not end with a
     * forward slash.
     * 
     * @param prefix to validate
     * @return the prefix
     * 
     * @throws NullPointerException
     *             if {@code prefix} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code prefix} is not valid
     */
    static String requireValidPrefix(String prefix) {
        if (prefix.isEmpty()) {
            return prefix;
        }
        if (!prefix.startsWith("/")) {
            throw new IllegalArgumentException(
                "Prefix must start with a forward slash (\"/\"). Input was: " + prefix);
        }
        if (prefix.endsWith("/")) {
            throw new IllegalArgumentException(
                "Prefix can not end with a forward slash (\"/\"). Input was: " + prefix);
        }
        return prefix;
    }
}
