package alpha.simplrouter.route;

import alpha.simplrouter.handler.Arguments;
import alpha.simplrouter.handler.Handler;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A rule binds a path pattern to a {@link Handler}.<p>
 * 
 * Rules are created by {@link RuleTable#register(String, Handler)} and
 * {@link RuleTable#override(String, Handler)}. The returned rule is then
 * further configured with static parameters, filters and requisites, all of
 * which apply to subsequent match attempts.
 * 
 * <h2>Pattern</h2>
 * 
 * The pattern is split into segments using the forward slash ('/') as
 * delimiter. Empty segments are kept; the pattern "/" has two empty segments,
 * "/about" has the empty segment followed by "about". A request URI is split
 * the same way, and the segments are compared index by index.<p>
 * 
 * A segment is one of three kinds:
 * 
 * <ul>
 *   <li>Wildcard: exactly {@value #WILDCARD}. Accepts anything that remains
 *       of the request path, but only if no other rule matches the request
 *       path.</li>
 *   <li>Variable: starts with '{' and ends with '}' with at least one
 *       character in between, for example "{id}". The text in between is the
 *       name of the variable, and the request URI's segment becomes its
 *       value.</li>
 *   <li>Literal: anything else. Must be equal to the request URI's segment.</li>
 * </ul>
 * 
 * For example, given rule "/user/{id}/[*]", the request path
 * "/user/123/avatar.png" matches with {@code id = "123"}, unless another rule
 * matches the same request path.<p>
 * 
 * Apart from the wildcard, the request path must have just as many segments
 * as the rule's pattern. "/a/b" matches neither "/a" nor "/a/b/c".
 * 
 * <h2>Filters</h2>
 * 
 * A filter is a regular expression which the value of a variable must contain
 * (as determined by {@link java.util.regex.Matcher#find()}). Filters are not
 * implicitly anchored; use '^' and '$' to constrain the entire value.
 * 
 * <h2>Requisites</h2>
 * 
 * A {@link Requisite} is evaluated for each match attempt, in the order they
 * were added. The first requisite returning {@code false} disqualifies the
 * rule and the rest will not be evaluated.
 * 
 * <h2>Thread-safety</h2>
 * 
 * The pattern and handler never change. Params, filters and requisites may be
 * modified at any time, but not concurrently with a match attempt.
 */
public interface Rule
{
    /**
     * The wildcard segment.
     */
    String WILDCARD = "[*]";
    
    /**
     * First character of a variable segment.
     */
    char VARIABLE_FIRST = '{';
    
    /**
     * Last character of a variable segment.
     */
    char VARIABLE_LAST = '}';
    
    /**
     * Returns the pattern of this rule.<p>
     * 
     * The pattern includes the rule table's prefix, if one was applied at the
     * time of registration.
     * 
     * @return the pattern of this rule (never {@code null})
     */
    String pattern();
    
    /**
     * Returns the segments of this rule's pattern.
     * 
     * @return the segments of this rule's pattern
     *         (unmodifiable, never {@code null} nor empty)
     */
    List<String> segments();
    
    /**
     * Returns the handler of this rule.
     * 
     * @return the handler of this rule (never {@code null})
     */
    Handler handler();
    
    /**
     * Adds a static parameter.<p>
     * 
     * Parameters are passed along with a match, and are given precedence over
     * variables of the same name by {@link Match#arguments()}.<p>
     * 
     * A parameter with the same key is replaced.
     * 
     * @param key of parameter
     * @param value of parameter
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    Rule addParam(String key, String value);
    
    /**
     * Adds all entries of the given map as parameters.
     * 
     * @param params to add
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code params}, or any key or value, is {@code null}
     * 
     * @see #addParam(String, String)
     */
    Rule addParams(Map<String, String> params);
    
    /**
     * Returns a parameter value.
     * 
     * @param key of parameter
     * 
     * @return the value ({@code null} if there is no such parameter)
     * 
     * @throws NullPointerException if {@code key} is {@code null}
     */
    String param(String key);
    
    /**
     * Returns all parameters in the order they were first added.
     * 
     * @return all parameters (unmodifiable view, never {@code null})
     */
    Map<String, String> params();
    
    /**
     * Sets a filter for a variable.<p>
     * 
     * A previously set filter for the same variable is replaced.
     * 
     * @param variable name, without braces
     * @param regex the value must contain
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws FilterPatternInvalidException
     *             if {@code regex} is not a valid regular expression
     */
    Rule setFilter(String variable, String regex);
    
    /**
     * Returns the filter of a variable.
     * 
     * @param variable name, without braces
     * 
     * @return the filter ({@code null} if there is no filter)
     * 
     * @throws NullPointerException if {@code variable} is {@code null}
     */
    Pattern filter(String variable);
    
    /**
     * Returns all filters keyed by variable name.
     * 
     * @return all filters (unmodifiable view, never {@code null})
     */
    Map<String, Pattern> filters();
    
    /**
     * Adds a requisite.
     * 
     * @param requisite to add
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException if {@code requisite} is {@code null}
     */
    Rule addRequisite(Requisite requisite);
    
    /**
     * Returns all requisites in the order they were added.
     * 
     * @return all requisites (unmodifiable view, never {@code null})
     */
    List<Requisite> requisites();
    
    /**
     * Returns whether the given segment is the wildcard.
     * 
     * @param segment to test
     * 
     * @return {@code true} if {@code segment} is the wildcard
     */
    static boolean isWildcard(String segment) {
        return WILDCARD.equals(segment);
    }
    
    /**
     * Returns whether the given segment is a variable.
     * 
     * @param segment to test
     * 
     * @return {@code true} if {@code segment} is a variable
     * 
     * @throws NullPointerException if {@code segment} is {@code null}
     */
    static boolean isVariable(String segment) {
        return segment.length() > 2 &&
               segment.charAt(0) == VARIABLE_FIRST &&
               segment.charAt(segment.length() - 1) == VARIABLE_LAST;
    }
    
    /**
     * Equivalent to {@link Match#arguments()}, except the caller provides the
     * variables.
     * 
     * @param routeVars variables extracted from a request path
     * @param params static parameters
     * 
     * @return arguments for a handler
     */
    static Arguments arguments(Map<String, String> routeVars, Map<String, String> params) {
        return new Arguments(routeVars).setAll(params, true);
    }
}
