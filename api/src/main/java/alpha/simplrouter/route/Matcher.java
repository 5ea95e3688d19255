package alpha.simplrouter.route;

import java.util.Optional;

/**
 * Finds the rule matching a request path.<p>
 * 
 * Rules are tried in the order they were registered, and the first one that
 * matches wins. The only exception to this is a rule with a wildcard, which
 * matches only if no other rule does (see {@link Rule}).<p>
 * 
 * The request path is given as an argument, never read from an ambient
 * request context.<p>
 * 
 * Matching is pure computation, save for the requisites. Any number of
 * threads can match concurrently, as long as the rules are not modified at the
 * same time.
 */
public interface Matcher
{
    /**
     * Matches the given request path.<p>
     * 
     * Is equivalent to {@code match(uri, false)}.
     * 
     * @param uri request path
     * 
     * @return the match, or an empty optional if no rule matched
     * 
     * @throws NullPointerException
     *             if {@code uri} is {@code null}
     * @throws RequisiteException
     *             if a requisite abstained and requisites are strict
     */
    default Optional<Match> match(String uri) {
        return match(uri, false);
    }
    
    /**
     * Matches the given request path.<p>
     * 
     * If {@code ignoreWildcard} is {@code true}, a wildcard segment is
     * compared as if it were a literal segment.
     * 
     * @param uri request path
     * @param ignoreWildcard whether to ignore wildcards
     * 
     * @return the match, or an empty optional if no rule matched
     * 
     * @throws NullPointerException
     *             if {@code uri} is {@code null}
     * @throws RequisiteException
     *             if a requisite abstained and requisites are strict
     */
    Optional<Match> match(String uri, boolean ignoreWildcard);
}
