package alpha.simplrouter.core;

import alpha.simplrouter.route.Match;
import alpha.simplrouter.route.Matcher;
import alpha.simplrouter.route.Rule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Matches a request path against rules in iteration order.<p>
 * 
 * The rules are walked from first to last, and each rule's segments are
 * compared to the request path's segments, index by index. The first rule
 * surviving the walk is the match.<p>
 * 
 * A wildcard segment stops the walk. At this point, the rules are matched once
 * more, this time with wildcards compared as literals. If that yields a match,
 * the wildcard rule is rejected; a wildcard never shadows a more specific
 * rule. Otherwise, the wildcard rule is the match. The nested pass never
 * recurses further.<p>
 * 
 * Requisites of a rule are evaluated before its segments, and they are
 * evaluated again by a nested pass.
 */
final class RuleMatcher implements Matcher
{
    private static final System.Logger LOG
            = System.getLogger(RuleMatcher.class.getPackageName());
    
    private final Iterable<DefaultRule> rules;
    private final boolean strictRequisites;
    
    /**
     * Constructs a {@code RuleMatcher}.<p>
     * 
     * The given iterable is iterated anew for each match attempt; it may be a
     * live view.
     * 
     * @param rules to match against
     * @param strictRequisites see {@link alpha.simplrouter.Config#strictRequisites()}
     */
    RuleMatcher(Iterable<DefaultRule> rules, boolean strictRequisites) {
        this.rules = requireNonNull(rules);
        this.strictRequisites = strictRequisites;
    }
    
    @Override
    public Optional<Match> match(String uri, boolean ignoreWildcard) {
        final String[] tokens = Segments.split(requireNonNull(uri));
        for (DefaultRule r : rules) {
            if (!r.passesRequisites(strictRequisites)) {
                continue;
            }
            Map<String, String> vars = walk(r, uri, tokens, ignoreWildcard);
            if (vars != null) {
                LOG.log(DEBUG, () -> "Matched \"" + uri + "\" with rule \"" + r + "\".");
                return Optional.of(new DefaultMatch(r, vars, ignoreWildcard));
            }
        }
        LOG.log(DEBUG, () -> "No rule matched \"" + uri + "\"" +
                (ignoreWildcard ? " (wildcards ignored)." : "."));
        return Optional.empty();
    }
    
    /**
     * Walks the segments of a rule.
     * 
     * @return captured variables, or {@code null} if the rule was rejected
     */
    private Map<String, String> walk(
            DefaultRule rule, String uri, String[] tokens, boolean ignoreWildcard)
    {
        final List<String> segments = rule.segments();
        Map<String, String> vars = Map.of();
        
        for (int i = 0; i < segments.size(); ++i) {
            final String s = segments.get(i),
                         t = i < tokens.length ? tokens[i] : null;
            
            if (!ignoreWildcard && Rule.isWildcard(s)) {
                // Wildcard yields to any other match
                return match(uri, true).isPresent() ? null : vars;
            } else if (!Rule.isVariable(s)) {
                if (!s.equals(t)) {
                    return null;
                }
            } else {
                final String name = Segments.variableName(s);
                final Pattern f = rule.filter(name);
                if (f != null && (t == null || !f.matcher(t).find())) {
                    return null;
                }
                (vars = mk(vars)).put(name, t);
            }
        }
        
        return segments.size() == tokens.length ? vars : null;
    }
    
    private static <K, V> Map<K, V> mk(Map<K, V> map) {
        return map.isEmpty() ? new LinkedHashMap<>() : map;
    }
}
