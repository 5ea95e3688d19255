package alpha.simplrouter.core;

import alpha.simplrouter.Config;
import alpha.simplrouter.Router;
import alpha.simplrouter.handler.Handler;
import alpha.simplrouter.route.Match;
import alpha.simplrouter.route.NoRuleFoundException;
import alpha.simplrouter.route.Rule;
import alpha.simplrouter.route.RuleCollisionException;
import alpha.simplrouter.route.RuleTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static alpha.simplrouter.Config.requireValidPrefix;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.text.MessageFormat.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Router}.<p>
 * 
 * Rules are stored in a {@code LinkedHashMap} keyed by their generic key, which
 * is the pattern with each variable segment replaced by "{}". Iteration order
 * is registration order, and this is the order in which rules are matched.
 * Removing a rule and registering it again moves it to the end.<p>
 * 
 * This class is not thread-safe. The rule table is expected to be populated
 * before the first match attempt, after which any number of threads may match
 * concurrently.
 */
public final class DefaultRouter implements Router
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouter.class.getPackageName());
    
    private final Config config;
    private final Map<String, DefaultRule> rules;
    private final RuleMatcher matcher;
    private String prefix;
    
    /**
     * Constructs a {@code DefaultRouter}.
     * 
     * @param config of router
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public DefaultRouter(Config config) {
        this.config  = requireNonNull(config);
        this.rules   = new LinkedHashMap<>();
        this.matcher = new RuleMatcher(rules.values(), config.strictRequisites());
        this.prefix  = config.prefix();
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    @Override
    public Rule register(String pattern, Handler handler) {
        final String p = applyPrefix(pattern),
                     k = Segments.genericKey(p);
        requireNonNull(handler);
        
        DefaultRule old = rules.get(k);
        if (old != null) {
            throw new RuleCollisionException(format(
                    "Rule \"{0}\" is equivalent to an already registered rule \"{1}\". " +
                    "To replace it, use method \"override\".", p, old));
        }
        
        DefaultRule r = new DefaultRule(p, handler);
        rules.put(k, r);
        LOG.log(DEBUG, () -> "Registered rule \"" + p + "\".");
        return r;
    }
    
    @Override
    public Rule override(String pattern, Handler handler) {
        requireNonNull(handler);
        final String p = applyPrefix(pattern);
        if (rules.remove(Segments.genericKey(p)) == null) {
            LOG.log(WARNING, () -> "There is no rule to override with \"" + p +
                    "\". Registering the rule anyway.");
        }
        return register(pattern, handler);
    }
    
    @Override
    public Rule remove(String pattern) {
        final String p = applyPrefix(pattern);
        Rule r = rules.remove(Segments.genericKey(p));
        if (r != null) {
            LOG.log(DEBUG, () -> "Removed rule \"" + r + "\".");
        }
        return r;
    }
    
    @Override
    public Rule get(String pattern) {
        return rules.get(Segments.genericKey(applyPrefix(pattern)));
    }
    
    @Override
    public List<Rule> rules() {
        return List.copyOf(rules.values());
    }
    
    @Override
    public int size() {
        return rules.size();
    }
    
    @Override
    public RuleTable setPrefix(String prefix) {
        this.prefix = requireValidPrefix(prefix);
        LOG.log(DEBUG, () -> "Prefix set to \"" + prefix + "\".");
        return this;
    }
    
    @Override
    public String prefix() {
        return prefix;
    }
    
    @Override
    public Optional<Match> match(String uri, boolean ignoreWildcard) {
        return matcher.match(uri, ignoreWildcard);
    }
    
    @Override
    public Match dispatch(String uri) {
        Optional<Match> m = match(uri);
        if (m.isEmpty()) {
            m = match(config.notFoundPattern());
        }
        if (m.isEmpty()) {
            LOG.log(WARNING, () -> "No rule matched \"" + uri +
                    "\" and no rule is registered for the not-found pattern \"" +
                    config.notFoundPattern() + "\".");
            throw new NoRuleFoundException(uri);
        }
        Match match = m.get();
        match.handler().handle(match.arguments());
        return match;
    }
    
    /**
     * Prepends the prefix to the given pattern if the pattern starts with a
     * forward slash.
     */
    private String applyPrefix(String pattern) {
        if (!prefix.isEmpty() && pattern.startsWith("/")) {
            return prefix + pattern;
        }
        return requireNonNull(pattern);
    }
}
