package alpha.simplrouter.core;

import alpha.simplrouter.handler.Handler;
import alpha.simplrouter.route.Match;
import alpha.simplrouter.route.Rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default implementation of {@link Match}.
 */
final class DefaultMatch implements Match
{
    private final Rule rule;
    private final Map<String, String> routeVars,
                                      params;
    private final boolean ignoresWildcard;
    
    DefaultMatch(Rule rule, Map<String, String> routeVars, boolean ignoresWildcard) {
        this.rule = rule;
        this.routeVars = Collections.unmodifiableMap(routeVars);
        // Snapshot; the rule may be reconfigured after the match
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(rule.params()));
        this.ignoresWildcard = ignoresWildcard;
    }
    
    @Override
    public Rule rule() {
        return rule;
    }
    
    @Override
    public Handler handler() {
        return rule.handler();
    }
    
    @Override
    public Map<String, String> routeVars() {
        return routeVars;
    }
    
    @Override
    public String routeVar(String name) {
        return routeVars.get(name);
    }
    
    @Override
    public Map<String, String> params() {
        return params;
    }
    
    @Override
    public boolean ignoresWildcard() {
        return ignoresWildcard;
    }
    
    @Override
    public String toString() {
        return DefaultMatch.class.getSimpleName() + "{" +
                "rule=\"" + rule + '"' +
                ", routeVars=" + routeVars +
                ", params=" + params + '}';
    }
}
