package alpha.simplrouter.core;

import alpha.simplrouter.handler.Handler;
import alpha.simplrouter.route.FilterPatternInvalidException;
import alpha.simplrouter.route.Requisite;
import alpha.simplrouter.route.RequisiteException;
import alpha.simplrouter.route.Rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.lang.System.Logger.Level.WARNING;
import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Rule}.
 */
final class DefaultRule implements Rule
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRule.class.getPackageName());
    
    private final String pattern;
    private final List<String> segments;
    private final Handler handler;
    private final Map<String, String> params;
    private final Map<String, Pattern> filters;
    private final List<Requisite> requisites;
    
    /**
     * Constructs a {@code DefaultRule}.
     * 
     * @param pattern of rule (prefix already applied)
     * @param handler of rule
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    DefaultRule(String pattern, Handler handler) {
        this.pattern    = requireNonNull(pattern);
        this.segments   = Collections.unmodifiableList(asList(Segments.split(pattern)));
        this.handler    = requireNonNull(handler);
        this.params     = new LinkedHashMap<>();
        this.filters    = new LinkedHashMap<>();
        this.requisites = new ArrayList<>();
    }
    
    @Override
    public String pattern() {
        return pattern;
    }
    
    @Override
    public List<String> segments() {
        return segments;
    }
    
    @Override
    public Handler handler() {
        return handler;
    }
    
    @Override
    public Rule addParam(String key, String value) {
        params.put(requireNonNull(key), requireNonNull(value));
        return this;
    }
    
    @Override
    public Rule addParams(Map<String, String> params) {
        params.forEach(this::addParam);
        return this;
    }
    
    @Override
    public String param(String key) {
        return params.get(requireNonNull(key));
    }
    
    @Override
    public Map<String, String> params() {
        return Collections.unmodifiableMap(params);
    }
    
    @Override
    public Rule setFilter(String variable, String regex) {
        requireNonNull(variable);
        requireNonNull(regex);
        final Pattern p;
        try {
            p = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new FilterPatternInvalidException(variable, e);
        }
        filters.put(variable, p);
        return this;
    }
    
    @Override
    public Pattern filter(String variable) {
        return filters.get(requireNonNull(variable));
    }
    
    @Override
    public Map<String, Pattern> filters() {
        return Collections.unmodifiableMap(filters);
    }
    
    @Override
    public Rule addRequisite(Requisite requisite) {
        requisites.add(requireNonNull(requisite));
        return this;
    }
    
    @Override
    public List<Requisite> requisites() {
        return Collections.unmodifiableList(requisites);
    }
    
    /**
     * Evaluates the requisites in order, until one of them fails.<p>
     * 
     * A requisite returning {@code null} either throws or is ignored with a
     * warning, depending on {@code strict}.
     * 
     * @param strict see {@link alpha.simplrouter.Config#strictRequisites()}
     * 
     * @return {@code false} if a requisite returned {@code false},
     *         otherwise {@code true}
     * 
     * @throws RequisiteException
     *             if a requisite returned {@code null} and {@code strict}
     */
    boolean passesRequisites(boolean strict) {
        for (Requisite r : requisites) {
            Boolean pass = r.test();
            if (pass == null) {
                if (strict) {
                    throw new RequisiteException(this);
                }
                LOG.log(WARNING, () -> "A requisite for rule \"" + pattern +
                        "\" does not return a boolean; it will be ignored.");
            } else if (!pass) {
                return false;
            }
        }
        return true;
    }
    
    @Override
    public String toString() {
        return pattern;
    }
}
