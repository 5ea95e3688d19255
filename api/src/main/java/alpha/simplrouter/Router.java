package alpha.simplrouter;

import alpha.simplrouter.handler.Handler;
import alpha.simplrouter.route.Match;
import alpha.simplrouter.route.Matcher;
import alpha.simplrouter.route.NoRuleFoundException;
import alpha.simplrouter.route.RequisiteException;
import alpha.simplrouter.route.Rule;
import alpha.simplrouter.route.RuleTable;

import java.util.ServiceLoader;

/**
 * A rule table and its matcher.<p>
 * 
 * Rules are registered when the application starts:
 * <pre>
 *   Router r = Router.create();
 *   r.register("/", home);
 *   r.register("/user/{id}", user).setFilter("id", "^[0-9]+$");
 *   r.register("/files/[*]", files);
 *   r.register("404", notFound);
 * </pre>
 * 
 * And then, for each request, either the match is looked up and handled by
 * the caller, or the router dispatches the request itself:
 * <pre>
 *   r.dispatch("/user/7"); // user.handle({id=7})
 *   r.dispatch("/nope");   // notFound.handle({})
 * </pre>
 * 
 * How a rule is matched is documented in the JavaDoc of {@link Rule}.
 */
public interface Router extends RuleTable, Matcher
{
    /**
     * Creates a router using {@link Config#DEFAULT}.
     * 
     * @return a new router
     */
    static Router create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates a router.
     * 
     * @param config of router
     * 
     * @return a new router
     * 
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    static Router create(Config config) {
        var loader = ServiceLoader.load(RouterFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config);
    }
    
    /**
     * Returns the configuration of this router.
     * 
     * @return the configuration of this router
     */
    Config config();
    
    /**
     * Matches the request path and invokes the matched rule's handler.<p>
     * 
     * If no rule matched the request path, then the
     * {@linkplain Config#notFoundPattern() not-found pattern} is matched
     * instead.<p>
     * 
     * The handler is invoked with {@link Match#arguments()} by the calling
     * thread. Any exception thrown by the handler propagates as-is.
     * 
     * @param uri request path
     * 
     * @return the match whose handler was invoked
     * 
     * @throws NullPointerException
     *             if {@code uri} is {@code null}
     * @throws NoRuleFoundException
     *             if no rule matched, not even the not-found pattern
     * @throws RequisiteException
     *             if a requisite abstained and requisites are strict
     * 
     * @see Handler
     */
    Match dispatch(String uri);
}
