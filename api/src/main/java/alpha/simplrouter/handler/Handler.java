package alpha.simplrouter.handler;

import alpha.simplrouter.Router;
import alpha.simplrouter.route.Match;

/**
 * The application code bound to a rule.<p>
 * 
 * The router never invokes a handler while matching. The handler is returned
 * as part of a {@link Match} for the caller to invoke, or invoked by
 * {@link Router#dispatch(String)}.
 */
@FunctionalInterface
public interface Handler
{
    /**
     * Handles a request.
     * 
     * @param arguments route variables and static parameters
     */
    void handle(Arguments arguments);
}
