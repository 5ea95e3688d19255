package alpha.simplrouter.route;

import alpha.simplrouter.handler.Arguments;
import alpha.simplrouter.handler.Handler;

import java.util.Map;

/**
 * The result of a successful match.<p>
 * 
 * A match is created anew for each match attempt and is owned by the caller.
 * Invoking the handler is the caller's responsibility, for example:
 * <pre>
 *   router.match(uri).ifPresent(m -&gt; m.handler().handle(m.arguments()));
 * </pre>
 */
public interface Match
{
    /**
     * Returns the matched rule.
     * 
     * @return the matched rule
     */
    Rule rule();
    
    /**
     * Returns the matched rule's handler.
     * 
     * @return the matched rule's handler
     */
    Handler handler();
    
    /**
     * Returns variable values extracted from the request path, in the order
     * the variables appear in the rule's pattern.<p>
     * 
     * A value is {@code null} if the request path had no segment at the
     * variable's position, which is possible only if the pattern has a
     * wildcard further along.
     * 
     * @return variables extracted from the request path (unmodifiable)
     */
    Map<String, String> routeVars();
    
    /**
     * Returns a variable value.
     * 
     * @param name of variable
     * 
     * @return the value ({@code null} if there is no such variable)
     */
    String routeVar(String name);
    
    /**
     * Returns the static parameters of the matched rule.
     * 
     * @return the static parameters of the matched rule (unmodifiable)
     */
    Map<String, String> params();
    
    /**
     * Returns {@code true} if the matcher was invoked with wildcards ignored.
     * 
     * @return {@code true} if the matcher was invoked with wildcards ignored
     */
    boolean ignoresWildcard();
    
    /**
     * Returns the arguments to give the handler.<p>
     * 
     * The arguments consist of all {@link #routeVars()} followed by
     * all {@link #params()}. A parameter replaces the value of a variable with
     * the same name.
     * 
     * @return a new {@code Arguments} instance
     */
    default Arguments arguments() {
        return Rule.arguments(routeVars(), params());
    }
}
