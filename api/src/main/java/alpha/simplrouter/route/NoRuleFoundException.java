package alpha.simplrouter.route;

import alpha.simplrouter.Config;
import alpha.simplrouter.Router;

import java.io.Serial;

/**
 * Thrown by {@link Router#dispatch(String)} if neither the request path nor
 * the {@linkplain Config#notFoundPattern() not-found pattern} matched a rule.
 */
public class NoRuleFoundException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final String uri;
    
    /**
     * Constructs a {@code NoRuleFoundException}.
     * 
     * @param uri request path
     */
    public NoRuleFoundException(String uri) {
        super("No rule found for \"" + uri + "\".");
        this.uri = uri;
    }
    
    /**
     * Returns the request path for which no {@link Rule} was found.
     * 
     * @return the request path for which no {@link Rule} was found
     */
    public String getUri() {
        return uri;
    }
}
