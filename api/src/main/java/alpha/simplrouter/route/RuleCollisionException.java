package alpha.simplrouter.route;

import java.io.Serial;

/**
 * Thrown by {@link RuleTable#register(String, alpha.simplrouter.handler.Handler)}
 * when an attempt is made to register a rule which is equivalent to an already
 * registered rule.
 * 
 * @see RuleTable#override(String, alpha.simplrouter.handler.Handler)
 */
public class RuleCollisionException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RuleCollisionException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RuleCollisionException(String message) {
        super(message);
    }
}
