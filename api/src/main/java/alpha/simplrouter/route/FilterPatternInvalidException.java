package alpha.simplrouter.route;

import java.io.Serial;
import java.util.regex.PatternSyntaxException;

/**
 * Thrown by {@link Rule#setFilter(String, String)} if the regular expression
 * does not compile.
 */
public class FilterPatternInvalidException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     * 
     * @param variable name of filtered variable
     * @param cause the syntax error
     */
    public FilterPatternInvalidException(String variable, PatternSyntaxException cause) {
        super("Filter for variable \"" + variable +
              "\" is not a valid regular expression: " + cause.getPattern(), cause);
    }
}
