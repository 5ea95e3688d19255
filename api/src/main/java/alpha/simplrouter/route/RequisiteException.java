package alpha.simplrouter.route;

import alpha.simplrouter.Config;

import java.io.Serial;

/**
 * Thrown by a {@link Matcher} if a {@link Requisite} returned {@code null} and
 * {@link Config#strictRequisites()} is {@code true}.
 */
public class RequisiteException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final transient Rule rule;
    
    /**
     * Constructs a {@code RequisiteException}.
     * 
     * @param rule whose requisite abstained
     */
    public RequisiteException(Rule rule) {
        super("A requisite for rule \"" + rule + "\" did not return a boolean.");
        this.rule = rule;
    }
    
    /**
     * Returns the rule whose requisite abstained.
     * 
     * @return the rule whose requisite abstained
     *         ({@code null} if this exception was deserialized)
     */
    public Rule getRule() {
        return rule;
    }
}
