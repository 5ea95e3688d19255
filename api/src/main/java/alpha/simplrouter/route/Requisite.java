package alpha.simplrouter.route;

import alpha.simplrouter.Config;

/**
 * A gate which must be open for a {@link Rule} to match.<p>
 * 
 * Requisites are evaluated on each match attempt, by the thread calling the
 * matcher, in the order they were added to the rule. They may have side
 * effects, such as checking a session or logging the attempt. The router
 * imposes no timeout.<p>
 * 
 * A requisite may return {@code null} to abstain, what happens then is
 * controlled by {@link Config#strictRequisites()}.
 */
@FunctionalInterface
public interface Requisite
{
    /**
     * Evaluates this requisite.
     * 
     * @return {@code TRUE} to pass, {@code FALSE} to reject the rule
     */
    Boolean test();
}
