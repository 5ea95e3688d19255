package alpha.simplrouter.route;

import alpha.simplrouter.handler.Handler;

import java.util.List;

/**
 * An ordered table of rules.<p>
 * 
 * Each rule is stored under a generic key, which is the rule's pattern with
 * all variable names removed. Patterns "/user/{id}" and "/user/{name}" both
 * have the key "/user/{}" and can not both be registered; they would be
 * indistinguishable to the matcher.<p>
 * 
 * The table is built when the application starts and is then treated as
 * read-only. The implementation performs no synchronization and must not be
 * modified concurrently with a match attempt.
 */
public interface RuleTable
{
    /**
     * Registers a new rule.<p>
     * 
     * If the table has a prefix and the pattern starts with a forward slash,
     * then the prefix is prepended to the pattern.
     * 
     * @param pattern of rule
     * @param handler of rule
     * 
     * @return the new rule, for further configuration
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RuleCollisionException
     *             if an equivalent rule has already been registered
     */
    Rule register(String pattern, Handler handler);
    
    /**
     * Registers a new rule, replacing any equivalent rule.<p>
     * 
     * The new rule is appended to the end of the table. If there was no rule
     * to replace, a warning is logged but the rule is registered anyway.
     * 
     * @param pattern of rule
     * @param handler of rule
     * 
     * @return the new rule, for further configuration
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    Rule override(String pattern, Handler handler);
    
    /**
     * Removes the rule equivalent to the given pattern.<p>
     * 
     * Variable names in the pattern do not matter; "/user/{}" removes
     * "/user/{id}". The prefix is applied just as for registration.
     * 
     * @param pattern of rule
     * 
     * @return the removed rule ({@code null} if there was none)
     * 
     * @throws NullPointerException
     *             if {@code pattern} is {@code null}
     */
    Rule remove(String pattern);
    
    /**
     * Returns the rule equivalent to the given pattern.
     * 
     * @param pattern of rule
     * 
     * @return the rule ({@code null} if there is none)
     * 
     * @throws NullPointerException
     *             if {@code pattern} is {@code null}
     * 
     * @see #remove(String)
     */
    Rule get(String pattern);
    
    /**
     * Returns all rules in the order they will be matched.
     * 
     * @return all rules (an unmodifiable snapshot)
     */
    List<Rule> rules();
    
    /**
     * Returns the number of rules.
     * 
     * @return the number of rules
     */
    int size();
    
    /**
     * Sets the prefix applied to rules registered hereafter.<p>
     * 
     * Already registered rules are not affected.
     * 
     * @param prefix new prefix (may be empty)
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code prefix} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code prefix} is non-empty and does not start with a
     *             forward slash, or if it ends with a forward slash
     */
    RuleTable setPrefix(String prefix);
    
    /**
     * Returns the current prefix.
     * 
     * @return the current prefix (never {@code null})
     */
    String prefix();
}
