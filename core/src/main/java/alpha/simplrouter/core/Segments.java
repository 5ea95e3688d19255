package alpha.simplrouter.core;

import alpha.simplrouter.route.Rule;

import java.util.StringJoiner;

/**
 * Splits patterns and request paths into segments, and derives the generic
 * key of a pattern.
 */
final class Segments
{
    /** Replaces each variable segment in a generic key. */
    static final String VARIABLE_KEY = "" + Rule.VARIABLE_FIRST + Rule.VARIABLE_LAST;
    
    private Segments() {
        // Empty
    }
    
    /**
     * Splits the given path on each forward slash.<p>
     * 
     * Unlike {@code String.split(String)}, trailing empty segments are kept.
     * <pre>
     *   split("")      -&gt; [""]
     *   split("/")     -&gt; ["", ""]
     *   split("/a/")   -&gt; ["", "a", ""]
     *   split("404")   -&gt; ["404"]
     * </pre>
     * 
     * @param path to split
     * @return the segments (never empty)
     */
    static String[] split(String path) {
        return path.split("/", -1);
    }
    
    /**
     * Returns the name of a variable segment.
     * 
     * @param segment a variable segment
     * @return the name of the variable
     */
    static String variableName(String segment) {
        assert Rule.isVariable(segment);
        return segment.substring(1, segment.length() - 1);
    }
    
    /**
     * Returns the generic key of a pattern.<p>
     * 
     * The generic key is the pattern with each variable segment replaced by
     * {@value #VARIABLE_KEY}.
     * <pre>
     *   genericKey("/user/{id}/[*]") -&gt; "/user/{}/[*]"
     * </pre>
     * 
     * @param pattern of rule
     * @return the generic key
     */
    static String genericKey(String pattern) {
        var key = new StringJoiner("/");
        for (String s : split(pattern)) {
            key.add(Rule.isVariable(s) ? VARIABLE_KEY : s);
        }
        return key.toString();
    }
}
