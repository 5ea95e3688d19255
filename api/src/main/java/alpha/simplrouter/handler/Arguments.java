package alpha.simplrouter.handler;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An ordered, string-keyed bag of values handed to a {@link Handler}.<p>
 * 
 * Keys are never {@code null}. Values may be {@code null}; a route variable
 * with no corresponding request path segment has the {@code null} value.<p>
 * 
 * This class is not thread-safe.
 */
public final class Arguments implements Iterable<Map.Entry<String, String>>
{
    private final Map<String, String> map;
    
    /**
     * Constructs an empty {@code Arguments}.
     */
    public Arguments() {
        this.map = new LinkedHashMap<>();
    }
    
    /**
     * Constructs an {@code Arguments} with a copy of the given entries.
     * 
     * @param entries to copy
     * 
     * @throws NullPointerException
     *             if {@code entries} or a key is {@code null}
     */
    public Arguments(Map<String, String> entries) {
        this();
        setAll(entries, true);
    }
    
    /**
     * Returns a value.
     * 
     * @param key of value
     * @return the value ({@code null} if absent or the value is {@code null})
     */
    public String get(String key) {
        return map.get(key);
    }
    
    /**
     * Returns whether the key is present.
     * 
     * @param key of value
     * @return whether the key is present
     */
    public boolean has(String key) {
        return map.containsKey(key);
    }
    
    /**
     * Returns whether any key has the given value.
     * 
     * @param value to look for (may be {@code null})
     * @return whether any key has the given value
     */
    public boolean contains(String value) {
        return map.containsValue(value);
    }
    
    /**
     * Sets a value.<p>
     * 
     * A new key is appended last, an existing key keeps its position.
     * 
     * @param key of value
     * @param value to set (may be {@code null})
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException if {@code key} is {@code null}
     */
    public Arguments set(String key, String value) {
        map.put(requireNonNull(key), value);
        return this;
    }
    
    /**
     * Sets all entries of the given map.
     * 
     * @param entries to set
     * @param overwrite {@code true} if a given value replaces an existing one,
     *                  {@code false} if an existing value is kept
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code entries} or a key is {@code null}
     */
    public Arguments setAll(Map<String, String> entries, boolean overwrite) {
        entries.forEach((k, v) -> {
            requireNonNull(k);
            if (overwrite || !map.containsKey(k)) {
                map.put(k, v);
            }
        });
        return this;
    }
    
    /**
     * Removes a value.
     * 
     * @param key of value
     * @return {@code true} if the key was present, otherwise {@code false}
     */
    public boolean remove(String key) {
        if (!map.containsKey(key)) {
            return false;
        }
        map.remove(key);
        return true;
    }
    
    /**
     * Removes all values.
     * 
     * @return this (for chaining/fluency)
     */
    public Arguments clear() {
        map.clear();
        return this;
    }
    
    /**
     * Returns all keys in iteration order.
     * 
     * @return all keys (a snapshot)
     */
    public List<String> keys() {
        return List.copyOf(map.keySet());
    }
    
    /**
     * Returns the number of entries.
     * 
     * @return the number of entries
     */
    public int size() {
        return map.size();
    }
    
    /**
     * Returns {@code true} if there are no entries.
     * 
     * @return {@code true} if there are no entries
     */
    public boolean isEmpty() {
        return map.isEmpty();
    }
    
    /**
     * Returns an unmodifiable view of the entries.
     * 
     * @return an unmodifiable view of the entries
     */
    public Map<String, String> toMap() {
        return Collections.unmodifiableMap(map);
    }
    
    @Override
    public Iterator<Map.Entry<String, String>> iterator() {
        return toMap().entrySet().iterator();
    }
    
    @Override
    public boolean equals(Object obj) {
        return obj instanceof Arguments &&
               Objects.equals(map, ((Arguments) obj).map);
    }
    
    @Override
    public int hashCode() {
        return map.hashCode();
    }
    
    @Override
    public String toString() {
        return map.toString();
    }
}
