package alpha.simplrouter.testutil;

import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.<p>
 * 
 * The library logs through {@code System.Logger}, which, absent another
 * provider, is backed by {@code java.util.logging}. The methods of this class
 * operate on the JUL logger named after the package of a given component.
 */
public final class Logging {
    private Logging() {
        // Empty
    }
    
    /**
     * Set logging level for the package of a given component.<p>
     * 
     * The level of the root logger's console handler is left untouched, so
     * records below {@code INFO} are only published to handlers added using
     * {@link #addHandler(Class, Handler)}, such as those of a {@link
     * LogRecorder}.
     * 
     * @param component to extract package from
     * @param level to set
     * 
     * @throws NullPointerException if any argument is {@code null}
     * 
     * @see #resetLevel(Class)
     */
    public static void setLevel(Class<?> component, System.Logger.Level level) {
        Logger.getLogger(component.getPackageName()).setLevel(LogRecords.toJUL(level));
    }
    
    /**
     * Reset the logging level of the package that the component belongs to.<p>
     * 
     * The logger will inherit the level of its parent.
     * 
     * @param component to extract package from
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void resetLevel(Class<?> component) {
        Logger.getLogger(component.getPackageName()).setLevel(null);
    }
    
    /**
     * Add handler to the logger of the package that the component belongs to.
     * 
     * @param component to extract package from
     * @param handler to add
     * 
     * @throws NullPointerException
     *             if {@code component} is {@code null}
     *             (should also be the case for {@code handler})
     */
    public static void addHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).addHandler(handler);
    }
    
    /**
     * Remove handler from the logger of the package that the component belongs to.
     * 
     * This method returns silently if the given handler is not found or
     * {@code null}.
     * 
     * @param component to extract package from
     * @param handler to remove (may be {@code null})
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).removeHandler(handler);
    }
}
