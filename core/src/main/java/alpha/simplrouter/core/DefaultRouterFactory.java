package alpha.simplrouter.core;

import alpha.simplrouter.Config;
import alpha.simplrouter.Router;
import alpha.simplrouter.RouterFactory;

/**
 * Default {@code RouterFactory}.<p>
 * 
 * Registered in the provider configuration file
 * {@code META-INF/services/alpha.simplrouter.RouterFactory}, which requires a
 * class with a public no-arg constructor.
 */
public class DefaultRouterFactory implements RouterFactory
{
    /**
     * Constructs this object.
     */
    public DefaultRouterFactory() {
        // Empty
    }
    
    @Override
    public Router create(Config config) {
        return new DefaultRouter(config);
    }
}
