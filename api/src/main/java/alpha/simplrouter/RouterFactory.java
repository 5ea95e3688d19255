package alpha.simplrouter;

/**
 * Factory of {@code Router}.<p>
 * 
 * The library does not support custom implementations of the API, and
 * application code should have no use of this type. It is only public because
 * it is a requirement by Java's service-provider mechanism.
 */
@FunctionalInterface
public interface RouterFactory {
    /**
     * Creates a new {@code Router}.<p>
     * 
     * This method should only be used by the static method
     * {@link Router#create(Config) Router.create()}.
     * 
     * @param config of router
     * 
     * @return a new {@code Router}
     * 
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    Router create(Config config);
}
