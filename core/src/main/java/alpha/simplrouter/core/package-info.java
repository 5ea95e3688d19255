/**
 * Home of the library-provided router implementation.<p>
 * 
 * The public types in this package are {@link
 * alpha.simplrouter.core.DefaultRouter}, which is used by the {@link
 * alpha.simplrouter.Router} interface as the default implementation, and its
 * factory. All other types in this package can therefore be regarded as an
 * implementation detail.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments.
 */
package alpha.simplrouter.core;
