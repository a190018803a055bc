package org.arpha.routing.target;

import java.util.Optional;

/**
 * Resolves the target part of an action descriptor ({@code App\Blog} in {@code App\Blog::show/0})
 * to something that can build target instances.
 */
public interface TargetLocator {

    Optional<TargetFactory> locate(String targetName);

}
