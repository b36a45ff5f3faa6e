package org.specrun.tree;

/**
 * Wraps the rest of an example's evaluation.
 *
 * <p>A well-behaved hook invokes {@code next} exactly once. Each invocation of {@code next} is evaluated
 * as its own sub-evaluation; the example still reports a single result.
 */
@FunctionalInterface
public interface AroundHook {
    void around(HookAction next) throws Exception;
}
