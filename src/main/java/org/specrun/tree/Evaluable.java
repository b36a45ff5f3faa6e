package org.specrun.tree;

import org.specrun.result.Result;

/**
 * Body of an example. Throwing is equivalent to returning the result mapped by
 * {@link Result#fromThrowable(Throwable)}.
 */
@FunctionalInterface
public interface Evaluable {
    Result evaluate(ExampleParams params) throws Exception;

    static Evaluable of(HookAction action) {
        return params -> {
            action.run();
            return Result.success();
        };
    }
}
