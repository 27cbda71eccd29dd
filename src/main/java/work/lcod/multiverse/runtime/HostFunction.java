package work.lcod.multiverse.runtime;

import java.util.List;

/**
 * A function implemented in Java and callable from analysis code. Arguments arrive evaluated and normalized
 * (numbers as {@link Double}, immutable lists and records).
 */
@FunctionalInterface
public interface HostFunction {
    Object invoke(ExecutionContext ctx, List<Object> args) throws Exception;
}
