package com.radoncal.server.pipeline;

@FunctionalInterface
public interface UnitFunction<T, R> {
    R apply(T item) throws Exception;
}
