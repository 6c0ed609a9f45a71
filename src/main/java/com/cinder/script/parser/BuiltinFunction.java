package com.cinder.script.parser;

import java.util.List;

/** Functional interface for host-provided builtins. */
@FunctionalInterface
public interface BuiltinFunction {
    Value call(List<Value> args);
}
