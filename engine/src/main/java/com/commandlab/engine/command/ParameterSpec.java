package com.commandlab.engine.command;

/**
 * One entry of a command signature. Signature order is argument order.
 */
public record ParameterSpec(String name, ParameterType type, boolean required) {

    public static ParameterSpec required(String name, ParameterType type) {
        return new ParameterSpec(name, type, true);
    }

    public static ParameterSpec optional(String name, ParameterType type) {
        return new ParameterSpec(name, type, false);
    }
}
