package com.commandlab.engine.capture;

/**
 * @param structure null for scalar and absent return values
 */
public record ReturnValueAnalysis(
        ReturnType    returnType,
        Structure     structure,
        boolean       containsSensitiveData,
        Serialization serialization) {

    public enum ReturnType { NONE, STRING, NUMBER, BOOLEAN, OBJECT, ARRAY }

    public enum Complexity { SIMPLE, MODERATE, COMPLEX }

    /** {@code keyCount} is set for objects, {@code arrayLength} for arrays. */
    public record Structure(
            boolean isObject,
            boolean isArray,
            Integer keyCount,
            Integer arrayLength,
            int     nestedLevels) {}

    /** {@code jsonSize} is in characters, null when not serializable. */
    public record Serialization(boolean isSerializable, Integer jsonSize, Complexity complexity) {}
}
