package com.commandlab.engine.command;

public enum ParameterKind {
    STRING, NUMBER, BOOLEAN, OBJECT, ARRAY, URI, URI_ARRAY, UNION, UNKNOWN
}
