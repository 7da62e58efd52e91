package com.commandlab.engine.detection;

/** Before/after pair; either side may be null when unknown or absent. */
public record Change<T>(T before, T after) {}
