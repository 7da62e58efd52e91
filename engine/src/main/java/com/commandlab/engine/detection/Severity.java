package com.commandlab.engine.detection;

public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }
