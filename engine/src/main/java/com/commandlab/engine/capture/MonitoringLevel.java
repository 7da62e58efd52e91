package com.commandlab.engine.capture;

public enum MonitoringLevel { NONE, BASIC, COMPREHENSIVE }
