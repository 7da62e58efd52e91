package com.commandlab.engine.detection;

public enum EffectCategory { FILE_SYSTEM, EDITOR, SETTINGS, VIEWS }
