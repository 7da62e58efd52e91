package com.commandlab.engine.host;

public record EditorInfo(String documentUri, int column, Selection selection) {}
