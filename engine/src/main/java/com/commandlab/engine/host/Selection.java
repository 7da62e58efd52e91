package com.commandlab.engine.host;

/** Zero-based editor selection; an empty selection is a cursor position. */
public record Selection(int startLine, int startCharacter, int endLine, int endCharacter) {

    public static Selection cursorAtStart() {
        return new Selection(0, 0, 0, 0);
    }
}
