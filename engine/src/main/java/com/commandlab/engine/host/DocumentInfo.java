package com.commandlab.engine.host;

/**
 * An open editor document.
 *
 * @param uri         document URI as a string (e.g. "file:///ws/a.txt")
 * @param languageId  language mode, "plaintext" when unknown
 * @param dirty       unsaved edits present
 * @param lineCount   number of lines in the current buffer
 * @param contentHash hash of the current buffer, may be null
 */
public record DocumentInfo(
        String  uri,
        String  languageId,
        boolean dirty,
        int     lineCount,
        String  contentHash) {}
