package io.nodewright.core.batch;

import java.util.List;

/// One non-blank, non-comment line of a batch script, split into tokens.
///
/// @param number 1-based line number in the script
/// @param text original line text, trimmed
/// @param verb first token, lower-cased
/// @param args remaining tokens; double-quoted tokens keep their quotes
public record ScriptLine(int number, String text, String verb, List<String> args) {

    public ScriptLine {
        args = List.copyOf(args);
    }
}
