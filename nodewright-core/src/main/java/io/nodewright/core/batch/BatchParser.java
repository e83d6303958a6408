package io.nodewright.core.batch;

import io.nodewright.core.exception.BatchScriptException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/// Splits batch script text into {@link ScriptLine}s.
///
/// Blank lines and lines starting with `#` are skipped. Tokens are separated
/// by whitespace, except inside double quotes, so `title="Upscaled image"` is
/// one token. Verbs are not validated here; an unknown verb fails when the
/// line is executed.
public final class BatchParser {

    private BatchParser() {}

    /// Parses a whole script.
    ///
    /// @param script script text, not null
    /// @return lines in script order, never null
    /// @throws BatchScriptException if a line has an unterminated quote
    public static List<ScriptLine> parse(String script) throws BatchScriptException {
        Objects.requireNonNull(script, "script must not be null");
        List<ScriptLine> lines = new ArrayList<>();
        String[] raw = script.split("\\R", -1);
        for (int i = 0; i < raw.length; i++) {
            String text = raw[i].strip();
            if (text.isEmpty() || text.startsWith("#")) {
                continue;
            }
            List<String> tokens = tokenize(text, i + 1);
            lines.add(
                    new ScriptLine(
                            i + 1,
                            text,
                            tokens.get(0).toLowerCase(Locale.ROOT),
                            tokens.subList(1, tokens.size())));
        }
        return lines;
    }

    static List<String> tokenize(String text, int lineNumber) throws BatchScriptException {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (Character.isWhitespace(c) && !quoted) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new BatchScriptException(lineNumber, "unterminated quote in '" + text + "'");
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
