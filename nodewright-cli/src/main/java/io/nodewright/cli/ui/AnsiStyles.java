package io.nodewright.cli.ui;

/// ANSI text styling for CLI output with semantic color methods.
///
/// All methods return styled strings; output handling is the caller's
/// responsibility. With color disabled every method returns its input
/// unchanged, so output stays machine-readable.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.ok("Saved to " + path));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final int RULE_WIDTH = 60;

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    // --- Text Formatting ---

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Applies gray color for secondary elements.
    public String gray(String text) {
        return style(text, GRAY);
    }

    /// Applies blue for node references and other highlights.
    public String accent(String text) {
        return style(text, BLUE);
    }

    // --- Status Lines ---

    /// Formats a success line: ` [OK] text`.
    public String ok(String text) {
        return " " + style("[OK]", GREEN) + " " + text;
    }

    /// Formats a warning line: ` [WARN] text`.
    public String warn(String text) {
        return " " + style("[WARN]", YELLOW) + " " + text;
    }

    /// Formats a failure line: ` [FAIL] text`.
    public String fail(String text) {
        return " " + style("[FAIL]", RED) + " " + text;
    }

    // --- Symbols ---

    /// Right arrow for link direction.
    public String arrow() {
        return style("->", BLUE);
    }

    /// Full-width rule under report headings.
    public String rule() {
        return style("=".repeat(RULE_WIDTH), GRAY);
    }
}
