package com.places.display.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;

/**
 * Opt-in token dump for seeing how an expression was split before parsing. Enabled with the
 * {@code places.display.debugTokens} system property, or {@code PLACES_DISPLAY_DEBUG_TOKENS} when
 * the property is unset.
 */
public final class DebugFlags {
    static final String TOKENS_PROPERTY = "places.display.debugTokens";
    private static final String TOKENS_ENV = "PLACES_DISPLAY_DEBUG_TOKENS";
    private static final ThreadLocal<List<String>> DUMPED_TOKENS = ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDumpEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value == null) {
            value = System.getenv(TOKENS_ENV);
        }
        return Boolean.parseBoolean(value);
    }

    /** Writes one line per token, EOF included, to stderr and keeps them for the current thread. */
    static void dumpTokens(String expression, CommonTokenStream tokens, Vocabulary vocabulary) {
        System.err.println("[Places Display] Tokens of \"" + expression + "\":");
        for (Token token : tokens.getTokens()) {
            String text = token.getType() == Token.EOF ? "" : token.getText();
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-8s col %-3d '%s'",
                            vocabulary.getSymbolicName(token.getType()),
                            token.getCharPositionInLine() + 1,
                            text);
            System.err.println("  " + line);
            DUMPED_TOKENS.get().add(line);
        }
    }

    /** Returns and forgets the lines dumped on this thread. */
    static List<String> drainDumpedTokens() {
        List<String> dumped = List.copyOf(DUMPED_TOKENS.get());
        DUMPED_TOKENS.get().clear();
        return dumped;
    }
}
