package com.places.display.parser;

import com.places.display.parser.ast.FallbackNode;
import com.places.display.parser.ast.FilterNode;
import com.places.display.parser.ast.IdentifierNode;
import com.places.display.parser.ast.SequenceNode;
import com.places.display.parser.ast.SourceLocation;
import com.places.display.parser.grammar.DisplayOptionsBaseVisitor;
import com.places.display.parser.grammar.DisplayOptionsLexer;
import com.places.display.parser.grammar.DisplayOptionsParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parses display option expressions into a {@link SequenceNode} tree.
 *
 * <p>The grammar accepts any mix of text and groups inside a segment or filter item. This builder
 * applies the shape rules on top of it: an identifier, then at most one filter and one fallback in
 * either order; filter items are plain values or {@code attr(values)} predicates, and a leading
 * {@code +} or {@code -} item switches a filter between allow-list and deny-list semantics. Content
 * that does not fit is logged and skipped so that the rest of the expression still renders.</p>
 */
public final class DisplayOptionsAstBuilder {
    private static final Logger LOGGER = Logger.getLogger(DisplayOptionsAstBuilder.class.getName());

    public SequenceNode parse(String expression) throws DisplayOptionsParseException {
        Objects.requireNonNull(expression, "expression");

        DisplayOptionsLexer lexer = new DisplayOptionsLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        if (DebugFlags.isTokenDumpEnabled()) {
            tokens.fill();
            DebugFlags.dumpTokens(expression, tokens, lexer.getVocabulary());
            tokens.seek(0);
        }

        DisplayOptionsParser parser = new DisplayOptionsParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        try {
            DisplayOptionsParser.DisplayOptionsContext context = parser.displayOptions();
            return new AstBuildingVisitor().build(context);
        } catch (ParseCancellationException ex) {
            throw new DisplayOptionsParseException(ex.getMessage(), ex);
        }
    }

    private static final class AstBuildingVisitor extends DisplayOptionsBaseVisitor<SequenceNode> {

        SequenceNode build(DisplayOptionsParser.DisplayOptionsContext context) {
            return visitDisplayOptions(context);
        }

        @Override
        public SequenceNode visitDisplayOptions(DisplayOptionsParser.DisplayOptionsContext ctx) {
            return visitExpression(ctx.expression());
        }

        @Override
        public SequenceNode visitExpression(DisplayOptionsParser.ExpressionContext ctx) {
            List<IdentifierNode> segments = new ArrayList<>();
            for (DisplayOptionsParser.SegmentContext segment : ctx.segment()) {
                Segment built = buildSegment(segment);
                if (built.node() != null) {
                    segments.add(built.node());
                }
                if (built.endsList()) {
                    break;
                }
            }
            return new SequenceNode(segments);
        }

        /**
         * Content after a segment's groups that is not a comma ends the enclosing list: the
         * segment itself still renders, its later siblings do not.
         */
        private Segment buildSegment(DisplayOptionsParser.SegmentContext ctx) {
            List<DisplayOptionsParser.SegmentPartContext> parts = ctx.segmentPart();
            StringBuilder name = new StringBuilder();
            int index = 0;
            while (index < parts.size() && parts.get(index).TEXT() != null) {
                name.append(parts.get(index).TEXT().getText());
                index++;
            }

            FilterNode filter = null;
            FallbackNode fallback = null;
            StringBuilder trailing = new StringBuilder();
            for (; index < parts.size(); index++) {
                DisplayOptionsParser.SegmentPartContext part = parts.get(index);
                if (trailing.length() == 0) {
                    if (part.TEXT() != null && part.TEXT().getText().isBlank()) {
                        continue;
                    }
                    if (part.fallback() != null && fallback == null) {
                        fallback = new FallbackNode(visitExpression(part.fallback().expression()));
                        continue;
                    }
                    if (part.filter() != null && filter == null) {
                        filter = buildFilter(part.filter());
                        continue;
                    }
                }
                trailing.append(part.getText());
            }

            String identifier = name.toString().strip();
            boolean endsList = trailing.length() > 0;
            if (endsList) {
                LOGGER.log(
                        Level.WARNING,
                        "Ignoring content after option \"{0}\" and the rest of its list: {1}",
                        new Object[] {identifier, trailing.toString().strip()});
            }
            if (identifier.isEmpty() && fallback == null) {
                return new Segment(null, endsList);
            }
            return new Segment(new IdentifierNode(identifier, locationOf(ctx), filter, fallback), endsList);
        }

        private FilterNode buildFilter(DisplayOptionsParser.FilterContext ctx) {
            boolean allow = true;
            Set<String> values = new LinkedHashSet<>();
            Map<String, Set<String>> includeAttributes = new LinkedHashMap<>();
            Map<String, Set<String>> excludeAttributes = new LinkedHashMap<>();

            List<DisplayOptionsParser.FilterItemContext> items = ctx.filterItem();
            for (int i = 0; i < items.size(); i++) {
                DisplayOptionsParser.FilterItemContext item = items.get(i);
                String text = item.getText().strip();
                if (i == 0 && isModifier(text)) {
                    allow = "+".equals(text);
                    continue;
                }
                if (text.isEmpty()) {
                    continue;
                }
                if (isPlainText(item)) {
                    values.add(normalizeValue(text));
                    continue;
                }
                AttributePredicate predicate = buildAttributePredicate(item);
                if (predicate == null) {
                    LOGGER.log(Level.WARNING, "Skipping malformed attribute filter: {0}", text);
                    continue;
                }
                if (predicate.allow()) {
                    includeAttributes.put(predicate.optionName(), predicate.values());
                } else {
                    excludeAttributes.put(predicate.optionName(), predicate.values());
                }
            }

            if (allow) {
                return new FilterNode(values, Set.of(), includeAttributes, excludeAttributes);
            }
            return new FilterNode(Set.of(), values, includeAttributes, excludeAttributes);
        }

        /** Accepts {@code name(values)}; any other arrangement of nested groups is rejected. */
        private AttributePredicate buildAttributePredicate(DisplayOptionsParser.FilterItemContext item) {
            List<DisplayOptionsParser.FilterPartContext> parts = new ArrayList<>(item.filterPart());
            while (!parts.isEmpty() && isBlankText(parts.get(parts.size() - 1))) {
                parts.remove(parts.size() - 1);
            }
            if (parts.size() != 2 || parts.get(0).TEXT() == null || parts.get(1).filter() == null) {
                return null;
            }
            String optionName = parts.get(0).TEXT().getText().strip().toLowerCase(Locale.ROOT);
            if (optionName.isEmpty()) {
                return null;
            }

            boolean allow = true;
            Set<String> values = new LinkedHashSet<>();
            List<DisplayOptionsParser.FilterItemContext> nested = parts.get(1).filter().filterItem();
            for (int i = 0; i < nested.size(); i++) {
                DisplayOptionsParser.FilterItemContext value = nested.get(i);
                if (!isPlainText(value)) {
                    return null;
                }
                String text = value.getText().strip();
                if (i == 0 && isModifier(text)) {
                    allow = "+".equals(text);
                    continue;
                }
                if (!text.isEmpty()) {
                    values.add(normalizeValue(text));
                }
            }
            return new AttributePredicate(optionName, allow, values);
        }

        private static boolean isPlainText(DisplayOptionsParser.FilterItemContext item) {
            for (DisplayOptionsParser.FilterPartContext part : item.filterPart()) {
                if (part.TEXT() == null) {
                    return false;
                }
            }
            return true;
        }

        private static boolean isBlankText(DisplayOptionsParser.FilterPartContext part) {
            return part.TEXT() != null && part.TEXT().getText().isBlank();
        }

        private static boolean isModifier(String text) {
            return "+".equals(text) || "-".equals(text);
        }

        private static String normalizeValue(String text) {
            return text.strip().toLowerCase(Locale.ROOT);
        }

        private static SourceLocation locationOf(ParserRuleContext ctx) {
            Token start = ctx.getStart();
            if (start == null || start.getType() == Token.EOF) {
                return SourceLocation.UNKNOWN;
            }
            return new SourceLocation(start.getLine(), start.getCharPositionInLine() + 1);
        }
    }

    private record Segment(IdentifierNode node, boolean endsList) {}

    private record AttributePredicate(String optionName, boolean allow, Set<String> values) {}
}
