package inieditor;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Grammar tables shared by the parser:
 * <pre>
 * Document := BlankLine* Property* Section*
 * Property := (Comment Newline)* Ident '=' Value Newline? BlankLine*
 * Section  := (Comment Newline)* '[' Ident ']' Newline? BlankLine* Property*
 * Value    := String | Number
 * </pre>
 * The tables are checked once when the class loads; an inconsistent table
 * fails initialization with {@link GrammarDefinitionError}.
 */
public final class IniGrammar {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    /** Token that may introduce a production once its comment prefix is skipped. */
    static final Map<Production, Set<TokenType>> FIRST;

    static {
        Map<Production, Set<TokenType>> first = new EnumMap<>(Production.class);
        first.put(Production.PROPERTY, EnumSet.of(TokenType.IDENT));
        first.put(Production.SECTION, EnumSet.of(TokenType.LBRACKET));
        first.put(Production.VALUE, EnumSet.of(TokenType.STRING, TokenType.NUMBER));
        check(first);
        FIRST = Collections.unmodifiableMap(first);
    }

    private IniGrammar() {
    }

    public enum Production {
        PROPERTY,
        SECTION,
        VALUE
    }

    /**
     * Outcome of looking past a comment run.
     * {@code production} is {@code null} when the token found starts neither a
     * property nor a section; {@code distance} is how far ahead that token is.
     */
    @Value
    public static class Lookahead {
        Production production;
        int distance;
        int commentLines;

        public boolean isResolved() {
            return production != null;
        }
    }

    /**
     * Token window the lookahead reads from; {@code peek(0)} is the current token.
     */
    @FunctionalInterface
    public interface TokenWindow {
        IniToken peek(int distance) throws IniLexException;
    }

    /**
     * Skips {@code Comment Newline} pairs from the current token and decides
     * whether the run belongs to a property or a section.
     *
     * @param maxCommentLines longest comment run to skip, {@code 0} for no limit
     */
    public static Lookahead classifyAhead(TokenWindow window, int maxCommentLines) throws IniLexException {
        int distance = 0;
        int lines = 0;
        while (window.peek(distance).is(TokenType.COMMENT)) {
            if (maxCommentLines > 0 && lines == maxCommentLines) {
                return new Lookahead(null, distance, lines);
            }
            if (!window.peek(distance + 1).is(TokenType.NEWLINE)) {
                return new Lookahead(null, distance + 1, lines);
            }
            distance += 2;
            lines++;
        }
        TokenType type = window.peek(distance).getType();
        if (FIRST.get(Production.PROPERTY).contains(type)) {
            return new Lookahead(Production.PROPERTY, distance, lines);
        }
        if (FIRST.get(Production.SECTION).contains(type)) {
            return new Lookahead(Production.SECTION, distance, lines);
        }
        return new Lookahead(null, distance, lines);
    }

    public static boolean isIdentifier(String s) {
        return s != null && IDENTIFIER.matcher(s).matches();
    }

    /**
     * Property and Section share the comment prefix and are told apart by one
     * token only, so their FIRST sets must be non-empty, disjoint and free of
     * the tokens the prefix is made of.
     */
    static void check(Map<Production, Set<TokenType>> first) {
        for (Production production : Production.values()) {
            Set<TokenType> tokens = first.get(production);
            if (tokens == null || tokens.isEmpty()) {
                throw new GrammarDefinitionError("no FIRST tokens for " + production);
            }
            if (tokens.contains(TokenType.COMMENT) || tokens.contains(TokenType.NEWLINE)) {
                throw new GrammarDefinitionError(production + " may start with a comment prefix token");
            }
        }
        Set<TokenType> overlap = EnumSet.copyOf(first.get(Production.PROPERTY));
        overlap.retainAll(first.get(Production.SECTION));
        if (!overlap.isEmpty()) {
            throw new GrammarDefinitionError("PROPERTY and SECTION both start with " + overlap);
        }
    }
}
