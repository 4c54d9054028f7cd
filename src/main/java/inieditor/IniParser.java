package inieditor;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Recursive-descent parser for the grammar in {@link IniGrammar}. Each
 * production has its own method; comment runs are resolved with
 * {@link IniGrammar#classifyAhead} before a production is entered.
 * <p>
 * Parsing is all or nothing: on error no tree is returned.
 */
@Slf4j
public class IniParser {

    private final Options options;

    public IniParser() {
        this(Options.builder().build());
    }

    public IniParser(Options options) {
        this.options = Validate.notNull(options, "options must not be null");
    }

    public IniDocument parse(String sourceLabel, String text) throws IniParseException {
        Validate.notNull(text, "text must not be null");
        try {
            IniDocument document = new ParseContext(sourceLabel, text, options).document();
            log.debug("Parsed {}: {} global properties, {} sections",
                    sourceLabel, document.getProperties().size(), document.getSections().size());
            return document;
        } catch (IniParseException e) {
            log.debug("Failed to parse {}: {}", sourceLabel, e.getMessage());
            throw e;
        }
    }

    @Getter
    @Builder
    @ToString
    public static class Options {
        /** Accept {@code \r\n} as a line break. */
        @Builder.Default
        private final boolean crlfNewlines = true;

        /** Longest comment run allowed above a property or section, {@code 0} for no limit. */
        @Builder.Default
        private final int maxCommentLookahead = 0;
    }

    private static final class ParseContext {
        private final String sourceLabel;
        private final IniLexer.Cursor cursor;
        private final int maxCommentLookahead;
        private final List<IniToken> buffer = new ArrayList<>();
        private int pos;

        ParseContext(String sourceLabel, String text, Options options) {
            this.sourceLabel = sourceLabel;
            this.cursor = new IniLexer(sourceLabel, text, options.isCrlfNewlines()).cursor();
            this.maxCommentLookahead = options.getMaxCommentLookahead();
        }

        IniDocument document() throws IniParseException {
            IniDocument document = new IniDocument();
            document.getBlankLines().addAll(blankLines());

            IniGrammar.Lookahead ahead = lookahead();
            while (ahead.getProduction() == IniGrammar.Production.PROPERTY) {
                document.getProperties().add(property());
                ahead = lookahead();
            }
            while (ahead.getProduction() == IniGrammar.Production.SECTION) {
                document.getSections().add(section());
                ahead = lookahead();
            }

            if (ahead.getDistance() == 0 && peek().is(TokenType.EOF)) {
                return document;
            }
            IniToken found = peek(ahead.getDistance());
            if (ahead.getCommentLines() > 0) {
                throw unexpected(found, "property key", "\"[\"");
            }
            throw unexpected(found, "property key", "\"[\"", "comment", "end of input");
        }

        private IniProperty property() throws IniParseException {
            List<String> comments = commentLines();
            String key = expect(TokenType.IDENT, "property key").getText();
            expect(TokenType.EQUALS, "\"=\"");
            IniProperty property = new IniProperty(key, value());
            property.getComments().addAll(comments);
            optionalNewline();
            property.getBlankLines().addAll(blankLines());
            return property;
        }

        private IniSection section() throws IniParseException {
            List<String> comments = commentLines();
            expect(TokenType.LBRACKET, "\"[\"");
            IniSection section = new IniSection(expect(TokenType.IDENT, "section name").getText());
            if (!peek().is(TokenType.RBRACKET)) {
                throw new IniParseException(sourceLabel, peek().getPosition(),
                        "unclosed section header [" + section.getName() + ", found " + peek().describe(),
                        List.of("\"]\""));
            }
            next();
            section.getComments().addAll(comments);
            optionalNewline();
            section.getBlankLines().addAll(blankLines());
            while (lookahead().getProduction() == IniGrammar.Production.PROPERTY) {
                section.getProperties().add(property());
            }
            return section;
        }

        private Value value() throws IniParseException {
            IniToken token = peek();
            switch (token.getType()) {
                case STRING:
                    next();
                    try {
                        return new StringValue(QuotedStrings.unquote(token.getText()));
                    } catch (IllegalArgumentException e) {
                        throw new IniParseException(sourceLabel, token.getPosition(), e.getMessage());
                    }
                case NUMBER:
                    next();
                    double number = Double.parseDouble(token.getText());
                    if (!Double.isFinite(number)) {
                        throw new IniParseException(sourceLabel, token.getPosition(),
                                "number out of range " + StringUtils.abbreviate(token.getText(), 32),
                                List.of("number"));
                    }
                    return new NumberValue(number);
                default:
                    throw unexpected(token, "string", "number");
            }
        }

        /**
         * {@code (Comment Newline)*}. Only entered after the lookahead has
         * confirmed the run ends in the production being parsed.
         */
        private List<String> commentLines() throws IniParseException {
            List<String> comments = new ArrayList<>();
            while (peek().is(TokenType.COMMENT)) {
                comments.add(next().getText());
                expect(TokenType.NEWLINE, "newline");
            }
            return comments;
        }

        private List<String> blankLines() throws IniLexException {
            List<String> blanks = new ArrayList<>();
            while (peek().is(TokenType.NEWLINE)) {
                blanks.add(next().getText());
            }
            return blanks;
        }

        private void optionalNewline() throws IniLexException {
            if (peek().is(TokenType.NEWLINE)) {
                next();
            }
        }

        private IniGrammar.Lookahead lookahead() throws IniLexException {
            return IniGrammar.classifyAhead(this::peek, maxCommentLookahead);
        }

        private IniToken expect(TokenType type, String construct) throws IniParseException {
            IniToken token = peek();
            if (!token.is(type)) {
                throw unexpected(token, construct);
            }
            return next();
        }

        private IniParseException unexpected(IniToken token, String... expected) {
            return new IniParseException(sourceLabel, token.getPosition(),
                    "unexpected " + token.describe(), Arrays.asList(expected));
        }

        private IniToken peek() throws IniLexException {
            return peek(0);
        }

        private IniToken peek(int distance) throws IniLexException {
            while (buffer.size() <= pos + distance) {
                if (!buffer.isEmpty() && buffer.get(buffer.size() - 1).is(TokenType.EOF)) {
                    return buffer.get(buffer.size() - 1);
                }
                buffer.add(cursor.next());
            }
            return buffer.get(pos + distance);
        }

        private IniToken next() throws IniLexException {
            IniToken token = peek();
            if (!token.is(TokenType.EOF)) {
                pos++;
            }
            return token;
        }
    }
}
