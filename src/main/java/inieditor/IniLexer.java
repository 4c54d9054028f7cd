package inieditor;

import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits INI text into tokens. Horizontal whitespace is skipped, everything
 * else becomes a token; the last token is always {@link TokenType#EOF}.
 * <p>
 * The lexer holds no cursor state itself: every call to {@link #cursor()}
 * starts a new pass from the beginning of the text.
 */
public class IniLexer {

    private final String sourceLabel;
    private final String text;
    private final boolean crlfNewlines;

    public IniLexer(String sourceLabel, String text) {
        this(sourceLabel, text, true);
    }

    public IniLexer(String sourceLabel, String text, boolean crlfNewlines) {
        Validate.notNull(text, "text must not be null");
        this.sourceLabel = StringUtils.defaultString(sourceLabel);
        this.text = text;
        this.crlfNewlines = crlfNewlines;
    }

    public Cursor cursor() {
        return new Cursor();
    }

    /**
     * Runs a full pass and returns every token, {@code EOF} included.
     */
    public List<IniToken> tokenize() throws IniLexException {
        List<IniToken> tokens = new ArrayList<>();
        Cursor cursor = cursor();
        IniToken token;
        do {
            token = cursor.next();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    /**
     * One lazy pass over the text. Once {@code EOF} has been returned, further
     * calls keep returning it.
     */
    public final class Cursor {
        private int offset;
        private int line = 1;
        private int column = 1;

        private Cursor() {
        }

        public IniToken next() throws IniLexException {
            skipWhitespace();
            Position start = new Position(line, column, offset);
            if (offset >= text.length()) {
                return new IniToken(TokenType.EOF, "", start);
            }

            char c = text.charAt(offset);
            if (CharUtils.isAsciiAlpha(c)) {
                return emit(TokenType.IDENT, identEnd(), start);
            }
            if (CharUtils.isAsciiNumeric(c)) {
                return emit(TokenType.NUMBER, numberEnd(start), start);
            }
            switch (c) {
                case '"':
                    return emit(TokenType.STRING, stringEnd(start), start);
                case '[':
                    return emit(TokenType.LBRACKET, offset + 1, start);
                case ']':
                    return emit(TokenType.RBRACKET, offset + 1, start);
                case '=':
                    return emit(TokenType.EQUALS, offset + 1, start);
                case '#':
                case ';':
                    return emit(TokenType.COMMENT, lineEnd(), start);
                case '\n':
                    return newline(offset + 1, start);
                case '\r':
                    if (crlfNewlines && offset + 1 < text.length() && text.charAt(offset + 1) == '\n') {
                        return newline(offset + 2, start);
                    }
                    break;
                default:
                    break;
            }
            throw new IniLexException(sourceLabel, start, "unexpected character " + printable(c));
        }

        private void skipWhitespace() {
            while (offset < text.length()) {
                char c = text.charAt(offset);
                if (c != ' ' && c != '\t') {
                    return;
                }
                offset++;
                column++;
            }
        }

        private int identEnd() {
            int i = offset + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (!CharUtils.isAsciiAlphanumeric(c) && c != '_') {
                    break;
                }
                i++;
            }
            return i;
        }

        private int numberEnd(Position start) throws IniLexException {
            int i = digitsEnd(offset);
            if (i < text.length() && text.charAt(i) == '.') {
                int fraction = digitsEnd(i + 1);
                if (fraction == i + 1) {
                    throw new IniLexException(sourceLabel, start,
                            "malformed number \"" + text.substring(offset, i + 1) + "\"");
                }
                i = fraction;
            }
            return i;
        }

        private int digitsEnd(int from) {
            int i = from;
            while (i < text.length() && CharUtils.isAsciiNumeric(text.charAt(i))) {
                i++;
            }
            return i;
        }

        private int stringEnd(Position start) throws IniLexException {
            int i = offset + 1;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '"') {
                    return i + 1;
                }
                if (c == '\n' || c == '\r') {
                    break;
                }
                if (c == '\\') {
                    i++;
                    if (i < text.length() && (text.charAt(i) == '\n' || text.charAt(i) == '\r')) {
                        break;
                    }
                }
                i++;
            }
            throw new IniLexException(sourceLabel, start, "unterminated string");
        }

        private int lineEnd() {
            int i = offset;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\n') {
                    break;
                }
                if (crlfNewlines && c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    break;
                }
                i++;
            }
            return i;
        }

        private IniToken emit(TokenType type, int end, Position start) {
            IniToken token = new IniToken(type, text.substring(offset, end), start);
            column += end - offset;
            offset = end;
            return token;
        }

        private IniToken newline(int end, Position start) {
            IniToken token = new IniToken(TokenType.NEWLINE, text.substring(offset, end), start);
            offset = end;
            line++;
            column = 1;
            return token;
        }
    }

    private static String printable(char c) {
        if (CharUtils.isAsciiPrintable(c)) {
            return "'" + c + "'";
        }
        return String.format("U+%04X", (int) c);
    }
}
