package inieditor;

import org.apache.commons.lang3.CharUtils;
import org.apache.commons.lang3.Validate;

/**
 * Escaping for double-quoted string literals.
 */
final class QuotedStrings {

    private QuotedStrings() {
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case '\u0007':
                    sb.append("\\a");
                    break;
                case '\u000B':
                    sb.append("\\v");
                    break;
                default:
                    if (CharUtils.isAsciiControl(c)) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Strips the quotes of a string literal and resolves its escapes.
     *
     * @throws IllegalArgumentException on an unknown or truncated escape
     */
    static String unquote(String literal) {
        Validate.isTrue(literal.length() >= 2 && literal.charAt(0) == '"'
                && literal.charAt(literal.length() - 1) == '"', "not a quoted string: %s", literal);
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            Validate.isTrue(i < body.length(), "dangling escape at end of string");
            char e = body.charAt(i++);
            switch (e) {
                case '"':
                case '\'':
                case '\\':
                    sb.append(e);
                    break;
                case 'a':
                    sb.append('\u0007');
                    break;
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'v':
                    sb.append('\u000B');
                    break;
                case 'x':
                    sb.append(hex(body, i, 2));
                    i += 2;
                    break;
                case 'u':
                    sb.append(hex(body, i, 4));
                    i += 4;
                    break;
                default:
                    throw new IllegalArgumentException("invalid escape \\" + e);
            }
        }
        return sb.toString();
    }

    private static char hex(String s, int from, int digits) {
        Validate.isTrue(from + digits <= s.length(), "truncated hex escape");
        int v = 0;
        for (int i = from; i < from + digits; i++) {
            int d = Character.digit(s.charAt(i), 16);
            Validate.isTrue(d >= 0, "invalid hex digit '%s'", String.valueOf(s.charAt(i)));
            v = v * 16 + d;
        }
        return (char) v;
    }
}
