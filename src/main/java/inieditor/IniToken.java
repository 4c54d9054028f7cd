package inieditor;

import lombok.Value;

@Value
public class IniToken {
    TokenType type;
    String text;
    Position position;

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Human readable form used in error messages.
     */
    public String describe() {
        if (type == TokenType.NEWLINE || type == TokenType.EOF) {
            return type.getDescription();
        }
        return "\"" + text + "\"";
    }
}
