package inieditor;

public enum TokenType {
    IDENT("identifier"),
    STRING("string"),
    NUMBER("number"),
    LBRACKET("\"[\""),
    RBRACKET("\"]\""),
    EQUALS("\"=\""),
    COMMENT("comment"),
    NEWLINE("newline"),
    EOF("end of input");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
