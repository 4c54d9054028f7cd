package inieditor;

/**
 * No token rule matches the remaining input.
 */
public class IniLexException extends IniParseException {

    public IniLexException(String sourceLabel, Position position, String detail) {
        super(sourceLabel, position, detail);
    }
}
