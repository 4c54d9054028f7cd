package inieditor;

import lombok.Value;

/**
 * Location of a token in the source text.
 * Line and column are 1-based, offset is 0-based and counts chars.
 */
@Value
public class Position {
    int line;
    int column;
    int offset;

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
