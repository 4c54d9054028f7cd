package inieditor;

import org.apache.commons.lang3.Validate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Writes a document back to INI text.
 * <p>
 * Formatting is fixed: {@code [name]} headers, {@code key = value} pairs,
 * one {@code \n} per line. Leading blank lines of the document are dropped;
 * every other comment and blank line is written where the tree holds it.
 */
public class IniEncoder {

    private static final String LS = "\n";

    // 17 significant digits always identify a double
    private static final int MAX_DIGITS = 17;

    private static final Value.Visitor<String> VALUE_FORMAT = new Value.Visitor<>() {
        @Override
        public String visitString(StringValue value) {
            return QuotedStrings.quote(value.getText());
        }

        @Override
        public String visitNumber(NumberValue value) {
            return formatNumber(value.getNumber());
        }
    };

    public String encode(IniDocument document) {
        Validate.notNull(document, "document must not be null");
        StringBuilder out = new StringBuilder();
        for (IniProperty property : document.getProperties()) {
            appendProperty(out, property);
        }
        for (IniSection section : document.getSections()) {
            appendSection(out, section);
        }
        return out.toString();
    }

    public static String formatValue(Value value) {
        return value.accept(VALUE_FORMAT);
    }

    /**
     * Shortest plain decimal that parses back to {@code number}: no exponent,
     * no trailing zeros, no trailing dot.
     */
    static String formatNumber(double number) {
        BigDecimal exact = new BigDecimal(number);
        for (int precision = 1; precision < MAX_DIGITS; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision));
            if (rounded.doubleValue() == number) {
                return rounded.stripTrailingZeros().toPlainString();
            }
        }
        return exact.round(new MathContext(MAX_DIGITS)).stripTrailingZeros().toPlainString();
    }

    private static void appendSection(StringBuilder out, IniSection section) {
        appendComments(out, section.getComments());
        out.append('[').append(section.getName()).append(']').append(LS);
        appendBlankLines(out, section.getBlankLines());
        for (IniProperty property : section.getProperties()) {
            appendProperty(out, property);
        }
    }

    private static void appendProperty(StringBuilder out, IniProperty property) {
        appendComments(out, property.getComments());
        out.append(property.getKey()).append(" = ").append(formatValue(property.getValue())).append(LS);
        appendBlankLines(out, property.getBlankLines());
    }

    private static void appendComments(StringBuilder out, List<String> comments) {
        for (String comment : comments) {
            out.append(comment).append(LS);
        }
    }

    private static void appendBlankLines(StringBuilder out, List<String> blankLines) {
        out.append(LS.repeat(blankLines.size()));
    }
}
