package inieditor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IniEncoderTest {

    private final IniEncoder encoder = new IniEncoder();

    @Test
    void numbersUseShortestPlainDecimal() {
        assertEquals("21", IniEncoder.formatNumber(21));
        assertEquals("1.2", IniEncoder.formatNumber(1.2));
        assertEquals("0.5", IniEncoder.formatNumber(0.5));
        assertEquals("100", IniEncoder.formatNumber(100));
        assertEquals("0", IniEncoder.formatNumber(0));
        assertEquals("0.000001", IniEncoder.formatNumber(0.000001));
        assertEquals("1000000000000000000000", IniEncoder.formatNumber(1e21));
    }

    @Test
    void largeNumbersKeepTheirShortestDigits() {
        assertEquals("200000000000000000000000", IniEncoder.formatNumber(2e23));
        assertEquals("100000000000000000000000", IniEncoder.formatNumber(1e23));
        assertEquals("8410000000000000000000", IniEncoder.formatNumber(8.41e21));
        assertEquals("282879384806159000", IniEncoder.formatNumber(2.82879384806159E17));
        assertEquals("0.1", IniEncoder.formatNumber(0.1));
        assertEquals("0.30000000000000004", IniEncoder.formatNumber(0.1 + 0.2));
        assertEquals(Double.MAX_VALUE, Double.parseDouble(IniEncoder.formatNumber(Double.MAX_VALUE)));
        assertEquals(Double.MIN_VALUE, Double.parseDouble(IniEncoder.formatNumber(Double.MIN_VALUE)));
    }

    @Test
    void stringsAreQuotedAndEscaped() {
        assertEquals("\"plain\"", IniEncoder.formatValue(Value.of("plain")));
        assertEquals("\"a\\\"b\\\\c\\n\\t\"", IniEncoder.formatValue(Value.of("a\"b\\c\n\t")));
        assertEquals("\"\\x01\\a\\v\"", IniEncoder.formatValue(Value.of("\u0001\u0007\u000B")));
        assertEquals("\"caf\u00e9\"", IniEncoder.formatValue(Value.of("caf\u00e9")));
    }

    @Test
    void quotedStringsReadBack() {
        var text = "tab\there \"quoted\" back\\slash \r\n \u0001 end";

        assertEquals(text, QuotedStrings.unquote(QuotedStrings.quote(text)));
    }

    @Test
    void unquoteRejectsBadEscapes() {
        assertThrows(IllegalArgumentException.class, () -> QuotedStrings.unquote("\"\\z\""));
        assertThrows(IllegalArgumentException.class, () -> QuotedStrings.unquote("\"\\x4\""));
        assertThrows(IllegalArgumentException.class, () -> QuotedStrings.unquote("\"\\u00g1\""));
    }

    @Test
    void encodesTreeBuiltByHand() {
        var document = new IniDocument();
        document.getBlankLines().add("\n");
        var top = new IniProperty("top", Value.of(0));
        top.getBlankLines().add("\n");
        document.getProperties().add(top);

        var section = new IniSection("srv");
        section.setComments(List.of("# server", "; block"));
        section.getBlankLines().add("\n");
        var host = new IniProperty("host", Value.of("localhost"));
        host.setComments(List.of("# where"));
        section.getProperties().add(host);
        document.getSections().add(section);

        assertEquals("top = 0\n\n# server\n; block\n[srv]\n\n# where\nhost = \"localhost\"\n",
                encoder.encode(document));
    }

    @Test
    void emptyDocumentRendersEmpty() {
        var document = new IniDocument();
        document.getBlankLines().add("\n");

        assertEquals("", encoder.encode(document));
        assertEquals("", document.render());
    }

    @Test
    void numberValueRejectsValuesItCannotRender() {
        assertThrows(IllegalArgumentException.class, () -> Value.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Value.of(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> Value.of(-1));
    }

    @Test
    void visitorSeesBothVariants() {
        Value.Visitor<String> kind = new Value.Visitor<>() {
            @Override
            public String visitString(StringValue value) {
                return "string:" + value.getText();
            }

            @Override
            public String visitNumber(NumberValue value) {
                return "number:" + IniEncoder.formatNumber(value.getNumber());
            }
        };

        assertEquals("string:x", Value.of("x").accept(kind));
        assertEquals("number:2.5", Value.of(2.5).accept(kind));
    }
}
