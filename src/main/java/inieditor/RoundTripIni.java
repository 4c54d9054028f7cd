package inieditor;

import org.apache.commons.lang3.Validate;

/**
 * Default {@link IniCodec}: text in, editable tree, canonical text out.
 * <pre>
 * IniCodec ini = new RoundTripIni();
 * IniDocument doc = ini.parse("app.ini", text);
 * doc.add("server/port", Value.of(8080));
 * String edited = ini.render(doc);
 * </pre>
 */
public class RoundTripIni implements IniCodec {

    private final IniParser parser;
    private final IniEncoder encoder = new IniEncoder();

    public RoundTripIni() {
        this(IniParser.Options.builder().build());
    }

    public RoundTripIni(IniParser.Options options) {
        this.parser = new IniParser(options);
    }

    @Override
    public IniDocument parse(String sourceLabel, String text) throws IniParseException {
        return parser.parse(sourceLabel, text);
    }

    @Override
    public String render(IniDocument document) {
        Validate.notNull(document, "document must not be null");
        return encoder.encode(document);
    }

    /**
     * Parses and re-renders {@code text} without edits.
     */
    public String normalize(String sourceLabel, String text) throws IniParseException {
        return render(parse(sourceLabel, text));
    }
}
