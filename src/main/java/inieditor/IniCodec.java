package inieditor;

public interface IniCodec {
    IniDocument parse(String sourceLabel, String text) throws IniParseException;

    String render(IniDocument document);
}
