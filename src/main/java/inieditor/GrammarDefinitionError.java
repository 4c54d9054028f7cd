package inieditor;

/**
 * The grammar tables are inconsistent. Raised while {@link IniGrammar} is
 * initialized, never in response to input.
 */
public class GrammarDefinitionError extends Error {

    public GrammarDefinitionError(String message) {
        super(message);
    }
}
