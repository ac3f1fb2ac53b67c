package validator;

// Which definition service confirmed a word.
public enum DictionarySource {
    PRIMARY_API("FreeDictionary"),
    FALLBACK_API("Wiktionary");

    private final String displayName;

    DictionarySource(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
