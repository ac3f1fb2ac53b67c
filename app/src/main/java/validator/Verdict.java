package validator;

// Final judgement for one word. source is null for invalid words.
public record Verdict(boolean valid, DictionarySource source, String reason) {

    public static Verdict valid(DictionarySource source) {
        return new Verdict(true, source, "found");
    }

    public static Verdict invalid(String reason) {
        return new Verdict(false, null, reason);
    }
}
