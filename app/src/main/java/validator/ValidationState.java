package validator;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

// Resume point persisted as { lastIndex, results, meta }. results is keyed by word so re-recording overwrites.
@JsonPropertyOrder({"lastIndex", "results", "meta"})
public class ValidationState {

    private int lastIndex;
    private Map<String, Boolean> results = new LinkedHashMap<>();
    private Meta meta;

    public record Meta(String createdAt) { }

    // Jackson
    public ValidationState() {
    }

    public static ValidationState fresh(Instant createdAt) {
        ValidationState state = new ValidationState();
        state.meta = new Meta(createdAt.toString());
        return state;
    }

    public void record(int index, String word, boolean valid) {
        results.put(word, valid);
        lastIndex = index + 1;
    }

    public int getLastIndex() {
        return lastIndex;
    }

    public void setLastIndex(int lastIndex) {
        this.lastIndex = lastIndex;
    }

    public Map<String, Boolean> getResults() {
        return results;
    }

    public void setResults(Map<String, Boolean> results) {
        this.results = results == null ? new LinkedHashMap<>() : new LinkedHashMap<>(results);
    }

    public Meta getMeta() {
        return meta;
    }

    public void setMeta(Meta meta) {
        this.meta = meta;
    }
}
