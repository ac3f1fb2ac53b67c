package validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

// Primary tier: a JSON array of entries; a word counts when any entry has a non-empty "meanings" array.
public class FreeDictionaryTier extends JsonDefinitionTier {

    public FreeDictionaryTier(RetryingFetcher fetcher, ObjectMapper mapper, String baseUrl) {
        super(fetcher, mapper, baseUrl);
    }

    @Override
    protected boolean hasDefinition(JsonNode root) {
        if (!root.isArray()) return false;
        for (JsonNode entry : root) {
            JsonNode meanings = entry.path("meanings");
            if (meanings.isArray() && meanings.size() > 0) return true;
        }
        return false;
    }
}
