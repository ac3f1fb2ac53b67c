package validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

// Fallback tier: definitions grouped by language code; a word counts when the "en" group is non-empty.
public class WiktionaryTier extends JsonDefinitionTier {

    public WiktionaryTier(RetryingFetcher fetcher, ObjectMapper mapper, String baseUrl) {
        super(fetcher, mapper, baseUrl);
    }

    @Override
    protected boolean hasDefinition(JsonNode root) {
        JsonNode english = root.path("en");
        return english.isArray() && english.size() > 0;
    }
}
