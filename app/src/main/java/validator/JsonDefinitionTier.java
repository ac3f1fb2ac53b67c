package validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

// GET <base>/<word> against a JSON definition service.
// Exhausted transport failures, non-2xx statuses and unreadable bodies are misses; runtime exceptions are not caught.
public abstract class JsonDefinitionTier implements DefinitionTier {

    private final RetryingFetcher fetcher;
    private final ObjectMapper mapper;
    private final String baseUrl;

    protected JsonDefinitionTier(RetryingFetcher fetcher, ObjectMapper mapper, String baseUrl) {
        this.fetcher = fetcher;
        this.mapper = mapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
    }

    @Override
    public TierResult lookup(String word) throws InterruptedException {
        String url = urlFor(word);

        FetchResponse res;
        try {
            res = fetcher.fetch(url, word);
        } catch (IOException e) {
            return TierResult.miss("transport failure: " + e);
        }

        if (!res.isSuccess()) {
            return TierResult.miss("HTTP " + res.statusCode());
        }

        JsonNode root;
        try {
            root = mapper.readTree(res.body() == null ? "" : res.body());
        } catch (JsonProcessingException e) {
            return TierResult.miss("unreadable body: " + e.getOriginalMessage());
        }
        if (root == null || root.isMissingNode()) {
            return TierResult.miss("empty body");
        }

        return hasDefinition(root) ? TierResult.found() : TierResult.miss("no qualifying entries");
    }

    String urlFor(String word) {
        return baseUrl + "/" + URLEncoder.encode(word, StandardCharsets.UTF_8).replace("+", "%20");
    }

    protected abstract boolean hasDefinition(JsonNode root);

    private static String stripTrailingSlash(String url) {
        String s = url.trim();
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }
}
