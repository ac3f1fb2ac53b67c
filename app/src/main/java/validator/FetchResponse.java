package validator;

// Outcome of one HTTP GET: status, body text and the raw Retry-After header (may be null).
public record FetchResponse(int statusCode, String body, String retryAfter) {

    public static final int TOO_MANY_REQUESTS = 429;

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isRateLimited() {
        return statusCode == TOO_MANY_REQUESTS;
    }
}
