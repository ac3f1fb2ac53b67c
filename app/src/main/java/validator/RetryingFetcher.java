package validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.OptionalLong;

// One logical GET. Retries only on 429 and transient transport failures, at most retries + 1 attempts.
public class RetryingFetcher {

    private static final Logger log = LoggerFactory.getLogger(RetryingFetcher.class);

    private final HttpTransport transport;
    private final Backoff backoff;
    private final long rateLimitBufferMillis;
    private final int defaultRetries;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryingFetcher(HttpTransport transport,
                           Backoff backoff,
                           long rateLimitBufferMillis,
                           int defaultRetries,
                           Sleeper sleeper,
                           Clock clock) {
        this.transport = transport;
        this.backoff = backoff;
        this.rateLimitBufferMillis = rateLimitBufferMillis;
        this.defaultRetries = defaultRetries;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public FetchResponse fetch(String url, String label) throws IOException, InterruptedException {
        return fetch(url, label, defaultRetries);
    }

    // label is only used in log lines (the word being looked up)
    public FetchResponse fetch(String url, String label, int retries) throws IOException, InterruptedException {
        long maxAttempts = Math.max(0L, retries) + 1L;
        long attempt = 0;

        while (true) {
            attempt++;

            FetchResponse res;
            try {
                res = transport.get(url);
            } catch (IOException e) {
                if (!TransientErrors.isTransient(e) || attempt >= maxAttempts) {
                    throw e;
                }
                long wait = backoff.jitteredDelayFor(attempt);
                log.warn("Transient error on \"{}\" (attempt {}/{}): {}. Retrying in {}s...",
                        label, attempt, maxAttempts, e.getMessage(), Math.round(wait / 1000.0));
                sleeper.sleep(wait);
                continue;
            }

            if (!res.isRateLimited()) return res;

            // Out of attempts: the 429 itself goes back to the caller
            if (attempt >= maxAttempts) return res;

            OptionalLong retryAfter = Backoff.parseRetryAfterMillis(res.retryAfter(), clock.instant());
            long baseWait = retryAfter.isPresent() ? retryAfter.getAsLong() : backoff.jitteredDelayFor(attempt);
            long wait = baseWait > Long.MAX_VALUE - rateLimitBufferMillis
                    ? Long.MAX_VALUE
                    : baseWait + rateLimitBufferMillis;

            log.warn("429 rate limited on \"{}\". Attempt {}/{}. Waiting {}s...",
                    label, attempt, maxAttempts, Math.round(wait / 1000.0));
            sleeper.sleep(wait);
        }
    }
}
