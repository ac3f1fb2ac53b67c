package validator;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

// Parsed CLI parameters and environment for a validation run.
public record ValidatorConfig(
        Path sourcePath,
        Path backupPath,
        Path checkpointPath,
        Path invalidReportPath,
        String listName,
        int wordLength,
        long requestDelayMillis,
        long fallbackDelayMillis,
        int checkpointInterval,
        int requestTimeoutMillis,
        int maxRetries,
        long baseBackoffMillis,
        long maxBackoffMillis,
        long rateLimitBufferMillis,
        String primaryBaseUrl,
        String fallbackBaseUrl,
        String userAgent
) {

    public static final String CONTACT_ENV = "WORD_VALIDATOR_CONTACT";
    public static final String DEFAULT_DATA_DIR = "src/data";
    public static final int MAX_RETRIES = 100;
    public static final String PRIMARY_URL = "https://api.dictionaryapi.dev/api/v2/entries/en";
    public static final String FALLBACK_URL = "https://en.wiktionary.org/api/rest_v1/page/definition";

    static final String USAGE = """
            Usage: [dataDir] [--name=value ...]
              dataDir                  directory holding solutions.js (default: src/data)
              --source=FILE            source file name inside dataDir (default: solutions.js)
              --list-name=NAME         exported array name (default: SOLUTIONS_LIST)
              --delay-ms=N             pause after every word (default: 800)
              --fallback-delay-ms=N    pause before the fallback lookup (default: 400)
              --checkpoint-every=N     flush the checkpoint every N words (default: 25)
              --timeout-ms=N           per-request timeout, >= 1 (default: 10000)
              --retries=N              retries after the first attempt, <= 100 (default: 3)
              --base-backoff-ms=N      first backoff step (default: 1500)
              --max-backoff-ms=N       backoff cap (default: 60000)
              --rate-limit-buffer-ms=N extra wait after any 429 (default: 2000)
              --primary-url=URL        primary definition service base URL
              --fallback-url=URL       fallback definition service base URL
            Environment: WORD_VALIDATOR_CONTACT is embedded in the User-Agent when set.
            """;

    private static final Set<String> KNOWN_FLAGS = Set.of(
            "source", "list-name", "delay-ms", "fallback-delay-ms", "checkpoint-every", "timeout-ms",
            "retries", "base-backoff-ms", "max-backoff-ms", "rate-limit-buffer-ms", "primary-url", "fallback-url");

    // Build a config from CLI args; throws IllegalArgumentException with a user-facing message.
    public static ValidatorConfig fromArgs(String[] args, Map<String, String> env) {
        String dataDir = DEFAULT_DATA_DIR;
        boolean dataDirSeen = false;
        Map<String, String> flags = new HashMap<>();

        for (String arg : args) {
            if (arg.startsWith("--")) {
                int eq = arg.indexOf('=');
                if (eq < 0) throw new IllegalArgumentException("Expected --name=value, got: " + arg);
                String name = arg.substring(2, eq);
                if (!KNOWN_FLAGS.contains(name)) throw new IllegalArgumentException("Unknown option: --" + name);
                flags.put(name, arg.substring(eq + 1));
            } else {
                if (dataDirSeen) throw new IllegalArgumentException("Unexpected extra argument: " + arg);
                dataDir = arg;
                dataDirSeen = true;
            }
        }

        Path dir = Paths.get(dataDir);
        String sourceName = flags.getOrDefault("source", "solutions.js");
        String listName = flags.getOrDefault("list-name", WordListFile.DEFAULT_LIST_NAME);
        if (sourceName.isBlank()) throw new IllegalArgumentException("--source must not be empty");
        if (listName.isBlank()) throw new IllegalArgumentException("--list-name must not be empty");

        long baseBackoff = parseLong(flags, "base-backoff-ms", 1_500);
        long maxBackoff = parseLong(flags, "max-backoff-ms", 60_000);
        if (maxBackoff < baseBackoff) {
            throw new IllegalArgumentException("--max-backoff-ms must be >= --base-backoff-ms");
        }
        int checkpointEvery = (int) parseLong(flags, "checkpoint-every", 25);
        if (checkpointEvery < 1) throw new IllegalArgumentException("--checkpoint-every must be >= 1");
        // jsoup reads 0 as "no timeout"
        int timeoutMillis = (int) parseLong(flags, "timeout-ms", 10_000);
        if (timeoutMillis < 1) throw new IllegalArgumentException("--timeout-ms must be >= 1");
        int retries = (int) parseLong(flags, "retries", 3);
        if (retries > MAX_RETRIES) throw new IllegalArgumentException("--retries must be <= " + MAX_RETRIES);

        return new ValidatorConfig(
                dir.resolve(sourceName),
                dir.resolve(sourceName + ".backup"),
                dir.resolve("validation-progress.json"),
                dir.resolve("invalid-words.json"),
                listName,
                5,
                parseLong(flags, "delay-ms", 800),
                parseLong(flags, "fallback-delay-ms", 400),
                checkpointEvery,
                timeoutMillis,
                retries,
                baseBackoff,
                maxBackoff,
                parseLong(flags, "rate-limit-buffer-ms", 2_000),
                flags.getOrDefault("primary-url", PRIMARY_URL),
                flags.getOrDefault("fallback-url", FALLBACK_URL),
                userAgent(env.get(CONTACT_ENV)));
    }

    // Some endpoints behave better when the caller identifies itself.
    static String userAgent(String contact) {
        if (contact == null || contact.isBlank()) return "WordListValidator/1.0";
        return "WordListValidator/1.0 (" + contact.trim() + ")";
    }

    // Strict non-negative integer parsing with a clean error message.
    private static long parseLong(Map<String, String> flags, String name, long defaultValue) {
        String raw = flags.get(name);
        if (raw == null) return defaultValue;
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for --" + name + ": " + raw);
        }
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("--" + name + " must be between 0 and " + Integer.MAX_VALUE);
        }
        return value;
    }
}
