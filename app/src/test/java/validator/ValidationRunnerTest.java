package validator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ValidationRunnerTest {

    private static final String MEANINGS = "[{\"word\":\"%s\",\"meanings\":[{\"partOfSpeech\":\"noun\"}]}]";

    private static final String FIVE_WORDS = """
            // Total: 5 words
            export const SOLUTIONS_LIST = [
              "CRANE",
              "ZZZZZ",
              "HELLO",
              "FJORD",
              "QQQQQ"
            ];
            """;

    private static final String FIVE_WORDS_VALIDATED = """
            // Total: 3 words
            export const SOLUTIONS_LIST = [
              "crane",
              "hello",
              "fjord"
            ];
            """;

    private final ObjectMapper mapper = ValidationRunner.newObjectMapper();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    // Primary knows crane/hello, fallback knows fjord; crashWord blows up the primary once.
    private final List<String> primaryLookups = new ArrayList<>();
    private final List<String> fallbackLookups = new ArrayList<>();
    private String crashWord;

    private final DefinitionTier primary = word -> {
        primaryLookups.add(word);
        if (word.equals(crashWord)) {
            crashWord = null;
            throw new IllegalStateException("simulated crash on " + word);
        }
        return Set.of("crane", "hello").contains(word) ? TierResult.found() : TierResult.miss("HTTP 404");
    };

    private final DefinitionTier fallback = word -> {
        fallbackLookups.add(word);
        return word.equals("fjord") ? TierResult.found() : TierResult.miss("HTTP 404");
    };

    private ValidatorConfig config(Path dir, String... flags) {
        List<String> args = new ArrayList<>();
        args.add(dir.toString());
        Collections.addAll(args, flags);
        return ValidatorConfig.fromArgs(args.toArray(new String[0]), Map.of());
    }

    private ValidationRunner runner(ValidatorConfig config, DefinitionTier first, DefinitionTier second) {
        AtomicWriter writer = new AtomicWriter();
        WordValidator validator = new WordValidator(first, second, sleeper, config.fallbackDelayMillis(), config.wordLength());
        CheckpointStore store = new CheckpointStore(config.checkpointPath(), writer, mapper, clock);
        ProgressReporter reporter = new ProgressReporter(new PrintStream(console, true, StandardCharsets.UTF_8), false);
        return new ValidationRunner(config, validator, store, writer, mapper, reporter, sleeper);
    }

    private List<String> invalidReport(ValidatorConfig config) throws Exception {
        return mapper.readValue(config.invalidReportPath().toFile(), new TypeReference<List<String>>() { });
    }

    private static String read(Path path) throws Exception {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Test
    void endToEndAgainstDefinitionServices(@TempDir Path tempDir) throws Exception {
        String original = """
                // Total: 3 words
                export const SOLUTIONS_LIST = [
                  "CRANE",
                  "ZZZZZ",
                  "HELLO"
                ];
                """;
        Files.writeString(tempDir.resolve("solutions.js"), original, StandardCharsets.UTF_8);

        try (StubDictionaryServer server = new StubDictionaryServer()) {
            server.on("/primary/crane", StubDictionaryServer.Reply.json(200, MEANINGS.formatted("crane")))
                    .on("/primary/hello", StubDictionaryServer.Reply.json(200, MEANINGS.formatted("hello")));

            ValidatorConfig config = config(tempDir,
                    "--primary-url=" + server.baseUrl("/primary"),
                    "--fallback-url=" + server.baseUrl("/fallback"),
                    "--timeout-ms=5000");
            RetryingFetcher fetcher = new RetryingFetcher(
                    new JsoupTransport(config.userAgent(), config.requestTimeoutMillis()),
                    new Backoff(config.baseBackoffMillis(), config.maxBackoffMillis()),
                    config.rateLimitBufferMillis(), config.maxRetries(), sleeper, clock);
            ValidationRunner runner = runner(config,
                    new FreeDictionaryTier(fetcher, mapper, config.primaryBaseUrl()),
                    new WiktionaryTier(fetcher, mapper, config.fallbackBaseUrl()));

            RunSummary summary = runner.run();

            assertEquals(2, summary.kept());
            assertEquals(1, summary.removed());
            assertEquals(RunPhase.FINALIZE, runner.phase());
            assertEquals("""
                    // Total: 2 words
                    export const SOLUTIONS_LIST = [
                      "crane",
                      "hello"
                    ];
                    """, read(config.sourcePath()));
            assertEquals(List.of("ZZZZZ"), invalidReport(config));
            assertEquals(original, read(config.backupPath()));
            assertFalse(Files.exists(config.checkpointPath()));

            assertEquals(3, server.countRequests("/primary/"));
            assertEquals(List.of("/fallback/zzzzz"), server.requestedPaths.stream()
                    .filter(p -> p.startsWith("/fallback/")).toList());
            // one fallback pause for ZZZZZ, then the per-word pacing after each of the three words
            assertEquals(List.of(800L, 400L, 800L, 800L), sleeper.sleeps);
        }
    }

    @Test
    void singlePassWritesValidListAndInvalidReport(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), FIVE_WORDS, StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir, "--checkpoint-every=2");

        runner(config, primary, fallback).run();

        assertEquals(FIVE_WORDS_VALIDATED, read(config.sourcePath()));
        assertEquals(List.of("ZZZZZ", "QQQQQ"), invalidReport(config));
        assertEquals(List.of("crane", "zzzzz", "hello", "fjord", "qqqqq"), primaryLookups);
        String printed = console.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Backup created."));
        assertTrue(printed.contains("Processing 5 words starting at index 0..."));
        assertTrue(printed.contains("OK [4/5] FJORD (Wiktionary)"));
    }

    @Test
    void existingBackupIsNeverOverwritten(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), FIVE_WORDS, StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir);
        String olderBackup = "export const SOLUTIONS_LIST = [\"first\", \"draft\"];\n";
        Files.writeString(config.backupPath(), olderBackup, StandardCharsets.UTF_8);

        runner(config, primary, fallback).run();

        assertEquals(olderBackup, read(config.backupPath()));
        assertEquals(FIVE_WORDS_VALIDATED, read(config.sourcePath()));
        String printed = console.toString(StandardCharsets.UTF_8);
        assertFalse(printed.contains("Backup created."));
        assertTrue(printed.contains("Processing 5 words starting at index 0..."));
    }

    @Test
    void crashMidRunResumesFromLastFlushAndEndsTheSame(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), FIVE_WORDS, StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir, "--checkpoint-every=2");
        crashWord = "fjord";

        ValidationRunner crashed = runner(config, primary, fallback);
        assertThrows(IllegalStateException.class, crashed::run);

        // words 0-1 were flushed; HELLO was recorded in memory only and is redone
        assertEquals(RunPhase.PROCESS, crashed.phase());
        ValidationState onDisk = mapper.readValue(config.checkpointPath().toFile(), ValidationState.class);
        assertEquals(2, onDisk.getLastIndex());
        assertEquals(Map.of("CRANE", true, "ZZZZZ", false), onDisk.getResults());
        assertEquals(FIVE_WORDS, read(config.sourcePath()));

        primaryLookups.clear();
        runner(config, primary, fallback).run();

        assertEquals(List.of("hello", "fjord", "qqqqq"), primaryLookups);
        assertEquals(FIVE_WORDS_VALIDATED, read(config.sourcePath()));
        assertEquals(List.of("ZZZZZ", "QQQQQ"), invalidReport(config));
        assertEquals(FIVE_WORDS, read(config.backupPath()));
        assertFalse(Files.exists(config.checkpointPath()));
        assertTrue(console.toString(StandardCharsets.UTF_8).contains("Resuming from previous session..."));
    }

    @Test
    void resumeOnlyProcessesWordsAfterTheCursor(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), FIVE_WORDS, StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir);
        Files.writeString(config.checkpointPath(),
                "{\"lastIndex\":2,\"results\":{\"CRANE\":true,\"ZZZZZ\":false},\"meta\":{\"createdAt\":\"earlier\"}}",
                StandardCharsets.UTF_8);

        runner(config, primary, fallback).run();

        assertEquals(List.of("hello", "fjord", "qqqqq"), primaryLookups);
        assertEquals(FIVE_WORDS_VALIDATED, read(config.sourcePath()));
        // a resumed run never takes the backup: the source may already have been touched
        assertFalse(Files.exists(config.backupPath()));
    }

    @Test
    void gapInCheckpointResultsMovesTheCursorBack(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), FIVE_WORDS, StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir);
        Files.writeString(config.checkpointPath(),
                "{\"lastIndex\":4,\"results\":{\"CRANE\":true,\"ZZZZZ\":false,\"FJORD\":true}}",
                StandardCharsets.UTF_8);

        runner(config, primary, fallback).run();

        assertEquals(List.of("hello", "fjord", "qqqqq"), primaryLookups);
        assertEquals(FIVE_WORDS_VALIDATED, read(config.sourcePath()));
    }

    @Test
    void completedCheckpointGoesStraightToFinalize(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), FIVE_WORDS, StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir);
        Files.writeString(config.checkpointPath(),
                "{\"lastIndex\":99,\"results\":{\"CRANE\":true,\"ZZZZZ\":false,\"HELLO\":true,"
                        + "\"FJORD\":true,\"QQQQQ\":false}}",
                StandardCharsets.UTF_8);

        RunSummary summary = runner(config, primary, fallback).run();

        assertTrue(primaryLookups.isEmpty());
        assertEquals(3, summary.kept());
        assertEquals(FIVE_WORDS_VALIDATED, read(config.sourcePath()));
        assertFalse(Files.exists(config.checkpointPath()));
    }

    @Test
    void checkpointIsFlushedOnCadenceAndAtTheEnd(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), FIVE_WORDS, StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir, "--checkpoint-every=2");
        List<Integer> flushedCursor = new ArrayList<>();

        // Peek at the checkpoint file whenever a word is looked up
        DefinitionTier peeking = word -> {
            if (Files.exists(config.checkpointPath())) {
                try {
                    flushedCursor.add(mapper.readValue(config.checkpointPath().toFile(), ValidationState.class).getLastIndex());
                } catch (java.io.IOException e) {
                    throw new IllegalStateException(e);
                }
            } else {
                flushedCursor.add(-1);
            }
            return primary.lookup(word);
        };

        runner(config, peeking, fallback).run();

        assertEquals(List.of(-1, -1, 2, 2, 4), flushedCursor);
    }

    @Test
    void missingExportFailsBeforeAnythingIsWritten(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("solutions.js"), "export const WORDS = [\"crane\"];", StandardCharsets.UTF_8);
        ValidatorConfig config = config(tempDir);

        assertThrows(WordListFormatException.class, () -> runner(config, primary, fallback).run());

        assertFalse(Files.exists(config.checkpointPath()));
        assertFalse(Files.exists(config.backupPath()));
        assertTrue(primaryLookups.isEmpty());
    }
}
