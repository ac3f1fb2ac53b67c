package validator;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// Drives one run through INIT, PROCESS and FINALIZE, one word at a time in list order.
// The checkpoint is flushed on a fixed cadence and after the last word; nothing is rolled back on failure.
public class ValidationRunner {

    private static final Logger log = LoggerFactory.getLogger(ValidationRunner.class);

    private final ValidatorConfig config;
    private final WordValidator validator;
    private final CheckpointStore checkpoint;
    private final AtomicWriter writer;
    private final ObjectMapper mapper;
    private final ProgressReporter reporter;
    private final Sleeper sleeper;

    private RunPhase phase = RunPhase.INIT;

    // Working data handed from INIT to the later phases
    private record RunContext(WordListFile listFile, List<String> subset, int startIndex) { }

    public ValidationRunner(ValidatorConfig config,
                            WordValidator validator,
                            CheckpointStore checkpoint,
                            AtomicWriter writer,
                            ObjectMapper mapper,
                            ProgressReporter reporter,
                            Sleeper sleeper) {
        this.config = config;
        this.validator = validator;
        this.checkpoint = checkpoint;
        this.writer = writer;
        this.mapper = mapper;
        this.reporter = reporter;
        this.sleeper = sleeper;
    }

    // Wire the production collaborators for a run.
    public static ValidationRunner create(ValidatorConfig config, ProgressReporter reporter) {
        ObjectMapper mapper = newObjectMapper();
        AtomicWriter writer = new AtomicWriter();
        Sleeper sleeper = Sleeper.SYSTEM;
        Clock clock = Clock.systemUTC();

        RetryingFetcher fetcher = new RetryingFetcher(
                new JsoupTransport(config.userAgent(), config.requestTimeoutMillis()),
                new Backoff(config.baseBackoffMillis(), config.maxBackoffMillis()),
                config.rateLimitBufferMillis(),
                config.maxRetries(),
                sleeper,
                clock);

        WordValidator validator = new WordValidator(
                new FreeDictionaryTier(fetcher, mapper, config.primaryBaseUrl()),
                new WiktionaryTier(fetcher, mapper, config.fallbackBaseUrl()),
                sleeper,
                config.fallbackDelayMillis(),
                config.wordLength());

        CheckpointStore checkpoint = new CheckpointStore(config.checkpointPath(), writer, mapper, clock);
        return new ValidationRunner(config, validator, checkpoint, writer, mapper, reporter, sleeper);
    }

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public RunPhase phase() {
        return phase;
    }

    public RunSummary run() throws IOException, InterruptedException {
        RunContext ctx = init();

        enter(RunPhase.PROCESS);
        process(ctx);

        enter(RunPhase.FINALIZE);
        return finish(ctx);
    }

    private void enter(RunPhase next) {
        log.info("Phase {} -> {}", phase, next);
        phase = next;
    }

    private RunContext init() throws IOException {
        phase = RunPhase.INIT;

        String raw = Files.readString(config.sourcePath(), StandardCharsets.UTF_8);
        WordListFile listFile = WordListFile.parse(raw, config.listName());

        // Only clean fixed-length tokens are processed, so odd entries never get rewritten unexpectedly
        List<String> subset = listFile.workingSubset(config.wordLength());

        boolean resuming = checkpoint.exists();
        if (resuming) reporter.info("Resuming from previous session...");
        ValidationState state = checkpoint.load();

        int start = resumeIndex(state, subset);
        state.setLastIndex(start);

        if (start == 0 && !Files.exists(config.backupPath())) {
            Files.copy(config.sourcePath(), config.backupPath(), StandardCopyOption.COPY_ATTRIBUTES);
            reporter.info("Backup created.");
        }

        reporter.info("Processing " + subset.size() + " words starting at index " + start + "...");
        return new RunContext(listFile, subset, start);
    }

    // Clamp the stored cursor and step back to the first word that never got a result.
    private int resumeIndex(ValidationState state, List<String> subset) {
        int start = Math.min(Math.max(state.getLastIndex(), 0), subset.size());
        Map<String, Boolean> results = state.getResults();
        for (int i = 0; i < start; i++) {
            if (!results.containsKey(subset.get(i))) {
                log.warn("Checkpoint has no result for \"{}\" at index {}; resuming from there instead of {}",
                        subset.get(i), i, start);
                return i;
            }
        }
        return start;
    }

    private void process(RunContext ctx) throws IOException, InterruptedException {
        List<String> subset = ctx.subset();
        int total = subset.size();

        for (int i = ctx.startIndex(); i < total; i++) {
            String word = subset.get(i);
            Verdict verdict = validator.validate(word);

            checkpoint.record(i, word, verdict);
            int done = checkpoint.state().getLastIndex();
            reporter.progress(done, total, word, verdict);

            // Unconditional pacing keeps the request cadence predictable
            sleeper.sleep(config.requestDelayMillis());

            if (done % config.checkpointInterval() == 0 || done == total) {
                checkpoint.flush();
            }
        }
    }

    private RunSummary finish(RunContext ctx) throws IOException {
        Map<String, Boolean> results = checkpoint.state().getResults();

        List<String> validWords = new ArrayList<>();
        List<String> invalidWords = new ArrayList<>();
        for (String word : ctx.subset()) {
            Boolean valid = results.get(word);
            if (Boolean.TRUE.equals(valid)) validWords.add(word);
            else if (Boolean.FALSE.equals(valid)) invalidWords.add(word);
        }

        writer.writeAtomic(config.sourcePath(), ctx.listFile().rewrite(validWords));
        writer.writeAtomic(config.invalidReportPath(), mapper.writeValueAsString(invalidWords));

        checkpoint.clear();

        RunSummary summary = new RunSummary(validWords.size(), invalidWords.size(), config.invalidReportPath());
        log.info("Run complete: kept={} removed={}", summary.kept(), summary.removed());
        return summary;
    }
}
