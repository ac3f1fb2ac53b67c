package validator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

// Owns the run's ValidationState and its JSON file. The file's presence means a run is in progress.
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path path;
    private final AtomicWriter writer;
    private final ObjectMapper mapper;
    private final Clock clock;

    private ValidationState state;

    public CheckpointStore(Path path, AtomicWriter writer, ObjectMapper mapper, Clock clock) {
        this.path = path;
        this.writer = writer;
        this.mapper = mapper;
        this.clock = clock;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    public ValidationState load() throws IOException {
        if (!exists()) {
            state = ValidationState.fresh(clock.instant());
        } else {
            state = mapper.readValue(path.toFile(), ValidationState.class);
            log.info("Loaded checkpoint {} (lastIndex={}, results={})",
                    path, state.getLastIndex(), state.getResults().size());
        }
        return state;
    }

    public ValidationState state() {
        if (state == null) throw new IllegalStateException("Checkpoint not loaded yet");
        return state;
    }

    public void record(int index, String word, Verdict verdict) {
        state().record(index, word, verdict.valid());
    }

    public void flush() throws IOException {
        writer.writeAtomic(path, mapper.writeValueAsString(state()));
    }

    public void clear() throws IOException {
        Files.deleteIfExists(path);
    }

    public Path path() {
        return path;
    }
}
