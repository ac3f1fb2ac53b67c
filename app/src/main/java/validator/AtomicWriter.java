package validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

// Writes <name>.tmp beside the target and renames it over. A crash before the rename leaves the old content.
public class AtomicWriter {

    private static final Logger log = LoggerFactory.getLogger(AtomicWriter.class);

    public void writeAtomic(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = tempPathFor(target);
        Files.writeString(tmp, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);

        moveIntoPlace(tmp, target);
    }

    // Sibling path so the rename never crosses a filesystem boundary.
    static Path tempPathFor(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    protected void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}, falling back to a plain move", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
