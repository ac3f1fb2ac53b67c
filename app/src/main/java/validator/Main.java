package validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// CLI entry point that parses args and launches a validation run.
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ValidatorConfig config;
        try {
            config = ValidatorConfig.fromArgs(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ValidatorConfig.USAGE);
            System.exit(1);
            return; // unreachable, but required by compiler
        }

        ProgressReporter reporter = ProgressReporter.forConsole();
        try {
            RunSummary summary = ValidationRunner.create(config, reporter).run();
            reporter.summary(summary);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted; the last flushed checkpoint is the resume point", e);
            System.exit(1);
        } catch (Exception e) {
            // Checkpoint flushed so far stays on disk; the next invocation resumes from it
            log.error("Fatal error", e);
            System.err.println("Fatal error: " + e.getMessage());
            System.exit(1);
        }
    }
}
