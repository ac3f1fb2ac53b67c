package validator;

import java.io.PrintStream;

// Console output for a run. On a terminal progress lines overwrite each other; when piped each is its own line.
public class ProgressReporter {

    private final PrintStream out;
    private final boolean interactive;

    public ProgressReporter(PrintStream out, boolean interactive) {
        this.out = out;
        this.interactive = interactive;
    }

    public static ProgressReporter forConsole() {
        return new ProgressReporter(System.out, System.console() != null);
    }

    public void info(String message) {
        out.println(message);
    }

    public void progress(int done, int total, String word, Verdict verdict) {
        StringBuilder line = new StringBuilder(verdict.valid() ? "OK " : "XX ")
                .append('[').append(done).append('/').append(total).append("] ")
                .append(word);
        if (verdict.valid() && verdict.source() != null) {
            line.append(" (").append(verdict.source().displayName()).append(')');
        }

        if (interactive) {
            out.print(line + "\r");
            out.flush();
        } else {
            out.println(line);
        }
    }

    // Print the end-of-run summary, first moving off any in-place progress line.
    public void summary(RunSummary summary) {
        if (interactive) out.println();
        out.println("==== Run summary ====");
        out.println("Kept   : " + summary.kept());
        out.println("Removed: " + summary.removed());
        out.println("Invalid words written to: " + summary.invalidReportPath());
    }
}
