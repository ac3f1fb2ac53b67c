package validator;

import java.nio.file.Path;

// Counts and output location of a completed run.
public record RunSummary(int kept, int removed, Path invalidReportPath) { }
