package validator;

// One external definition service. Implementations turn per-request failures into misses.
@FunctionalInterface
public interface DefinitionTier {

    TierResult lookup(String word) throws InterruptedException;
}
