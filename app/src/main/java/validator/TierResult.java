package validator;

// Outcome of asking one definition service about a word. A miss means "try the next tier".
public record TierResult(boolean ok, String reason) {

    public static TierResult found() {
        return new TierResult(true, "found");
    }

    public static TierResult miss(String reason) {
        return new TierResult(false, reason);
    }
}
