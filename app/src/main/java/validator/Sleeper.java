package validator;

// Blocking pause used for pacing and backoff; swapped out in tests to record waits instead.
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
