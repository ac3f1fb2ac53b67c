package validator;

import java.util.ArrayList;
import java.util.List;

// Sleeper that remembers requested pauses instead of blocking.
class RecordingSleeper implements Sleeper {

    final List<Long> sleeps = new ArrayList<>();

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
    }

    long total() {
        return sleeps.stream().mapToLong(Long::longValue).sum();
    }
}
