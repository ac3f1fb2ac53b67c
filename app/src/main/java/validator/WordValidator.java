package validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

// Length gate, then the primary tier, then a short pause and the fallback tier.
public class WordValidator {

    private static final Logger log = LoggerFactory.getLogger(WordValidator.class);

    static final String LENGTH_REASON = "length";

    private final DefinitionTier primary;
    private final DefinitionTier fallback;
    private final Sleeper sleeper;
    private final long fallbackDelayMillis;
    private final int wordLength;

    public WordValidator(DefinitionTier primary,
                         DefinitionTier fallback,
                         Sleeper sleeper,
                         long fallbackDelayMillis,
                         int wordLength) {
        this.primary = primary;
        this.fallback = fallback;
        this.sleeper = sleeper;
        this.fallbackDelayMillis = fallbackDelayMillis;
        this.wordLength = wordLength;
    }

    public Verdict validate(String word) throws InterruptedException {
        String w = word.trim().toLowerCase(Locale.ROOT);
        if (w.length() != wordLength) return Verdict.invalid(LENGTH_REASON);

        TierResult first = primary.lookup(w);
        if (first.ok()) return Verdict.valid(DictionarySource.PRIMARY_API);
        log.debug("Primary miss for \"{}\": {}", w, first.reason());

        // Avoid bursting straight into the fallback service
        sleeper.sleep(fallbackDelayMillis);

        TierResult second = fallback.lookup(w);
        if (second.ok()) return Verdict.valid(DictionarySource.FALLBACK_API);
        log.debug("Fallback miss for \"{}\": {}", w, second.reason());

        return Verdict.invalid("primary: " + first.reason() + "; fallback: " + second.reason());
    }
}
