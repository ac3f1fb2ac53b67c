package validator;

// The source file does not contain the exported word array in the expected shape.
public class WordListFormatException extends IllegalStateException {

    public WordListFormatException(String message) {
        super(message);
    }
}
