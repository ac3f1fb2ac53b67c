package validator;

import java.io.IOException;

// A single GET attempt. HTTP error statuses come back as responses; only transport failures throw.
@FunctionalInterface
public interface HttpTransport {

    FetchResponse get(String url) throws IOException;
}
