package validator;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.io.UncheckedIOException;

public class JsoupTransport implements HttpTransport {

    private final String userAgent;
    private final int timeoutMillis;

    public JsoupTransport(String userAgent, int timeoutMillis) {
        this.userAgent = userAgent;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public FetchResponse get(String url) throws IOException {
        // jsoup's timeout covers connect and read; expiry surfaces as SocketTimeoutException
        Connection.Response res = Jsoup.connect(url)
                .userAgent(userAgent)
                .header("Accept", "application/json")
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .followRedirects(true)
                .maxBodySize(0)
                .timeout(timeoutMillis)
                .method(Connection.Method.GET)
                .execute();

        String body;
        try {
            body = res.body();
        } catch (UncheckedIOException e) {
            // body is read lazily; unwrap so a reset mid-body is seen as a transport error
            throw e.getCause();
        }
        return new FetchResponse(res.statusCode(), body, res.header("Retry-After"));
    }
}
