package de.bsommerfeld.threadcrawler.crawler.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.bsommerfeld.threadcrawler.core.config.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Raw HTTP access to the forum's item API. Performs exactly one request per
 * call; rate limiting and retries are layered on top by
 * {@link RateLimitedItemFetcher} and {@link RetryingItemFetcher}.
 *
 * <h3>Status mapping</h3>
 * <ul>
 * <li>200 with an item body: {@link FetchResult.Found}</li>
 * <li>200 with {@code null}/empty body, 404, deleted or dead items:
 * {@link FetchResult.NotFound}</li>
 * <li>429, 5xx, timeouts and I/O errors: retryable
 * {@link FetchFailedException}</li>
 * <li>any other status, malformed JSON: non-retryable
 * {@link FetchFailedException}</li>
 * </ul>
 */
public class HttpItemFetcher implements ItemFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpItemFetcher.class);

    private final HttpClient httpClient;
    private final ItemParser parser;
    private final String baseUrl;
    private final String userAgent;
    private final Duration requestTimeout;

    public HttpItemFetcher(HttpClient httpClient, ItemParser parser, String baseUrl, String userAgent,
            Duration requestTimeout) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout;
    }

    /** Builds the shared client used in production. */
    public static HttpClient defaultClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public FetchResult fetch(long itemId) throws FetchFailedException {
        String url = baseUrl + "/item/" + itemId + ".json";
        HttpResponse<String> response = executeGet(itemId, url);

        if (response.statusCode() == 404) {
            LOG.debug("Item {} does not exist (HTTP 404)", itemId);
            return new FetchResult.NotFound(itemId);
        }
        validateStatus(itemId, response.statusCode(), url);

        try {
            return parser.parseItem(itemId, response.body());
        } catch (JsonProcessingException e) {
            throw new FetchFailedException(itemId, "Malformed item payload for " + itemId, e, false);
        }
    }

    @Override
    public List<Long> fetchListing(Listing listing) throws FetchFailedException {
        String url = baseUrl + "/" + listing.endpoint() + ".json";
        HttpResponse<String> response = executeGet(LISTING_ID, url);
        validateStatus(LISTING_ID, response.statusCode(), url);

        try {
            return parser.parseIdList(response.body());
        } catch (JsonProcessingException e) {
            throw new FetchFailedException(LISTING_ID, "Malformed listing payload from " + url, e, false);
        }
    }

    private HttpResponse<String> executeGet(long itemId, String url) throws FetchFailedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchFailedException(itemId, "Timed out after " + requestTimeout.toMillis() + "ms: " + url,
                    e, true);
        } catch (IOException e) {
            throw new FetchFailedException(itemId, "I/O error requesting " + url, e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchFailedException(itemId, "Interrupted while requesting " + url, e, false);
        }
    }

    /**
     * Rejects every non-2xx status. 429 and 5xx are marked retryable.
     */
    static void validateStatus(long itemId, int status, String url) throws FetchFailedException {
        if (status >= 200 && status < 300)
            return;
        boolean retryable = status == 429 || status >= 500;
        throw new FetchFailedException(itemId, "HTTP " + status + " from " + url, retryable);
    }
}
