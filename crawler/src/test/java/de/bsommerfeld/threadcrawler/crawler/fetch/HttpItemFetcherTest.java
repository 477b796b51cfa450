package de.bsommerfeld.threadcrawler.crawler.fetch;

import de.bsommerfeld.threadcrawler.core.config.Listing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Status and payload mapping of the raw HTTP fetcher. The {@link HttpClient}
 * is mocked, no request leaves the JVM.
 */
@ExtendWith(MockitoExtension.class)
class HttpItemFetcherTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private HttpItemFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new HttpItemFetcher(httpClient, new ItemParser(), "https://api.test/v0/", "test-agent",
                Duration.ofSeconds(3));
    }

    // -- Item Requests --

    @Test
    void fetch_shouldRequestItemUrlWithTimeoutAndUserAgent() throws Exception {
        respond(200, "{\"id\": 8863, \"type\": \"story\", \"title\": \"Hi\", \"kids\": [1, 2]}");

        FetchResult result = fetcher.fetch(8863);

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertEquals("https://api.test/v0/item/8863.json", request.uri().toString());
        assertEquals(Duration.ofSeconds(3), request.timeout().orElseThrow());
        assertEquals("test-agent", request.headers().firstValue("User-Agent").orElseThrow());

        Item item = assertInstanceOf(FetchResult.Found.class, result).item();
        assertEquals(List.of(1L, 2L), item.kids());
    }

    @Test
    void fetch_shouldMapNotFoundStatusToNotFound() throws Exception {
        respond(404, "");

        assertInstanceOf(FetchResult.NotFound.class, fetcher.fetch(1));
    }

    @Test
    void fetch_shouldMapNullBodyToNotFound() throws Exception {
        respond(200, "null");

        assertInstanceOf(FetchResult.NotFound.class, fetcher.fetch(1));
    }

    @Test
    void fetch_shouldKeepKidsOfDeletedItem() throws Exception {
        respond(200, "{\"id\": 5, \"deleted\": true, \"kids\": [6]}");

        FetchResult.NotFound notFound = assertInstanceOf(FetchResult.NotFound.class, fetcher.fetch(5));
        assertEquals(List.of(6L), notFound.orphanIds());
    }

    @Test
    void fetch_shouldMarkServerErrorsRetryable() throws Exception {
        respond(503, "");

        FetchFailedException e = assertThrows(FetchFailedException.class, () -> fetcher.fetch(1));
        assertTrue(e.isRetryable());
        assertEquals(1, e.getItemId());
    }

    @Test
    void fetch_shouldMarkTooManyRequestsRetryable() throws Exception {
        respond(429, "");

        assertTrue(assertThrows(FetchFailedException.class, () -> fetcher.fetch(1)).isRetryable());
    }

    @Test
    void fetch_shouldNotRetryClientErrors() throws Exception {
        respond(403, "");

        assertFalse(assertThrows(FetchFailedException.class, () -> fetcher.fetch(1)).isRetryable());
    }

    @Test
    void fetch_shouldNotRetryMalformedJson() throws Exception {
        respond(200, "{not json");

        assertFalse(assertThrows(FetchFailedException.class, () -> fetcher.fetch(1)).isRetryable());
    }

    @Test
    void fetch_shouldMarkTimeoutRetryable() throws Exception {
        doThrow(new HttpTimeoutException("timed out")).when(httpClient).send(any(), any());

        assertTrue(assertThrows(FetchFailedException.class, () -> fetcher.fetch(1)).isRetryable());
    }

    @Test
    void fetch_shouldMarkConnectionResetRetryable() throws Exception {
        doThrow(new IOException("Connection reset")).when(httpClient).send(any(), any());

        assertTrue(assertThrows(FetchFailedException.class, () -> fetcher.fetch(1)).isRetryable());
    }

    // -- Listing Requests --

    @Test
    void fetchListing_shouldRequestListingEndpoint() throws Exception {
        respond(200, "[3, 1, 2]");

        List<Long> ids = fetcher.fetchListing(Listing.BEST);

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertEquals("https://api.test/v0/beststories.json", captor.getValue().uri().toString());
        assertEquals(List.of(3L, 1L, 2L), ids);
    }

    // -- Status Validation --

    @Test
    void validateStatus_shouldAcceptAll2xxCodes() {
        assertDoesNotThrow(() -> HttpItemFetcher.validateStatus(1, 200, "url"));
        assertDoesNotThrow(() -> HttpItemFetcher.validateStatus(1, 204, "url"));
        assertDoesNotThrow(() -> HttpItemFetcher.validateStatus(1, 299, "url"));
    }

    @Test
    void validateStatus_shouldRejectBoundaryValues() {
        assertThrows(FetchFailedException.class, () -> HttpItemFetcher.validateStatus(1, 199, "url"));
        assertThrows(FetchFailedException.class, () -> HttpItemFetcher.validateStatus(1, 300, "url"));
    }

    private void respond(int status, String body) throws Exception {
        lenient().when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(), any());
    }
}
