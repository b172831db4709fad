package com.xbleey.pricewatch.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.FailureKind;
import com.xbleey.pricewatch.enums.PricingRegion;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPriceQuerierTest {

    private MockWebServer server;
    private HttpPriceQuerier querier;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        PriceWatchProperties properties = new PriceWatchProperties();
        properties.getPricing().setApiUrl(server.url("/api").uri());
        ObjectMapper objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        OkHttpClient client = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(2))
                .build();
        querier = new HttpPriceQuerier(client, objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void parsesQuote() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("""
                        {"productId":"B0TEST","price":79.90,"currency":"EUR","title":"Kettle","availability":"IN_STOCK"}
                        """));

        PriceQuote quote = querier.query("B0TEST", PricingRegion.DE);

        assertThat(quote.price()).isEqualByComparingTo("79.90");
        assertThat(quote.currency()).isEqualTo("EUR");
        assertThat(quote.title()).isEqualTo("Kettle");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/products/B0TEST?region=DE");
    }

    @Test
    void tooManyRequestsIsRateLimited() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertFailure(FailureKind.RATE_LIMITED);
    }

    @Test
    void notFoundIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertFailure(FailureKind.PERMANENT);
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertFailure(FailureKind.TRANSIENT);
    }

    @Test
    void missingPriceIsTransient() {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"productId\":\"B0TEST\",\"currency\":\"EUR\"}"));

        assertFailure(FailureKind.TRANSIENT);
    }

    @Test
    void droppedConnectionIsTransient() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        assertFailure(FailureKind.TRANSIENT);
    }

    @Test
    void blankProductIsPermanentWithoutCallingApi() {
        assertThatThrownBy(() -> querier.query(" ", PricingRegion.IT))
                .isInstanceOfSatisfying(PriceQueryException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(FailureKind.PERMANENT));
        assertThat(server.getRequestCount()).isZero();
    }

    private void assertFailure(FailureKind expected) {
        assertThatThrownBy(() -> querier.query("B0TEST", PricingRegion.IT))
                .isInstanceOfSatisfying(PriceQueryException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(expected));
    }
}
