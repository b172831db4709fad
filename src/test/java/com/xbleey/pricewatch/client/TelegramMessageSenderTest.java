package com.xbleey.pricewatch.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.DeliveryResult;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramMessageSenderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private PriceWatchProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new PriceWatchProperties();
        properties.getTelegram().setApiUrl(server.url("/").uri());
        properties.getTelegram().setBotToken("123:abc");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsMarkdownMessageToOwnerChat() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));

        DeliveryResult result = sender().send("42", "*Price drop!*");

        assertThat(result).isEqualTo(DeliveryResult.DELIVERED);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/bot123:abc/sendMessage");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("chat_id").asText()).isEqualTo("42");
        assertThat(body.get("text").asText()).isEqualTo("*Price drop!*");
        assertThat(body.get("parse_mode").asText()).isEqualTo("Markdown");
    }

    @Test
    void errorStatusIsFailedDelivery() {
        server.enqueue(new MockResponse().setResponseCode(403));

        assertThat(sender().send("42", "hello")).isEqualTo(DeliveryResult.FAILED);
    }

    @Test
    void missingTokenFailsWithoutCall() {
        properties.getTelegram().setBotToken(" ");

        assertThat(sender().send("42", "hello")).isEqualTo(DeliveryResult.FAILED);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void unreachableApiIsFailedDeliveryNotException() {
        properties.getTelegram().setApiUrl(URI.create("http://127.0.0.1:1"));

        assertThat(sender().send("42", "hello")).isEqualTo(DeliveryResult.FAILED);
    }

    private TelegramMessageSender sender() {
        return new TelegramMessageSender(new OkHttpClient(), objectMapper, properties);
    }
}
