package com.xbleey.pricewatch.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.DeliveryResult;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends owner messages through the Telegram Bot API; the owner id is the chat id.
 */
@Component
public class TelegramMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(TelegramMessageSender.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final PriceWatchProperties properties;

    public TelegramMessageSender(OkHttpClient okHttpClient, ObjectMapper objectMapper, PriceWatchProperties properties) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public DeliveryResult send(String ownerId, String message) {
        String token = properties.getTelegram().getBotToken();
        if (token == null || token.isBlank()) {
            log.warn("Skip message to {}: telegram bot token not configured", ownerId);
            return DeliveryResult.FAILED;
        }
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("chat_id", ownerId);
            payload.put("text", message);
            payload.put("parse_mode", "Markdown");
            payload.put("disable_web_page_preview", false);
            HttpUrl url = HttpUrl.get(properties.getTelegram().getApiUrl().toString())
                    .newBuilder()
                    .addPathSegment("bot" + token.trim())
                    .addPathSegment("sendMessage")
                    .build();
            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
            try (Response response = okHttpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Telegram returned http status {} for owner {}", response.code(), ownerId);
                    return DeliveryResult.FAILED;
                }
                return DeliveryResult.DELIVERED;
            }
        } catch (Exception ex) {
            log.warn("Failed to send message to owner {}", ownerId, ex);
            return DeliveryResult.FAILED;
        }
    }
}
