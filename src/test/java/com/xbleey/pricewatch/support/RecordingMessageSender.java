package com.xbleey.pricewatch.support;

import com.xbleey.pricewatch.client.MessageSender;
import com.xbleey.pricewatch.enums.DeliveryResult;

import java.util.ArrayList;
import java.util.List;

public class RecordingMessageSender implements MessageSender {

    private final List<SentMessage> sent = new ArrayList<>();
    private int failuresLeft;
    private int attempts;

    public synchronized void failNext(int count) {
        this.failuresLeft = count;
    }

    public synchronized List<SentMessage> sent() {
        return List.copyOf(sent);
    }

    public synchronized int attempts() {
        return attempts;
    }

    @Override
    public synchronized DeliveryResult send(String ownerId, String message) {
        attempts++;
        if (failuresLeft > 0) {
            failuresLeft--;
            return DeliveryResult.FAILED;
        }
        sent.add(new SentMessage(ownerId, message));
        return DeliveryResult.DELIVERED;
    }

    public record SentMessage(String ownerId, String text) {
    }
}
