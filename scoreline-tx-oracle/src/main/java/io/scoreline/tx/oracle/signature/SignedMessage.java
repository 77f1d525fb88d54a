package io.scoreline.tx.oracle.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scoreline.tx.oracle.model.FeedPrice;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Canonical bytes an oracle signs: {@code timestamp + ":" + JSON(feeds)}, with
 * the timestamp exactly as submitted and feeds serialized compactly in
 * submission order.
 */
public final class SignedMessage {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private SignedMessage() {
    }

    public static String canonical(long timestamp, List<FeedPrice> feeds) {
        try {
            return timestamp + ":" + objectMapper.writeValueAsString(feeds);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Feeds are not serializable", e);
        }
    }

    public static byte[] canonicalBytes(long timestamp, List<FeedPrice> feeds) {
        return canonical(timestamp, feeds).getBytes(StandardCharsets.UTF_8);
    }
}
