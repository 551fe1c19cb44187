package io.b2mash.invoiceintake.push;

import io.b2mash.invoiceintake.mailbox.HistoryMarker;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Decodes a Pub/Sub push envelope {@code {"message":{"data":"<base64>",...},"subscription":...}}
 * whose data is the Gmail notification {@code {"emailAddress":...,"historyId":...}}. The history id
 * may arrive as a JSON number or a string.
 */
@Component
public class PushEnvelopeDecoder {

  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public PushEnvelopeDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Notification decode(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new PushPayloadException("Empty push body");
    }
    Map<String, Object> envelope = readObject(payload, "envelope");
    if (!(envelope.get("message") instanceof Map<?, ?> message)) {
      throw new PushPayloadException("Envelope has no message");
    }
    if (!(message.get("data") instanceof String data) || data.isBlank()) {
      throw new PushPayloadException("Envelope message has no data");
    }

    String json;
    try {
      json = new String(decodeBase64(data.strip()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new PushPayloadException("Message data is not base64", e);
    }
    Map<String, Object> notification = readObject(json, "notification");

    Object address = notification.get("emailAddress");
    if (!(address instanceof String emailAddress) || emailAddress.isBlank()) {
      throw new PushPayloadException("Notification has no emailAddress");
    }
    Object historyId = notification.get("historyId");
    if (!(historyId instanceof Number) && !(historyId instanceof String)) {
      throw new PushPayloadException("Notification has no historyId");
    }
    try {
      return new Notification(emailAddress.strip(), HistoryMarker.parse(historyId.toString()));
    } catch (IllegalArgumentException e) {
      throw new PushPayloadException("Invalid historyId: " + historyId, e);
    }
  }

  private Map<String, Object> readObject(String json, String what) {
    try {
      Map<String, Object> value = objectMapper.readValue(json, JSON_OBJECT);
      if (value == null) {
        throw new PushPayloadException("Push " + what + " is null");
      }
      return value;
    } catch (JacksonException e) {
      throw new PushPayloadException("Push " + what + " is not a JSON object", e);
    }
  }

  /** Pub/Sub uses standard base64; some publishers send the URL-safe alphabet. */
  private static byte[] decodeBase64(String data) {
    if (data.indexOf('-') >= 0 || data.indexOf('_') >= 0) {
      return Base64.getUrlDecoder().decode(data);
    }
    return Base64.getDecoder().decode(data);
  }
}
