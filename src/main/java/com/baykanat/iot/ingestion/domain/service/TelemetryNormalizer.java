package com.baykanat.iot.ingestion.domain.service;

import com.baykanat.iot.ingestion.api.dto.IngestRequest;
import com.baykanat.iot.ingestion.domain.exception.InvalidTelemetryException;
import com.baykanat.iot.ingestion.domain.mapper.TelemetryMapper;
import com.baykanat.iot.ingestion.domain.model.TelemetryRecord;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Transport'a özgü girdiyi tek bir {@link TelemetryRecord} şekline çevirir.
 *
 * <p>MQTT: topic {@code devices/{device_id}/telemetry}, gövde JSON obje; {@code device_type} ve
 * {@code ts} gövdeden okunur. Geçersiz mesaj loglanır ve {@code Optional.empty()} döner, hiçbir
 * exception transport callback'ine taşınmaz.
 *
 * <p>HTTP: alanlar zaten yapılandırılmış gelir; sadece ts > 0 kuralı uygulanır.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelemetryNormalizer {

    static final String UNKNOWN = TelemetryMapper.UNKNOWN;
    /** Bu kadar sapan ts reddedilmez, şimdiye çekilir. */
    static final long MAX_CLOCK_SKEW_MS = Duration.ofDays(7).toMillis();
    /** TIMESTAMPTZ kolonuna güvenle yazılabilecek en büyük ts (9999-12-31T23:59:59.999Z). */
    public static final long MAX_TIMESTAMP_MS = 253_402_300_799_999L;
    /** device_id, topic, app_id, msg_id kolon genişliği. */
    public static final int MAX_ID_LENGTH = 255;
    public static final int MAX_DEVICE_TYPE_LENGTH = 100;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final TelemetryMapper telemetryMapper;
    private final Clock clock;

    /** MQTT mesajı → kayıt; geçersizse boş. */
    public Optional<TelemetryRecord> fromMqtt(String topic, byte[] rawPayload) {
        if (rawPayload == null || rawPayload.length == 0) {
            log.warn("Rejected empty message on topic {}", topic);
            return Optional.empty();
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(rawPayload);
        } catch (JacksonException e) {
            log.error("JSON decode error from topic {}: {}", topic, e.getOriginalMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.error("Failed to read message from topic {}: {}", topic, e.getMessage());
            return Optional.empty();
        }
        if (body == null || !body.isObject()) {
            log.warn("Rejected message on topic {}: payload is not a JSON object", topic);
            return Optional.empty();
        }

        if (topic != null && topic.length() > MAX_ID_LENGTH) {
            log.warn("Rejected message: topic longer than {} characters", MAX_ID_LENGTH);
            return Optional.empty();
        }
        String deviceId = deviceIdFromTopic(topic);
        if (deviceId.isBlank()) {
            log.warn("Rejected message on topic {}: empty device id segment", topic);
            return Optional.empty();
        }
        if (containsNullCharacter(body)) {
            log.warn("Rejected message from {}: payload contains \\u0000", deviceId);
            return Optional.empty();
        }

        long now = clock.millis();
        JsonNode tsNode = body.get("ts");
        long timestamp;
        if (tsNode == null) {
            timestamp = now;
        } else if (tsNode.isNumber()) {
            timestamp = tsNode.asLong();
        } else {
            log.warn("Rejected message from {}: ts is not numeric ({})", deviceId, tsNode);
            return Optional.empty();
        }

        if (!isValidTimestamp(timestamp)) {
            log.warn("Rejected message from {}: ts must be epoch ms > 0, got {}", deviceId, timestamp);
            return Optional.empty();
        }
        if (Math.abs(timestamp - now) > MAX_CLOCK_SKEW_MS) {
            log.warn("Timestamp out of range for {}: {}, using current time", deviceId, timestamp);
            timestamp = now;
        }

        JsonNode typeNode = body.get("device_type");
        String deviceType = typeNode != null && typeNode.isTextual() && !typeNode.asText().isBlank()
                ? typeNode.asText()
                : UNKNOWN;
        if (deviceType.length() > MAX_DEVICE_TYPE_LENGTH) {
            log.warn("Rejected message from {}: device_type longer than {} characters",
                    deviceId, MAX_DEVICE_TYPE_LENGTH);
            return Optional.empty();
        }

        return Optional.of(TelemetryRecord.builder()
                .deviceId(deviceId)
                .deviceType(deviceType)
                .topic(topic)
                .timestamp(timestamp)
                .payload(objectMapper.convertValue(body, PAYLOAD_TYPE))
                .receivedAt(clock.instant())
                .build());
    }

    /**
     * HTTP isteği → kayıt. Tek bir kaydın yazılamaması bütün batch'i düşüreceği için DB'nin kabul
     * etmeyeceği her şey burada InvalidTelemetryException ile reddedilir.
     */
    public TelemetryRecord fromIngestRequest(IngestRequest request) {
        if (request.getTs() == null || !isValidTimestamp(request.getTs())) {
            throw new InvalidTelemetryException("ts must be epoch ms > 0");
        }
        if (request.getTs() > MAX_TIMESTAMP_MS) {
            throw new InvalidTelemetryException("ts must be epoch ms <= " + MAX_TIMESTAMP_MS);
        }
        if (request.getAppId() == null || request.getAppId().isBlank()) {
            throw new InvalidTelemetryException("app_id is required");
        }
        if (request.getPayload() == null) {
            throw new InvalidTelemetryException("payload is required");
        }
        requireMaxLength("app_id", request.getAppId(), MAX_ID_LENGTH);
        requireMaxLength("device_id", request.getDeviceId(), MAX_ID_LENGTH);
        requireMaxLength("msg_id", request.getMsgId(), MAX_ID_LENGTH);
        requireMaxLength("topic", request.getTopic(), MAX_ID_LENGTH);
        requireMaxLength("device_type", request.getDeviceType(), MAX_DEVICE_TYPE_LENGTH);
        if (containsNullCharacter(objectMapper.valueToTree(request.getPayload()))
                || hasNullCharacter(request.getAppId()) || hasNullCharacter(request.getDeviceId())
                || hasNullCharacter(request.getMsgId()) || hasNullCharacter(request.getTopic())
                || hasNullCharacter(request.getDeviceType())) {
            throw new InvalidTelemetryException("text values must not contain \\u0000");
        }
        return telemetryMapper.toRecord(request, clock.instant());
    }

    /** Her iki yolda ortak kural. */
    public static boolean isValidTimestamp(long epochMillis) {
        return epochMillis > 0;
    }

    /** JSONB ve TEXT \\u0000 kabul etmez; alan adları ve string değerler özyinelemeli taranır. */
    static boolean containsNullCharacter(JsonNode node) {
        if (node == null) {
            return false;
        }
        if (node.isTextual()) {
            return hasNullCharacter(node.textValue());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (hasNullCharacter(field.getKey()) || containsNullCharacter(field.getValue())) {
                return true;
            }
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (containsNullCharacter(element)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean hasNullCharacter(String value) {
        return value != null && value.indexOf('\0') >= 0;
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new InvalidTelemetryException(field + " must be at most " + max + " characters");
        }
    }

    /** devices/{device_id}/telemetry → device_id; beklenmeyen şekilde "unknown". */
    static String deviceIdFromTopic(String topic) {
        if (topic == null) {
            return UNKNOWN;
        }
        String[] parts = topic.split("/", -1);
        return parts.length > 1 ? parts[1].trim() : UNKNOWN;
    }
}
