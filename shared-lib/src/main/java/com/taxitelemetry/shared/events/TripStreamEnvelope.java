package com.taxitelemetry.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Base64;

/**
 * Value of a message on the ingress stream. {@code data} is the base64 encoding of
 * one TripRecord serialized as UTF-8 JSON; {@code partitionKey} is its trip id and
 * doubles as the Kafka record key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TripStreamEnvelope {

    private String partitionKey;
    private String data;
    private String region;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant publishedAt;

    public static TripStreamEnvelope wrap(String partitionKey, byte[] payload, String region) {
        return TripStreamEnvelope.builder()
                .partitionKey(partitionKey)
                .data(Base64.getEncoder().encodeToString(payload))
                .region(region)
                .publishedAt(Instant.now())
                .build();
    }

    /**
     * @throws IllegalArgumentException when {@code data} is absent or not valid base64
     */
    public byte[] decodeData() {
        if (data == null) {
            throw new IllegalArgumentException("Envelope has no data");
        }
        return Base64.getDecoder().decode(data);
    }
}
