package com.example.sessionstore.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

/**
 * A media leg rebuilt from index reports. Lives for one request only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LegSession {
    private String legId;
    private String callId;
    private long createdAt;
    private long terminatedAt;
    private long duration;
    private String srcAddr;
    private int srcPort;
    private String dstAddr;
    private int dstPort;
    private int blockCount;

    @JsonProperty("out")
    private MediaSession out;

    @JsonProperty("in")
    private MediaSession in;
}
