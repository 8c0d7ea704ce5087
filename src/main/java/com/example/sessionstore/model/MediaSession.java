package com.example.sessionstore.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * One direction of a media leg.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MediaSession {
    private long createdAt;
    private long terminatedAt;
    private long duration;
    private String srcAddr;
    private int srcPort;
    private String dstAddr;
    private int dstPort;
    private String codec;
    private Integer payloadType;
    private long reportCount;

    @Builder.Default
    private List<MediaStatistic> blocks = new ArrayList<>();
}
