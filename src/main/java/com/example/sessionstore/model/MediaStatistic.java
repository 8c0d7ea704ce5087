package com.example.sessionstore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statistics of one fixed-width time slice of a media leg.
 * A new instance is an empty block: zero counters, unset gauges.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MediaStatistic {

    private Packets packets = new Packets();
    private Gauge jitter = new Gauge();
    @JsonProperty("r_factor")
    private Gauge rfactor = new Gauge();
    private Gauge mos = new Gauge();
    private double fractionLost;

    @Data
    @NoArgsConstructor
    public static class Packets {
        private long expected;
        private long received;
        private long lost;
        private long rejected;
    }

    @Data
    @NoArgsConstructor
    public static class Gauge {
        private Double min;
        private Double max;
        private Double avg;

        // weight of the running average
        @JsonIgnore
        private long samples;
    }
}
