package com.example.sessionstore.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionRequest {
    @JsonProperty("created_at")
    private Long createdAt;
    @JsonProperty("terminated_at")
    private Long terminatedAt;
    @JsonProperty("call_id")
    private List<String> callId;
}
