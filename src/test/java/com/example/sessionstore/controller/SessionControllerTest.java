package com.example.sessionstore.controller;

import com.example.sessionstore.configuration.SecurityConfiguration;
import com.example.sessionstore.model.LegSession;
import com.example.sessionstore.model.MediaSession;
import com.example.sessionstore.model.MediaStatistic;
import com.example.sessionstore.model.SessionRequest;
import com.example.sessionstore.service.SessionService;
import com.example.sessionstore.service.call.CallSessionService;
import com.example.sessionstore.service.media.MediaSessionService;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
@Import(SecurityConfiguration.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MediaSessionService mediaSessionService;

    @MockBean
    private CallSessionService callSessionService;

    @Test
    void mediaDetails() throws Exception {
        MediaSession out = MediaSession.builder().srcPort(10000).dstPort(20000).duration(400).build();
        out.getBlocks().add(new MediaStatistic());
        LegSession leg = LegSession.builder()
                .callId("call-1")
                .duration(400)
                .blockCount(1)
                .out(out)
                .in(MediaSession.builder().build())
                .build();

        Map<String, LegSession> entry = new LinkedHashMap<>();
        entry.put("rtp", leg);
        entry.put("rtcp", null);
        given(mediaSessionService.details(any())).willReturn(List.of(entry));

        mockMvc.perform(post("/session/media")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"created_at\": 0, \"terminated_at\": 400, \"call_id\": [\"call-1\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].rtp.call_id", is("call-1")))
                .andExpect(jsonPath("$[0].rtp.out.src_port", is(10000)))
                .andExpect(jsonPath("$[0].rtp.out.blocks", hasSize(1)))
                .andExpect(jsonPath("$[0].rtp.out.blocks[0].packets.expected", is(0)))
                .andExpect(jsonPath("$[0].rtp.out.blocks[0].fraction_lost", is(0.0)))
                .andExpect(jsonPath("$[0].rtp.out.blocks[0]", hasKey("r_factor")))
                .andExpect(jsonPath("$[0].rtp.in.blocks", hasSize(0)))
                .andExpect(jsonPath("$[0].rtcp").value(nullValue()));
    }

    @Test
    void mediaDetailsWithoutCallId() throws Exception {
        given(mediaSessionService.details(any())).willAnswer(inv -> {
            SessionService.requireFields(inv.getArgument(0, SessionRequest.class));
            return List.of();
        });

        mockMvc.perform(post("/session/media")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"created_at\": 0, \"terminated_at\": 400}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", is("call_id")));
    }

    @Test
    void mediaRaw() throws Exception {
        given(mediaSessionService.findInRawBySessionRequest(any())).willReturn(List.of(
                new Document("call_id", "call-1").append("src_port", 10000),
                new Document("call_id", "call-1").append("src_port", 10001)));

        mockMvc.perform(post("/session/media/raw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"created_at\": 0, \"terminated_at\": 400, \"call_id\": [\"call-1\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].src_port", is(10000)))
                .andExpect(jsonPath("$[1].src_port", is(10001)));
    }

    @Test
    void mediaRawWithoutCreatedAt() throws Exception {
        given(mediaSessionService.findInRawBySessionRequest(any())).willAnswer(inv -> {
            SessionService.requireFields(inv.getArgument(0, SessionRequest.class));
            return List.of();
        });

        mockMvc.perform(post("/session/media/raw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"terminated_at\": 400, \"call_id\": [\"call-1\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", is("created_at")));
    }

    @Test
    void callRaw() throws Exception {
        given(callSessionService.findInRawBySessionRequest(any()))
                .willReturn(List.of(new Document("call_id", "call-1").append("raw_data", "INVITE sip:bob@example.com SIP/2.0")));

        mockMvc.perform(post("/session/call/raw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"created_at\": 0, \"terminated_at\": 400, \"call_id\": [\"call-1\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].call_id", is("call-1")));
    }

    @Test
    void malformedRequest() throws Exception {
        mockMvc.perform(post("/session/media")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"created_at\": "))
                .andExpect(status().isBadRequest());
    }
}
