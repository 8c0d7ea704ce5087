package com.example.sessionstore.controller;

import com.example.sessionstore.model.LegSession;
import com.example.sessionstore.model.SessionRequest;
import com.example.sessionstore.service.call.CallSessionService;
import com.example.sessionstore.service.media.MediaSessionService;
import org.bson.Document;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping(value = "/session", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
public class SessionController {

    private final MediaSessionService mediaSessionService;
    private final CallSessionService callSessionService;

    public SessionController(MediaSessionService mediaSessionService, CallSessionService callSessionService) {
        this.mediaSessionService = mediaSessionService;
        this.callSessionService = callSessionService;
    }

    @PostMapping("/media")
    public List<Map<String, LegSession>> media(@RequestBody SessionRequest req) {
        return mediaSessionService.details(req);
    }

    @PostMapping("/media/raw")
    public List<Document> mediaRaw(@RequestBody SessionRequest req) {
        return mediaSessionService.findInRawBySessionRequest(req);
    }

    @PostMapping("/call/raw")
    public List<Document> callRaw(@RequestBody SessionRequest req) {
        return callSessionService.findInRawBySessionRequest(req);
    }
}
