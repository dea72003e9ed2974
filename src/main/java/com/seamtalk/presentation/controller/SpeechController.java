package com.seamtalk.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.seamtalk.exception.InvalidRequestException;
import com.seamtalk.service.speech.DashScopeSpeechProvider;
import com.seamtalk.service.speech.SynthesisResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Text-to-speech for clients: {@code POST /api/v1/tts}.
 */
@RestController
class SpeechController {

    static final String MISSING_FIELDS = "Missing required fields: text, lang";

    private final DashScopeSpeechProvider provider;

    SpeechController(DashScopeSpeechProvider provider) {
        this.provider = provider;
    }

    @PostMapping("/api/v1/tts")
    ResponseEntity<SpeechResponse> synthesize(@RequestBody SpeechRequest request) {
        if (request.text() == null || request.text().isBlank() || request.lang() == null || request.lang().isBlank()) {
            throw new InvalidRequestException(MISSING_FIELDS);
        }
        SynthesisResult result = provider.synthesize(request.text(), request.lang(), request.voice(), request.model());
        return ResponseEntity.ok(new SpeechResponse(result.audioUrl(), result.audioBase64(), result.format(),
                result.raw(), new Timing(result.ttfbMs(), result.totalMs())));
    }

    record SpeechRequest(String text, String lang, String voice, String model) {}

    record SpeechResponse(
            @JsonProperty("audio_url") String audioUrl,
            @JsonProperty("audio_base64") String audioBase64,
            String format,
            Map<String, Object> raw,
            Timing timing
    ) {}
}
