package com.seamtalk.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.seamtalk.exception.InvalidRequestException;
import com.seamtalk.service.translation.DoubaoTranslationProvider;
import com.seamtalk.service.translation.TranslationResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Text translation for clients: {@code POST /api/v1/translate/text}.
 */
@RestController
class TranslationController {

    static final String MISSING_FIELDS = "Missing required fields: text, source_lang, target_lang";

    private final DoubaoTranslationProvider provider;

    TranslationController(DoubaoTranslationProvider provider) {
        this.provider = provider;
    }

    @PostMapping("/api/v1/translate/text")
    ResponseEntity<TranslateResponse> translate(@RequestBody TranslateRequest request) {
        if (isBlank(request.text()) || isBlank(request.sourceLang()) || isBlank(request.targetLang())) {
            throw new InvalidRequestException(MISSING_FIELDS);
        }
        TranslationResult result = provider.translate(
                request.text(), request.sourceLang(), request.targetLang(), request.model());
        return ResponseEntity.ok(new TranslateResponse(
                result.translation(), result.raw(), new Timing(result.ttfbMs(), result.totalMs())));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    record TranslateRequest(
            String text,
            @JsonProperty("source_lang") String sourceLang,
            @JsonProperty("target_lang") String targetLang,
            String model
    ) {}

    record TranslateResponse(String translation, Map<String, Object> raw, Timing timing) {}
}
