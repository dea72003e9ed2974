package com.seamtalk.service.speech;

/**
 * Speaks a translation. Best effort: implementations log failures and never throw.
 */
public interface SpeechSynthesisClient {

    void speak(String text, String language);
}
