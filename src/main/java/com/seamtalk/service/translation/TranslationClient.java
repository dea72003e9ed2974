package com.seamtalk.service.translation;

import com.seamtalk.exception.TranslationException;

/**
 * Translates one final transcript. Blocking; callers run it off the session thread.
 */
public interface TranslationClient {

    /**
     * @param text           final transcript, not blank
     * @param sourceLanguage language of {@code text}
     * @param targetLanguage language to translate into
     * @return the translation
     * @throws TranslationException when the collaborator fails or answers with something unusable
     */
    String translate(String text, String sourceLanguage, String targetLanguage);
}
