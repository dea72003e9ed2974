/**
 * REST API controllers of the relay.
 *
 * <ul>
 *   <li>{@code GET /health} - liveness</li>
 *   <li>{@code POST /api/v1/translate/text} - text translation</li>
 *   <li>{@code POST /api/v1/tts} - speech synthesis</li>
 * </ul>
 *
 * <p>Controllers only check required fields and delegate to the providers; failures are mapped by
 * {@code GlobalExceptionHandler}.
 *
 * @see com.seamtalk.presentation.exception.GlobalExceptionHandler
 */
package com.seamtalk.presentation.controller;
