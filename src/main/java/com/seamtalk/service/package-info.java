/**
 * Service layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.session} - client hold-to-talk state machine</li>
 *   <li>{@code service.audio} - microphone capture and resampling to 16 kHz mono PCM16</li>
 *   <li>{@code service.hotkey} - global talk keys</li>
 *   <li>{@code service.translation}, {@code service.speech} - collaborator clients and providers</li>
 *   <li>{@code service.metrics} - Micrometer meters for relay and client</li>
 *   <li>{@code service.events} - user-facing error events</li>
 * </ul>
 *
 * <p>Services throw domain exceptions (never HTTP ones) and use constructor injection.
 */
package com.seamtalk.service;
