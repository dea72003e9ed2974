package com.seamtalk.service.session;

import com.seamtalk.domain.Direction;
import com.seamtalk.domain.SessionConfiguration;
import com.seamtalk.domain.SessionMode;
import com.seamtalk.domain.Side;
import com.seamtalk.domain.Turn;
import com.seamtalk.domain.TurnSnapshot;
import com.seamtalk.exception.DeviceUnavailableException;
import com.seamtalk.exception.ProtocolViolationException;
import com.seamtalk.protocol.RecognitionEvent;
import com.seamtalk.protocol.WireMessages;
import com.seamtalk.service.audio.capture.AudioStreamer;
import com.seamtalk.service.audio.capture.CaptureErrorEvent;
import com.seamtalk.service.hotkey.event.TalkKeyPressedEvent;
import com.seamtalk.service.hotkey.event.TalkKeyReleasedEvent;
import com.seamtalk.service.metrics.SessionMetrics;
import com.seamtalk.service.speech.SpeechSynthesisClient;
import com.seamtalk.service.translation.TranslationClient;
import com.seamtalk.transport.SocketConnector;
import com.seamtalk.transport.SocketListener;
import com.seamtalk.transport.TextSocket;
import com.seamtalk.util.LogSanitizer;
import com.seamtalk.util.concurrent.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Hold-to-talk session state machine of the client.
 *
 * <p>Maps talk-key gestures to realtime protocol traffic: press opens a relay socket and starts
 * the microphone, release commits the audio and waits for the final transcript, which is then
 * translated (and optionally spoken) in the background. Every turn uses its own relay
 * connection.
 *
 * <p><b>Threading:</b> all state lives on one {@link SerialExecutor} (the actor). Gestures,
 * audio frames, socket callbacks, the finalize timer and collaborator results are all queued
 * onto it, so transitions never race. Socket callbacks are tagged with the turn they belong to;
 * callbacks of an older turn are ignored.
 *
 * <p><b>Guarantees:</b>
 * <ul>
 *   <li>At most one open turn; a press while busy is ignored.</li>
 *   <li>{@link SessionState#FINALIZING} ends within the finalize timeout, exactly once.</li>
 *   <li>Partials never overwrite a final transcript.</li>
 * </ul>
 *
 * @see TalkSessionBuilder
 */
public class TalkSession {

    private static final Logger LOG = LogManager.getLogger(TalkSession.class);

    static final String TURN_ID_KEY = "turnId";

    private final SessionConfiguration configuration;
    private final URI relayUri;
    private final SocketConnector connector;
    private final AudioStreamer audio;
    private final TranslationClient translator;
    private final SpeechSynthesisClient speech;
    private final boolean speakTranslations;
    private final Executor collaboratorExecutor;
    private final SerialExecutor actor;
    private final SessionMetrics metrics;
    private final Duration finalizeTimeout;
    private final Clock clock;
    private final TurnRegistry turns;
    private final List<TurnListener> listeners = new CopyOnWriteArrayList<>();

    // Confined to the actor
    private SessionState state = SessionState.IDLE;
    private UUID connectionTurnId;
    private TextSocket socket;
    private boolean releaseRequested;
    private boolean commitSent;
    private SerialExecutor.ScheduledTask finalizeTimer;
    private long releasedAtNanos;

    // Published copy of state for other threads
    private volatile SessionState stateView = SessionState.IDLE;

    TalkSession(TalkSessionBuilder b) {
        this.configuration = b.configuration;
        this.relayUri = b.relayUri;
        this.connector = b.connector;
        this.audio = b.audio;
        this.translator = b.translator;
        this.speech = b.speech;
        this.speakTranslations = b.speakTranslations && b.speech != null;
        this.collaboratorExecutor = b.collaboratorExecutor;
        this.actor = b.actor;
        this.metrics = b.metrics;
        this.finalizeTimeout = b.finalizeTimeout;
        this.clock = b.clock;
        this.turns = new TurnRegistry(b.turnHistory);
    }

    public void addListener(TurnListener listener) {
        listeners.add(listener);
    }

    public SessionState state() {
        return stateView;
    }

    public SessionConfiguration configuration() {
        return configuration;
    }

    /** Snapshots of the retained turns, oldest first. */
    public List<TurnSnapshot> turns() {
        return turns.snapshots();
    }

    public Optional<TurnSnapshot> turn(UUID id) {
        return turns.find(id).map(Turn::snapshot);
    }

    /**
     * Talk key down.
     *
     * @param side pressed side; empty for a side-less control (auto-detect key)
     */
    public void pressDown(Optional<Side> side) {
        actor.execute(() -> handlePressDown(side));
    }

    /** Talk key up. */
    public void pressUp() {
        actor.execute(this::handlePressUp);
    }

    @EventListener
    public void onTalkKeyPressed(TalkKeyPressedEvent event) {
        pressDown(event.requestedSide());
    }

    @EventListener
    public void onTalkKeyReleased(TalkKeyReleasedEvent event) {
        pressUp();
    }

    @EventListener
    public void onCaptureError(CaptureErrorEvent event) {
        actor.execute(() -> {
            if (state == SessionState.RECORDING) {
                withActiveTurnContext();
                LOG.warn("Capture error while recording: {}", event.reason());
                abandon("capture_error");
            } else {
                LOG.debug("Capture error in state {}: {}", state, event.reason());
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        actor.execute(() -> {
            if (state != SessionState.IDLE) {
                LOG.info("Shutting down with turn in progress; abandoning it");
                abandon("shutdown");
            }
        });
        actor.shutdown();
    }

    // ---- gestures ----

    private void handlePressDown(Optional<Side> requested) {
        if (state != SessionState.IDLE) {
            LOG.debug("Press ignored: turn already in progress (state={})", state);
            return;
        }
        Side side = null;
        if (configuration.mode() == SessionMode.FIXED_SIDES) {
            if (requested.isEmpty()) {
                LOG.warn("Press of a side-less talk key ignored in fixed-sides mode");
                return;
            }
            side = requested.get();
        }
        Turn turn = turns.open(side, clock.instant());
        if (side != null) {
            turn.assignDirection(Direction.forSide(side, configuration));
        }
        ThreadContext.put(TURN_ID_KEY, turn.id().toString());
        releaseRequested = false;
        commitSent = false;
        connectionTurnId = turn.id();
        transition(SessionState.CONNECTING);
        notifyTurn(turn);
        LOG.info("Turn started: side={}, mode={}", side == null ? "auto" : side.wireName(),
                configuration.mode().wireName());

        UUID turnId = turn.id();
        connector.connect(relayUri, Map.of(), new RelayListener(turnId))
                .whenComplete((s, err) -> actor.execute(() -> onConnected(turnId, s, err)));
    }

    private void onConnected(UUID turnId, TextSocket opened, Throwable err) {
        if (!turnId.equals(connectionTurnId) || state != SessionState.CONNECTING) {
            if (opened != null) {
                opened.abort();
            }
            return;
        }
        withActiveTurnContext();
        if (err != null) {
            LOG.warn("Relay connection failed: {}", describe(err));
            abandon("connect_failed");
            return;
        }
        this.socket = opened;
        opened.send(WireMessages.sessionUpdate(configuration, recognitionLanguage()));
        try {
            audio.start(frame -> actor.execute(() -> onFrame(turnId, frame)));
        } catch (DeviceUnavailableException e) {
            LOG.error("Cannot record: {}", e.getMessage());
            abandon("device_unavailable");
            return;
        }
        transition(SessionState.RECORDING);
        if (releaseRequested) {
            LOG.debug("Talk key was released while connecting; finalizing immediately");
            beginFinalize();
        }
    }

    private void handlePressUp() {
        switch (state) {
            case CONNECTING -> releaseRequested = true;
            case RECORDING -> {
                withActiveTurnContext();
                beginFinalize();
            }
            default -> LOG.debug("Release ignored in state {}", state);
        }
    }

    private void beginFinalize() {
        // stop() returns after the capture thread queued its last frame, so the commit below runs after it
        audio.stop();
        transition(SessionState.FINALIZING);
        releasedAtNanos = System.nanoTime();
        UUID turnId = connectionTurnId;
        finalizeTimer = actor.schedule(() -> onFinalizeTimeout(turnId), finalizeTimeout);
        actor.execute(() -> sendCommit(turnId));
    }

    private void onFrame(UUID turnId, String base64Pcm) {
        if (socket == null || commitSent || !turnId.equals(connectionTurnId)) {
            return;
        }
        socket.send(WireMessages.audioAppend(base64Pcm));
    }

    private void sendCommit(UUID turnId) {
        if (state != SessionState.FINALIZING || !turnId.equals(connectionTurnId) || socket == null) {
            return;
        }
        commitSent = true;
        socket.send(WireMessages.audioCommit());
        socket.send(WireMessages.sessionFinish());
        LOG.debug("Audio committed; waiting for final transcript");
    }

    private void onFinalizeTimeout(UUID turnId) {
        if (state != SessionState.FINALIZING || !turnId.equals(connectionTurnId)) {
            return;
        }
        withActiveTurnContext();
        LOG.warn("No final transcript within {} ms; abandoning turn", finalizeTimeout.toMillis());
        abandon("timeout");
    }

    // ---- relay events ----

    private void onRelayText(UUID turnId, String text) {
        if (!turnId.equals(connectionTurnId) || state == SessionState.IDLE) {
            LOG.trace("Dropping relay message of a finished turn");
            return;
        }
        withActiveTurnContext();
        RecognitionEvent event;
        try {
            event = RecognitionEvent.parse(text);
        } catch (ProtocolViolationException e) {
            LOG.debug("Ignoring non-JSON relay message '{}'", LogSanitizer.preview(text));
            return;
        }
        switch (event.type()) {
            case PARTIAL -> applyPartial(event);
            case COMPLETED -> applyCompleted(event);
            case ERROR -> {
                LOG.error("Relay error: {}{}", event.errorMessage(),
                        event.errorDetail().isEmpty() ? "" : " (" + LogSanitizer.truncate(event.errorDetail(), 200) + ")");
                abandon("error");
            }
            case SESSION_FINISHED -> {
                LOG.warn("Session finished before a final transcript: {}", event.finishReason());
                abandon("session_finished");
            }
            default -> LOG.trace("Ignoring relay event {}", event.json().optString("type"));
        }
    }

    private void onRelayClosed(UUID turnId, int statusCode, String reason) {
        if (!turnId.equals(connectionTurnId) || state == SessionState.IDLE) {
            return;
        }
        withActiveTurnContext();
        LOG.warn("Relay closed before a final transcript. code={}, reason={}", statusCode, reason);
        socket = null;
        abandon("closed");
    }

    private void onRelayError(UUID turnId, Throwable error) {
        if (!turnId.equals(connectionTurnId) || state == SessionState.IDLE) {
            return;
        }
        withActiveTurnContext();
        LOG.error("Relay connection error: {}", describe(error));
        abandon("error");
    }

    private void applyPartial(RecognitionEvent event) {
        Optional<Turn> active = turns.active();
        if (active.isEmpty()) {
            return;
        }
        Turn turn = active.get();
        if (turn.updatePartial(event.partialText())) {
            notifyTurn(turn);
        }
    }

    private void applyCompleted(RecognitionEvent event) {
        if (state != SessionState.RECORDING && state != SessionState.FINALIZING) {
            return;
        }
        boolean wasFinalizing = state == SessionState.FINALIZING;
        cancelFinalizeTimer();
        if (audio.isRunning()) {
            audio.stop();
        }
        Turn turn = turns.resolveActiveOrCreate(null, clock.instant());
        Direction direction = resolveDirection(turn, event);
        turn.complete(event.transcript(), direction, clock.instant());
        turns.archive(turn);
        if (wasFinalizing) {
            metrics.recordFinalizeLatency(System.nanoTime() - releasedAtNanos);
        }
        metrics.incrementCompleted();
        LOG.info("Turn completed: side={}, {}->{}, text='{}'", direction.side().wireName(),
                direction.sourceLanguage(), direction.targetLanguage(), LogSanitizer.preview(turn.finalText()));
        releaseConnection(false);
        transition(SessionState.IDLE);
        notifyTurn(turn);
        requestTranslation(turn.snapshot());
    }

    private Direction resolveDirection(Turn turn, RecognitionEvent event) {
        if (configuration.mode() == SessionMode.AUTO_DETECT) {
            return event.annotatedDirection().orElseGet(() -> {
                LOG.debug("Completed event without routing annotations; defaulting to side A");
                return Direction.forSide(Side.A, configuration);
            });
        }
        Side side = turn.side() != null ? turn.side() : Side.A;
        return Direction.forSide(side, configuration);
    }

    // ---- collaborators ----

    private void requestTranslation(TurnSnapshot snapshot) {
        UUID turnId = snapshot.id();
        if (snapshot.finalText() == null || snapshot.finalText().isBlank()) {
            LOG.debug("Empty transcript; nothing to translate");
            applyTranslation(turnId, "", null);
            return;
        }
        CompletableFuture
                .supplyAsync(() -> translator.translate(
                        snapshot.finalText(), snapshot.sourceLanguage(), snapshot.targetLanguage()), collaboratorExecutor)
                .whenComplete((result, err) -> actor.execute(() -> applyTranslation(turnId, result, err)));
    }

    private void applyTranslation(UUID turnId, String result, Throwable err) {
        Optional<Turn> found = turns.find(turnId);
        if (found.isEmpty()) {
            LOG.debug("Translation arrived for an evicted turn {}", turnId);
            return;
        }
        Turn turn = found.get();
        ThreadContext.put(TURN_ID_KEY, turnId.toString());
        if (err != null) {
            LOG.warn("Translation failed: {}", describe(err));
            metrics.incrementTranslation("failure");
            if (turn.markTranslationFailed()) {
                notifyTurn(turn);
            }
            return;
        }
        String translation = result == null ? "" : result;
        if (!turn.applyTranslation(translation)) {
            return;
        }
        if (!translation.isBlank()) {
            metrics.incrementTranslation("success");
            LOG.info("Translated: '{}'", LogSanitizer.preview(translation));
        }
        notifyTurn(turn);
        if (speakTranslations && !translation.isBlank()) {
            String language = turn.targetLanguage();
            collaboratorExecutor.execute(() -> speech.speak(translation, language));
        }
    }

    // ---- helpers ----

    private void abandon(String reason) {
        cancelFinalizeTimer();
        if (audio.isRunning()) {
            audio.stop();
        }
        turns.active().ifPresent(turn -> {
            turn.abandon(clock.instant());
            turns.archive(turn);
            notifyTurn(turn);
        });
        metrics.incrementAbandoned(reason);
        LOG.info("Turn abandoned ({})", reason);
        releaseConnection(true);
        transition(SessionState.IDLE);
    }

    private void releaseConnection(boolean force) {
        TextSocket s = this.socket;
        this.socket = null;
        this.connectionTurnId = null;
        this.releaseRequested = false;
        this.commitSent = false;
        if (s == null) {
            return;
        }
        if (force) {
            s.abort();
        } else {
            s.close("turn complete");
        }
    }

    private void cancelFinalizeTimer() {
        if (finalizeTimer != null) {
            finalizeTimer.cancel();
            finalizeTimer = null;
        }
    }

    private String recognitionLanguage() {
        return turns.active()
                .filter(t -> t.side() != null)
                .map(Turn::sourceLanguage)
                .orElse(null);
    }

    private void transition(SessionState next) {
        SessionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        stateView = next;
        LOG.debug("Session state {} -> {}", previous, next);
        for (TurnListener l : listeners) {
            try {
                l.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                LOG.warn("Turn listener failed on state change: {}", e.toString());
            }
        }
    }

    private void notifyTurn(Turn turn) {
        TurnSnapshot snapshot = turn.snapshot();
        for (TurnListener l : listeners) {
            try {
                l.onTurnUpdated(snapshot);
            } catch (RuntimeException e) {
                LOG.warn("Turn listener failed on update: {}", e.toString());
            }
        }
    }

    private void withActiveTurnContext() {
        turns.active().ifPresent(t -> ThreadContext.put(TURN_ID_KEY, t.id().toString()));
    }

    private static String describe(Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private final class RelayListener implements SocketListener {

        private final UUID turnId;

        RelayListener(UUID turnId) {
            this.turnId = turnId;
        }

        @Override
        public void onText(String text) {
            actor.execute(() -> onRelayText(turnId, text));
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            actor.execute(() -> onRelayClosed(turnId, statusCode, reason));
        }

        @Override
        public void onError(Throwable error) {
            actor.execute(() -> onRelayError(turnId, error));
        }
    }
}
