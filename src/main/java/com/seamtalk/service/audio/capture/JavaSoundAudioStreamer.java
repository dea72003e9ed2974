package com.seamtalk.service.audio.capture;

import com.seamtalk.config.audio.AudioCaptureProperties;
import com.seamtalk.exception.DeviceUnavailableException;
import com.seamtalk.service.audio.AudioFormat;
import com.seamtalk.service.audio.PcmResampler;
import com.seamtalk.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Java Sound based microphone streamer. Opens the device at its native format, converts each
 * window to 16 kHz mono PCM16LE and hands base64 frames to the listener on a dedicated
 * {@code audio-capture} thread.
 *
 * <p>The device is opened synchronously in {@link #start(FrameListener)}, so an unavailable
 * microphone surfaces to the caller as {@link DeviceUnavailableException}. Failures after the
 * capture started are published as {@link CaptureErrorEvent}.
 */
@Service
@ConditionalOnProperty(prefix = "client", name = "enabled", havingValue = "true")
public class JavaSoundAudioStreamer implements AudioStreamer {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioStreamer.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private Capture current;

    @Autowired
    public JavaSoundAudioStreamer(AudioCaptureProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioStreamer(AudioCaptureProperties props,
                           ApplicationEventPublisher publisher,
                           DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
    }

    @PostConstruct
    public void logSystemInfo() {
        String os = System.getProperty("os.name");
        String arch = System.getProperty("os.arch");
        int mixerCount = AudioSystem.getMixerInfo().length;
        LOG.info("Audio capture initialized: OS={}, arch={}, device='{}', available-mixers={}, "
                        + "preferred-rate={}Hz, window={} frames",
                os, arch, deviceLabel(), mixerCount, props.getPreferredSampleRate(), props.getWindowFrames());
    }

    @PreDestroy
    public void shutdown() {
        if (isRunning()) {
            LOG.info("Shutting down with active capture; forcing stop");
        }
        stop(ProcessTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void start(FrameListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        synchronized (lock) {
            if (current != null) {
                throw new IllegalStateException("Audio capture is already running");
            }
            TargetDataLine line = openLine();
            Capture capture;
            try {
                capture = new Capture(line, new PcmResampler(line.getFormat()), listener);
                line.start();
            } catch (RuntimeException e) {
                closeQuietly(line);
                throw new DeviceUnavailableException(props.getDeviceName(), e);
            }
            Thread t = new Thread(() -> doCapture(capture), "audio-capture");
            t.setDaemon(true);
            capture.thread = t;
            current = capture;
            t.start();
            LOG.info("Audio capture started: native format {}", line.getFormat());
        }
    }

    @Override
    public void stop() {
        stop(ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
    }

    private void stop(long joinTimeoutMs) {
        Capture capture;
        synchronized (lock) {
            capture = current;
            current = null;
        }
        if (capture == null) {
            return;
        }
        capture.running = false;
        try {
            capture.line.stop();
        } catch (RuntimeException e) {
            LOG.debug("Stopping input line failed: {}", e.toString());
        }
        // Join outside lock; the capture thread delivers its last frames before exiting
        Thread t = capture.thread;
        if (t != null && t != Thread.currentThread()) {
            joinThread(t, joinTimeoutMs);
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lock) {
            return current != null;
        }
    }

    /** Formats tried in order: preferred rate first, mono before stereo, all 16-bit signed LE. */
    List<javax.sound.sampled.AudioFormat> candidateFormats() {
        Set<Integer> rates = new LinkedHashSet<>();
        rates.add(props.getPreferredSampleRate());
        rates.addAll(AudioFormat.FALLBACK_CAPTURE_SAMPLE_RATES);
        List<javax.sound.sampled.AudioFormat> formats = new ArrayList<>();
        for (int channels = 1; channels <= 2; channels++) {
            for (int rate : rates) {
                formats.add(new javax.sound.sampled.AudioFormat(rate, 16, channels, true, false));
            }
        }
        return formats;
    }

    private TargetDataLine openLine() {
        Exception last = null;
        for (javax.sound.sampled.AudioFormat format : candidateFormats()) {
            try {
                return provider.open(format, Optional.ofNullable(props.getDeviceName()));
            } catch (LineUnavailableException | IllegalArgumentException e) {
                LOG.debug("Input line rejected format {}: {}", format, e.getMessage());
                last = e;
            } catch (SecurityException e) {
                LOG.warn("Microphone access denied: {}", e.getMessage());
                throw new DeviceUnavailableException(props.getDeviceName(), e);
            }
        }
        LOG.warn("No usable input line on device '{}'", deviceLabel());
        throw new DeviceUnavailableException(props.getDeviceName(), last);
    }

    private void doCapture(Capture c) {
        int frameSize = c.resampler.frameSize();
        byte[] buf = new byte[props.getWindowFrames() * frameSize];
        long frames = 0;
        try {
            while (c.running) {
                int n = c.line.read(buf, 0, buf.length);
                if (n > 0) {
                    frames += emit(c, buf, n);
                }
            }
            // Tail of the utterance still buffered in the line
            int available = c.line.available();
            if (available > 0) {
                int n = c.line.read(buf, 0, Math.min(available - available % frameSize, buf.length));
                if (n > 0) {
                    frames += emit(c, buf, n);
                }
            }
            LOG.info("Audio capture completed: {} frames at {} Hz", frames, AudioFormat.TARGET_SAMPLE_RATE);
        } catch (RuntimeException e) {
            LOG.warn("Capture failed: {}", e.toString());
            publisher.publishEvent(new CaptureErrorEvent(CaptureErrorEvent.CAPTURE_ERROR, deviceLabel(), Instant.now()));
        } finally {
            closeQuietly(c.line);
        }
    }

    private int emit(Capture c, byte[] buf, int length) {
        byte[] pcm = c.resampler.convert(buf, length);
        if (pcm.length == 0) {
            return 0;
        }
        String frame = Base64.getEncoder().encodeToString(pcm);
        try {
            c.listener.onFrame(frame);
        } catch (RuntimeException e) {
            LOG.warn("Frame listener failed: {}", e.toString());
        }
        return pcm.length / AudioFormat.TARGET_BLOCK_ALIGN;
    }

    private String deviceLabel() {
        return props.getDeviceName() != null ? props.getDeviceName() : "default";
    }

    private static void closeQuietly(TargetDataLine line) {
        try {
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Closing input line failed: {}", e.toString());
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (!thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Capture {
        final TargetDataLine line;
        final PcmResampler resampler;
        final FrameListener listener;
        volatile boolean running = true;
        volatile Thread thread;

        Capture(TargetDataLine line, PcmResampler resampler, FrameListener listener) {
            this.line = line;
            this.resampler = resampler;
            this.listener = listener;
        }
    }
}
