package com.seamtalk.config.audio;

import com.seamtalk.service.audio.AudioFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Capture runs at the device's native format; frames are converted to 16 kHz mono PCM16LE
 * before they leave the pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Native frames read from the TargetDataLine per window. */
    @Min(64)
    @Max(16_384)
    private final int windowFrames;

    /** Sample rate tried first when opening the device. */
    @Min(8_000)
    @Max(192_000)
    private final int preferredSampleRate;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(Integer windowFrames,
                                  Integer preferredSampleRate,
                                  String deviceName) {
        this.windowFrames = windowFrames == null ? 1024 : windowFrames;
        this.preferredSampleRate = preferredSampleRate == null ? AudioFormat.DEFAULT_CAPTURE_SAMPLE_RATE : preferredSampleRate;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getWindowFrames() { return windowFrames; }
    public int getPreferredSampleRate() { return preferredSampleRate; }
    public String getDeviceName() { return deviceName; }
}
