package com.seamtalk.exception;

/**
 * Thrown when the microphone input line cannot be opened or started.
 * The caller aborts the turn that needed audio and stays idle.
 */
public class DeviceUnavailableException extends SeamTalkException {

    private final String deviceName;

    public DeviceUnavailableException(String deviceName, Throwable cause) {
        super("Audio input device unavailable: " + describe(deviceName)
                + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.deviceName = deviceName;
    }

    public String getDeviceName() {
        return deviceName;
    }

    private static String describe(String deviceName) {
        return deviceName == null ? "default" : deviceName;
    }
}
