package com.seamtalk.service.hotkey.event;

import java.time.Instant;

/**
 * Published when registering the global key hook fails due to OS permissions
 * (e.g., macOS Accessibility permission not granted). Talk keys stay inactive.
 */
public record TalkKeyPermissionDeniedEvent(String detail, Instant at) { }
