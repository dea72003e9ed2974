/**
 * Client audio pipeline: microphone capture at the device's native format and conversion to the
 * 16 kHz mono PCM16LE frames of the realtime protocol.
 */
package com.seamtalk.service.audio;
