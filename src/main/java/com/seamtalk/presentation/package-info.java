/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>The realtime WebSocket endpoint lives in {@code com.seamtalk.relay}; this package holds the
 * request/response endpoints only.
 *
 * @see com.seamtalk.presentation.controller
 * @see com.seamtalk.presentation.exception.GlobalExceptionHandler
 */
package com.seamtalk.presentation;
