/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.seamtalk.exception.InvalidRequestException} → 400 Bad Request</li>
 *   <li>{@link com.seamtalk.exception.MissingCredentialsException} → 500 Internal Server Error</li>
 *   <li>{@link com.seamtalk.exception.CollaboratorException} with provider status → 502 Bad Gateway</li>
 *   <li>{@link com.seamtalk.exception.CollaboratorException} without response → 500</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "error": "Doubao error: 401",
 *   "detail": "{\"error\":{\"code\":\"AuthenticationError\"}}",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.seamtalk.presentation.exception;
