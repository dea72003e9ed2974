/**
 * Conversation domain: sides, session configuration, turns and routing decisions.
 *
 * <p>Value types are immutable records that validate in their constructors.
 * {@link com.seamtalk.domain.Turn} is the one mutable entity; it is owned by the client
 * session's serial executor and published to other threads as
 * {@link com.seamtalk.domain.TurnSnapshot}.
 *
 * @since 1.0
 */
package com.seamtalk.domain;
