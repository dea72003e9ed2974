/**
 * Realtime relay: terminates client WebSockets, opens one upstream recognition connection per
 * client and annotates completed transcripts with the speaker side and translation direction.
 *
 * <p>Each connection is an independent {@link com.seamtalk.relay.RelayBridge} running on its
 * own serial executor. Nothing is shared between connections.
 */
package com.seamtalk.relay;
