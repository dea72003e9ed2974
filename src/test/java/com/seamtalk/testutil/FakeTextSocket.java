package com.seamtalk.testutil;

import com.seamtalk.transport.TextSocket;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records what was sent on a socket and how it ended.
 */
public class FakeTextSocket implements TextSocket {

    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean aborted;
    private volatile String closeReason;

    @Override
    public void send(String text) {
        if (open) {
            sent.add(text);
        }
    }

    @Override
    public void close(String reason) {
        closeReason = reason;
        open = false;
    }

    @Override
    public void abort() {
        aborted = true;
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public List<String> sent() {
        return sent;
    }

    public boolean aborted() {
        return aborted;
    }

    public String closeReason() {
        return closeReason;
    }
}
