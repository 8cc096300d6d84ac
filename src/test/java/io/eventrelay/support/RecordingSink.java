package io.eventrelay.support;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.error.TransportException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** Push channel that keeps every frame it receives; can be switched into a failing state. */
public final class RecordingSink implements EventSink {
    private final String id;
    private final BlockingQueue<ObjectNode> frames = new LinkedBlockingQueue<>();
    private volatile boolean failing;

    public RecordingSink(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(ObjectNode frame) throws TransportException {
        if (failing) {
            throw new TransportException("sink " + id + " is gone");
        }
        frames.add(frame.deepCopy());
    }

    @Override
    public boolean isOpen() {
        return !failing;
    }

    public void failSends() {
        failing = true;
    }

    public ObjectNode next(Duration timeout) throws InterruptedException {
        return frames.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<ObjectNode> drain() {
        List<ObjectNode> out = new ArrayList<>();
        frames.drainTo(out);
        return out;
    }

    public int size() {
        return frames.size();
    }
}
