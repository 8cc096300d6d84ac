package io.eventrelay.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking client for the socket transport. Replies are matched to requests through
 * {@code correlation_id}; pushed frames are buffered for {@link #nextPush}.
 */
public final class DaemonClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DaemonClient.class);

    private final SocketChannel channel;
    private final Object writeLock = new Object();
    private final Map<String, CompletableFuture<ObjectNode>> pending = new ConcurrentHashMap<>();
    private final BlockingQueue<ObjectNode> pushes = new LinkedBlockingQueue<>();
    private final AtomicLong correlationCounter = new AtomicLong();
    private final String clientTag;
    private final Thread reader;
    private volatile boolean closed;

    private DaemonClient(SocketChannel channel, String clientTag) {
        this.channel = channel;
        this.clientTag = clientTag;
        this.reader = new Thread(this::readLoop, "eventrelay-client-reader");
        this.reader.setDaemon(true);
        this.reader.start();
    }

    public static DaemonClient connectUnix(Path socketFile) throws IOException {
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        channel.connect(UnixDomainSocketAddress.of(socketFile));
        return new DaemonClient(channel, "unix");
    }

    public static DaemonClient connectTcp(String host, int port) throws IOException {
        SocketChannel channel = SocketChannel.open(new InetSocketAddress(host, port));
        return new DaemonClient(channel, "tcp");
    }

    public ObjectNode request(String event, ObjectNode data, Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        return request(event, data, null, timeout);
    }

    public ObjectNode request(String event, ObjectNode data, String origin, Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        String correlationId = clientTag + "-" + correlationCounter.incrementAndGet();
        ObjectNode frame = Jsons.object();
        frame.put("event", event);
        frame.set("data", data == null ? Jsons.object() : data);
        if (origin != null) {
            frame.put("origin", origin);
        }
        frame.put("correlation_id", correlationId);
        CompletableFuture<ObjectNode> reply = new CompletableFuture<>();
        pending.put(correlationId, reply);
        try {
            writeLine(WireProtocol.encode(frame));
            return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IOException("connection lost while waiting for " + event, e.getCause());
        } finally {
            pending.remove(correlationId);
        }
    }

    /** Next pushed frame, or {@code null} when none arrives within the timeout. */
    public ObjectNode nextPush(Duration timeout) throws InterruptedException {
        return pushes.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isOpen() {
        return !closed && channel.isOpen();
    }

    @Override
    public void close() {
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.getMessage());
        }
        try {
            reader.join(2_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void writeLine(String line) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
        synchronized (writeLock) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
    }

    private void readLoop() {
        ByteBuffer buffer = ByteBuffer.allocate(8192);
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        try {
            while (!closed) {
                int read = channel.read(buffer);
                if (read < 0) {
                    break;
                }
                buffer.flip();
                while (buffer.hasRemaining()) {
                    byte b = buffer.get();
                    if (b == '\n') {
                        dispatch(line.toString(StandardCharsets.UTF_8));
                        line.reset();
                    } else {
                        line.write(b);
                    }
                }
                buffer.clear();
            }
        } catch (IOException e) {
            if (!closed) {
                log.debug("Client connection dropped: {}", e.getMessage());
            }
        } finally {
            closed = true;
            IOException lost = new IOException("connection closed");
            pending.values().forEach(future -> future.completeExceptionally(lost));
        }
    }

    private void dispatch(String raw) {
        if (raw.isBlank()) {
            return;
        }
        JsonNode node;
        try {
            node = Jsons.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed frame from daemon: {}", e.getOriginalMessage());
            return;
        }
        if (!node.isObject()) {
            return;
        }
        ObjectNode frame = (ObjectNode) node;
        if (frame.path("push").asBoolean(false)) {
            pushes.add(frame);
            return;
        }
        String correlationId = frame.path("correlation_id").asText(null);
        CompletableFuture<ObjectNode> waiter = correlationId == null ? null : pending.get(correlationId);
        if (waiter != null) {
            waiter.complete(frame);
        } else {
            log.debug("Unmatched reply from daemon: {}", raw);
        }
    }
}
