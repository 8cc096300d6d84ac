package io.eventrelay.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.bus.EventSink;
import io.eventrelay.error.ErrorKind;
import io.eventrelay.error.TransportException;
import io.eventrelay.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non-blocking newline-delimited JSON server over a Unix domain socket or TCP.
 * <p>
 * One selector thread owns every channel. Requests of one connection run in arrival
 * order on the request executor; replies and pushes are queued per connection and
 * written by the selector thread.
 */
public final class SocketServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SocketServer.class);
    private static final int MAX_LINE_BYTES = 16 * 1024 * 1024;
    private static final long MAX_PENDING_BYTES = 8L * 1024L * 1024L;

    private final SocketAddress bindAddress;
    private final Path socketFile;
    private final RequestHandler handler;
    private final ExecutorService requestExecutor;
    private final Queue<Connection> pendingWrites = new ConcurrentLinkedQueue<>();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private Selector selector;
    private ServerSocketChannel server;
    private Thread loop;
    private volatile boolean running;

    private SocketServer(SocketAddress bindAddress, Path socketFile, RequestHandler handler,
                         ExecutorService requestExecutor) {
        this.bindAddress = bindAddress;
        this.socketFile = socketFile;
        this.handler = handler;
        this.requestExecutor = requestExecutor;
    }

    public static SocketServer unix(Path socketFile, RequestHandler handler, ExecutorService requestExecutor) {
        return new SocketServer(UnixDomainSocketAddress.of(socketFile), socketFile, handler, requestExecutor);
    }

    public static SocketServer tcp(String host, int port, RequestHandler handler, ExecutorService requestExecutor) {
        String bindHost = host == null || host.isBlank() ? "127.0.0.1" : host;
        return new SocketServer(new InetSocketAddress(bindHost, port), null, handler, requestExecutor);
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        if (socketFile != null) {
            Files.createDirectories(socketFile.toAbsolutePath().getParent());
            Files.deleteIfExists(socketFile);
            server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        } else {
            server = ServerSocketChannel.open();
        }
        server.bind(bindAddress);
        server.configureBlocking(false);
        selector = Selector.open();
        server.register(selector, SelectionKey.OP_ACCEPT);
        running = true;
        loop = new Thread(this::runLoop, "eventrelay-selector-" + describe());
        loop.setDaemon(true);
        loop.start();
        log.info("Listening on {}", describe());
    }

    public SocketAddress localAddress() throws IOException {
        return server.getLocalAddress();
    }

    /** Bound TCP port, or -1 for a Unix socket. */
    public int port() throws IOException {
        SocketAddress local = localAddress();
        return local instanceof InetSocketAddress ? ((InetSocketAddress) local).getPort() : -1;
    }

    public int connectionCount() {
        return connections.size();
    }

    @Override
    public void close() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        selector.wakeup();
        try {
            loop.join(5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (socketFile != null) {
            try {
                Files.deleteIfExists(socketFile);
            } catch (IOException e) {
                log.warn("Failed to remove socket file {}: {}", socketFile, e.getMessage());
            }
        }
        log.info("Stopped listening on {}", describe());
    }

    private String describe() {
        return socketFile != null ? "unix:" + socketFile : "tcp:" + bindAddress;
    }

    private void runLoop() {
        try {
            while (running) {
                selector.select(500L);
                drainPendingWrites();
                Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
                while (keys.hasNext()) {
                    SelectionKey key = keys.next();
                    keys.remove();
                    if (!key.isValid()) {
                        continue;
                    }
                    if (key.isAcceptable()) {
                        accept();
                        continue;
                    }
                    Connection connection = (Connection) key.attachment();
                    if (key.isReadable()) {
                        connection.readAvailable();
                    }
                    if (key.isValid() && key.isWritable()) {
                        connection.flush();
                    }
                }
            }
        } catch (IOException | ClosedSelectorException e) {
            if (running) {
                log.error("Selector loop for {} failed", describe(), e);
            }
        } finally {
            shutdownChannels();
        }
    }

    private void accept() throws IOException {
        SocketChannel channel = server.accept();
        if (channel == null) {
            return;
        }
        channel.configureBlocking(false);
        Connection connection = new Connection("conn-" + connectionCounter.incrementAndGet(), channel);
        connection.key = channel.register(selector, SelectionKey.OP_READ, connection);
        connections.put(connection.id, connection);
        log.debug("Accepted {} on {}", connection.id, describe());
    }

    private void drainPendingWrites() {
        Connection connection;
        while ((connection = pendingWrites.poll()) != null) {
            if (connection.closeRequested) {
                connection.closeNow();
            } else if (connection.key != null && connection.key.isValid() && !connection.outbound.isEmpty()) {
                connection.key.interestOps(SelectionKey.OP_READ | SelectionKey.OP_WRITE);
            }
        }
    }

    private void shutdownChannels() {
        for (Connection connection : connections.values()) {
            connection.closeNow();
        }
        try {
            server.close();
            selector.close();
        } catch (IOException e) {
            log.warn("Failed to close listener {}: {}", describe(), e.getMessage());
        }
    }

    private final class Connection implements EventSink {
        private final String id;
        private final SocketChannel channel;
        private final ByteBuffer readBuffer = ByteBuffer.allocate(8192);
        private final ByteArrayOutputStream line = new ByteArrayOutputStream();
        private final Queue<ByteBuffer> outbound = new ConcurrentLinkedQueue<>();
        private final AtomicLong pendingBytes = new AtomicLong();
        private CompletableFuture<Void> requestChain = CompletableFuture.completedFuture(null);
        private SelectionKey key;
        private volatile boolean open = true;
        private volatile boolean closeRequested;

        private Connection(String id, SocketChannel channel) {
            this.id = id;
            this.channel = channel;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open && !closeRequested;
        }

        @Override
        public void send(ObjectNode message) throws TransportException {
            if (!isOpen()) {
                throw new TransportException(id + " is closed");
            }
            byte[] bytes = WireProtocol.encode(message).getBytes(StandardCharsets.UTF_8);
            if (pendingBytes.addAndGet(bytes.length) > MAX_PENDING_BYTES) {
                requestClose();
                throw new TransportException(id + " is not reading, " + MAX_PENDING_BYTES + " bytes pending");
            }
            outbound.add(ByteBuffer.wrap(bytes));
            pendingWrites.add(this);
            selector.wakeup();
        }

        private void requestClose() {
            closeRequested = true;
            pendingWrites.add(this);
            selector.wakeup();
        }

        private void readAvailable() {
            int read;
            try {
                read = channel.read(readBuffer);
            } catch (IOException e) {
                log.debug("Read failed on {}: {}", id, e.getMessage());
                closeNow();
                return;
            }
            if (read < 0) {
                closeNow();
                return;
            }
            readBuffer.flip();
            while (readBuffer.hasRemaining()) {
                byte b = readBuffer.get();
                if (b == '\n') {
                    String raw = line.toString(StandardCharsets.UTF_8).trim();
                    line.reset();
                    if (!raw.isEmpty()) {
                        enqueueRequest(raw);
                    }
                } else {
                    line.write(b);
                    if (line.size() > MAX_LINE_BYTES) {
                        line.reset();
                        reply(WireProtocol.error(null, null, ErrorKind.VALIDATION,
                                "request exceeds " + MAX_LINE_BYTES + " bytes"));
                        requestClose();
                        break;
                    }
                }
            }
            readBuffer.clear();
        }

        private void enqueueRequest(String raw) {
            requestChain = requestChain
                    .exceptionally(e -> null)
                    .thenRunAsync(() -> process(raw), requestExecutor);
        }

        private void process(String raw) {
            ObjectNode response;
            try {
                WireRequest request = WireProtocol.parse(raw);
                response = handler.handle(request, this);
            } catch (ValidationException e) {
                response = WireProtocol.error(null, null, e.kind(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Request on {} failed", id, e);
                response = WireProtocol.error(null, null, ErrorKind.INTERNAL, e.getMessage());
            }
            if (response != null) {
                reply(response);
            }
        }

        private void reply(ObjectNode response) {
            try {
                send(response);
            } catch (TransportException e) {
                log.debug("Dropped reply on {}: {}", id, e.getMessage());
            }
        }

        private void flush() {
            try {
                ByteBuffer head;
                while ((head = outbound.peek()) != null) {
                    channel.write(head);
                    if (head.hasRemaining()) {
                        return;
                    }
                    outbound.poll();
                    pendingBytes.addAndGet(-head.capacity());
                }
                key.interestOps(SelectionKey.OP_READ);
                if (!outbound.isEmpty()) {
                    key.interestOps(SelectionKey.OP_READ | SelectionKey.OP_WRITE);
                }
            } catch (IOException e) {
                log.debug("Write failed on {}: {}", id, e.getMessage());
                closeNow();
            }
        }

        private void closeNow() {
            if (!open) {
                return;
            }
            open = false;
            connections.remove(id);
            if (key != null) {
                key.cancel();
            }
            try {
                channel.close();
            } catch (IOException e) {
                log.debug("Close failed on {}: {}", id, e.getMessage());
            }
            try {
                handler.onDisconnect(this);
            } catch (RuntimeException e) {
                log.warn("Disconnect handling for {} failed", id, e);
            }
            log.debug("Closed {}", id);
        }
    }
}
