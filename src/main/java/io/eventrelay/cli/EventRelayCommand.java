package io.eventrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventrelay.config.DaemonSettings;
import io.eventrelay.config.EventRelayConfig;
import io.eventrelay.model.Event;
import io.eventrelay.runtime.EventRelayDaemon;
import io.eventrelay.storage.Database;
import io.eventrelay.storage.SqliteEventJournal;
import io.eventrelay.transport.DaemonClient;
import io.eventrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "eventrelay",
        mixinStandardHelpOptions = true,
        description = "EventRelay event routing and completion daemon",
        subcommands = {
                EventRelayCommand.InitCommand.class,
                EventRelayCommand.ServeCommand.class,
                EventRelayCommand.SendCommand.class,
                EventRelayCommand.SubscribeCommand.class,
                EventRelayCommand.HistoryCommand.class,
                EventRelayCommand.SettingsCommand.class
        }
)
public final class EventRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Daemon data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use a subcommand. Try --help.");
    }

    EventRelayConfig config() {
        return EventRelayConfig.fromRoot(root);
    }

    DaemonClient connect(String socket, String host, int port) throws IOException {
        if (port > 0) {
            return DaemonClient.connectTcp(host, port);
        }
        Path socketFile = socket == null || socket.isBlank() ? config().socketFile() : Paths.get(socket);
        return DaemonClient.connectUnix(socketFile);
    }

    @Command(name = "init", description = "Initialize the data root and event journal")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        EventRelayCommand parent;

        @Override
        public Integer call() {
            EventRelayConfig config = parent.config();
            new Database(config).init();
            System.out.println("Initialized EventRelay at " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the daemon until system:shutdown or interrupt")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        EventRelayCommand parent;

        @Option(names = {"--socket"}, description = "Unix socket path (default <root>/daemon.sock)")
        String socket;

        @Option(names = {"--no-socket"}, defaultValue = "false", description = "Do not listen on a Unix socket")
        boolean noSocket;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind host for TCP and HTTP")
        String host;

        @Option(names = {"--tcp-port"}, defaultValue = "0", description = "TCP port for line-delimited JSON (0 disables)")
        int tcpPort;

        @Option(names = {"--http-port"}, defaultValue = "0", description = "HTTP port for POST /events (0 disables)")
        int httpPort;

        @Override
        public Integer call() throws Exception {
            EventRelayConfig config = parent.config();
            EventRelayDaemon daemon = new EventRelayDaemon(config);
            daemon.init();
            Thread hook = new Thread(daemon::close, "eventrelay-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                if (!noSocket) {
                    Path socketFile = socket == null || socket.isBlank() ? config.socketFile() : Paths.get(socket);
                    daemon.startSocket(socketFile);
                    System.out.println("Listening on unix:" + socketFile);
                }
                if (tcpPort > 0) {
                    daemon.startTcp(host, tcpPort);
                    System.out.println("Listening on tcp://" + host + ":" + tcpPort);
                }
                if (httpPort > 0) {
                    daemon.startHttp(host, httpPort);
                    System.out.println("Listening on http://" + host + ":" + httpPort + "/events");
                }
                daemon.awaitShutdown();
            } finally {
                daemon.close();
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    // JVM is already shutting down
                    System.err.println("Shutdown in progress");
                }
            }
            return 0;
        }
    }

    @Command(name = "send", description = "Send one event and print the reply")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        EventRelayCommand parent;

        @Parameters(index = "0", description = "Event name, e.g. completion:async")
        String event;

        @Option(names = {"--data"}, defaultValue = "{}", description = "JSON object payload")
        String data;

        @Option(names = {"--origin"}, description = "Origin (client or agent id)")
        String origin;

        @Option(names = {"--socket"}, description = "Unix socket path (default <root>/daemon.sock)")
        String socket;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "TCP host")
        String host;

        @Option(names = {"--tcp-port"}, defaultValue = "0", description = "Connect over TCP instead of the Unix socket")
        int tcpPort;

        @Option(names = {"--timeout-ms"}, defaultValue = "30000", description = "Reply timeout")
        long timeoutMs;

        @Override
        public Integer call() throws Exception {
            JsonNode payload = Jsons.readTree(data);
            if (!payload.isObject()) {
                System.err.println("--data must be a JSON object");
                return 2;
            }
            try (DaemonClient client = parent.connect(socket, host, tcpPort)) {
                ObjectNode reply = client.request(event, (ObjectNode) payload, origin, Duration.ofMillis(timeoutMs));
                System.out.println(Jsons.toJson(reply));
                return reply.has("error") ? 1 : 0;
            }
        }
    }

    @Command(name = "subscribe", description = "Subscribe to event patterns and print pushed events")
    static final class SubscribeCommand implements Callable<Integer> {
        @ParentCommand
        EventRelayCommand parent;

        @Parameters(arity = "0..*", description = "Event patterns (default *)")
        List<String> patterns;

        @Option(names = {"--client-id"}, defaultValue = "cli-subscriber", description = "Subscriber id")
        String clientId;

        @Option(names = {"--count"}, defaultValue = "0", description = "Exit after this many events (0 = forever)")
        int count;

        @Option(names = {"--socket"}, description = "Unix socket path (default <root>/daemon.sock)")
        String socket;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "TCP host")
        String host;

        @Option(names = {"--tcp-port"}, defaultValue = "0", description = "Connect over TCP instead of the Unix socket")
        int tcpPort;

        @Override
        public Integer call() throws Exception {
            try (DaemonClient client = parent.connect(socket, host, tcpPort)) {
                ObjectNode data = Jsons.object();
                data.put("client_id", clientId);
                List<String> requested = patterns == null || patterns.isEmpty() ? List.of("*") : patterns;
                requested.forEach(data.putArray("event_patterns")::add);
                ObjectNode reply = client.request("monitor:subscribe", data, clientId, Duration.ofSeconds(10));
                if (reply.has("error")) {
                    System.err.println(Jsons.toJson(reply));
                    return 1;
                }
                int received = 0;
                while (client.isOpen() && (count <= 0 || received < count)) {
                    ObjectNode push = client.nextPush(Duration.ofSeconds(1));
                    if (push != null) {
                        System.out.println(Jsons.toCompactJson(push));
                        received++;
                    }
                }
                return 0;
            }
        }
    }

    @Command(name = "history", description = "Read journaled events without a running daemon")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        EventRelayCommand parent;

        @Option(names = {"--pattern"}, description = "Event pattern, repeatable (default *)")
        List<String> patterns;

        @Option(names = {"--since"}, defaultValue = "0", description = "Return events after this sequence number")
        long since;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max events")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            SqliteEventJournal journal = new SqliteEventJournal(database);
            List<Event> events = journal.read(patterns == null ? List.of() : patterns, since, limit);
            List<ObjectNode> out = new ArrayList<>();
            for (Event event : events) {
                out.add(event.toWire());
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective daemon settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        EventRelayCommand parent;

        @Override
        public Integer call() {
            EventRelayConfig config = parent.config();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("settingsFile", config.settingsFile().toString());
            out.put("settings", DaemonSettings.load(config.settingsFile()));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }
}
