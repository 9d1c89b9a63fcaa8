package org.abstractica.demo.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.abstractica.realtime.ConnectionSnapshot;
import org.abstractica.realtime.ConnectionStatus;
import org.abstractica.realtime.RealtimeClient;
import org.abstractica.realtime.RealtimeEvent;
import org.abstractica.realtime.impl.client.DefaultRealtimeClientFactory;
import org.abstractica.realtime.impl.client.RealtimeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Demo application that watches a realtime server.
 *
 * <p>Features demonstrated:</p>
 * <ul>
 *   <li>Configuration from environment variables</li>
 *   <li>Handlers for every domain event</li>
 *   <li>Connection status notifications</li>
 *   <li>Queued emits while offline</li>
 *   <li>Manual connect, disconnect and ping</li>
 * </ul>
 *
 * <p>The auth token is read from {@code REALTIME_AUTH_TOKEN} and can be
 * replaced at runtime with the {@code token} command.</p>
 */
public class DemoMonitor
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoMonitor.class);
    private static final String ENV_AUTH_TOKEN = "REALTIME_AUTH_TOKEN";

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> token;
    private final RealtimeClient client;

    public DemoMonitor(RealtimeSettings settings, String initialToken)
    {
        this.token = new AtomicReference<>(initialToken);
        this.client = new DefaultRealtimeClientFactory().builder()
                .settings(settings)
                .authTokenProvider(() -> Optional.ofNullable(token.get()))
                .errorHandler((event, payload, exception) ->
                        LOG.error("Handler for {} failed on {}", event, payload, exception))
                .build();

        registerEventHandlers();
    }

    private void registerEventHandlers()
    {
        for (RealtimeEvent event : RealtimeEvent.values())
        {
            if (event.isServerEvent())
            {
                client.on(event, payload -> System.out.printf("[%s] %s%n", event, payload));
            }
        }

        client.onConnectionStatus(this::printStatus);
    }

    private void printStatus(ConnectionStatus status)
    {
        StringBuilder line = new StringBuilder("Status: ").append(status.status().getLabel());
        status.getAttempt().ifPresent(attempt -> line.append(" (attempt ").append(attempt)
                .append('/').append(status.getMaxAttempts().orElse(0)).append(')'));
        status.getReason().ifPresent(reason -> line.append(" - ").append(reason));
        status.getMessage().ifPresent(message -> line.append(" - ").append(message));
        System.out.println(line);
    }

    private void printSnapshot()
    {
        ConnectionSnapshot snapshot = client.getSnapshot();
        System.out.printf("state=%s connected=%s connecting=%s socketId=%s attempts=%d queued=%d%n",
                snapshot.state().getLabel(),
                snapshot.connected(),
                snapshot.connecting(),
                snapshot.socketId(),
                snapshot.reconnectAttempts(),
                snapshot.queuedMessages());
    }

    public void connect()
    {
        System.out.println("Connecting...");
        client.connect();
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String[] parts = line.trim().split("\\s+", 3);
                String command = parts[0].toLowerCase();

                switch (command)
                {
                    case "connect" -> client.connect();
                    case "disconnect" -> client.disconnect();
                    case "ping" -> client.ping();
                    case "status" -> printSnapshot();
                    case "token" -> token.set(parts.length > 1 ? parts[1] : null);
                    case "emit" ->
                    {
                        if (parts.length < 2)
                        {
                            System.out.println("Usage: emit <event> [json]");
                        }
                        else
                        {
                            handleEmit(parts[1], parts.length > 2 ? parts[2] : null);
                        }
                    }
                    case "quit", "exit", "q" ->
                    {
                        return;
                    }
                    case "help" ->
                    {
                        System.out.println("Commands:");
                        System.out.println("  connect              - Connect (or retry after failure)");
                        System.out.println("  disconnect           - Disconnect without reconnecting");
                        System.out.println("  emit <event> [json]  - Send now or queue until connected");
                        System.out.println("  ping                 - Send a ping");
                        System.out.println("  token [value]        - Replace or clear the auth token");
                        System.out.println("  status               - Show the connection snapshot");
                        System.out.println("  quit                 - Close and exit");
                    }
                    case "" ->
                    {
                    }
                    default -> System.out.println("Unknown command: " + command + " (type 'help' for commands)");
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void handleEmit(String event, String json)
    {
        try
        {
            JsonNode payload = json != null ? mapper.readTree(json) : null;
            client.emitOrQueue(event, payload);
        }
        catch (JsonProcessingException e)
        {
            System.out.println("Invalid JSON: " + e.getOriginalMessage());
        }
    }

    public void close()
    {
        client.close();
    }

    public static void main(String[] args)
    {
        RealtimeSettings settings;
        try
        {
            settings = RealtimeSettings.fromEnvironment(System::getenv);
        }
        catch (IllegalArgumentException e)
        {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        String initialToken = System.getenv(ENV_AUTH_TOKEN);
        if (initialToken == null || initialToken.isBlank())
        {
            System.out.println("No " + ENV_AUTH_TOKEN + " set; use 'token <value>' then 'connect'.");
        }

        DemoMonitor monitor = new DemoMonitor(settings, initialToken);
        Runtime.getRuntime().addShutdownHook(new Thread(monitor::close, "demo-monitor-shutdown"));

        LOG.info("Watching {}", settings.serverUri());
        monitor.connect();
        monitor.runCommandLoop();
        monitor.close();
    }
}
