package fr.lapetina.cluster.network.infrastructure.config;

import fr.lapetina.cluster.network.domain.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the cluster client configuration and keeps it current.
 *
 * <p>A configuration is validated before it is installed: every node needs a
 * url, node ids are unique, and numeric settings are in range. A rejected
 * document never replaces the current configuration, so
 * {@link #getCurrentConfig()} always matches what listeners were given.
 *
 * <p>When the configuration comes from a file, {@link #startWatching()} follows
 * that file and reinstalls it whenever its content changes.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<NetworkClientConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private final Object watchLock = new Object();
    // Guarded by watchLock
    private WatchService watchService;
    private Thread watcher;
    private boolean closed;

    // Content of the installed document, used to skip no-op file events
    private volatile String installedContent;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(NetworkClientConfig.class, new LoaderOptions()));
    }

    /**
     * Loads the configuration from the file system, or from the classpath when
     * no such file exists, and notifies listeners.
     *
     * @throws ConfigurationException if the document is missing, unreadable or invalid
     */
    public NetworkClientConfig load() {
        return install(read());
    }

    /**
     * Loads the configuration from a stream and notifies listeners.
     *
     * @throws ConfigurationException if the document is unreadable or invalid
     */
    public NetworkClientConfig loadFromStream(InputStream inputStream) {
        try {
            return install(new Document("stream", new String(inputStream.readAllBytes(), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration stream", e);
        }
    }

    /**
     * Reloads the configuration, keeping the current one if the new document is rejected.
     */
    public NetworkClientConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration rejected, keeping current: path={}", configPath, e);
            return currentConfig.get();
        }
    }

    /**
     * Returns the installed configuration, or null before the first load.
     */
    public NetworkClientConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private Document read() {
        if (Files.isRegularFile(configPath)) {
            try {
                return new Document(configPath.toString(), Files.readString(configPath, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration file: " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration not found on file system or classpath: " + configPath);
            }
            return new Document("classpath:" + resource, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource: " + resource, e);
        }
    }

    private NetworkClientConfig install(Document document) {
        NetworkClientConfig config = parse(document);
        NetworkClientConfig previous = currentConfig.getAndSet(config);
        installedContent = document.content();
        log.info("Configuration installed: source={}, cluster={}, nodes={}",
                document.source(), config.getCluster().getName(), config.getCluster().getNodes().size());

        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Config change listener failed: source={}", document.source(), e);
            }
        }
        return config;
    }

    private NetworkClientConfig parse(Document document) {
        NetworkClientConfig config;
        try {
            config = yaml.load(document.content());
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + document.source() + ": " + e.getMessage(), e);
        }
        if (config == null) {
            log.warn("Configuration is empty, using defaults: source={}", document.source());
            return new NetworkClientConfig();
        }
        validate(config, document.source());
        return config;
    }

    private static void validate(NetworkClientConfig config, String source) {
        requireSection(config.getCluster(), "cluster", source);
        requireSection(config.getLoadBalancer(), "loadBalancer", source);
        requireSection(config.getTransport(), "transport", source);
        requireSection(config.getMetrics(), "metrics", source);

        List<Node> nodes;
        try {
            nodes = config.getCluster().toNodes();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Invalid node in " + source + ": " + e.getMessage(), e);
        }
        Set<Integer> ids = new HashSet<>();
        for (Node node : nodes) {
            if (!ids.add(node.getId())) {
                throw new ConfigurationException("Duplicate node id " + node.getId() + " in " + source);
            }
        }

        if (config.getLoadBalancer().getMinimumAvailableNodes() < 0) {
            throw new ConfigurationException("loadBalancer.minimumAvailableNodes must not be negative in " + source);
        }
        NetworkClientConfig.TransportConfig transport = config.getTransport();
        if (transport.getConnectTimeoutMs() <= 0 || transport.getRequestTimeoutMs() <= 0) {
            throw new ConfigurationException("transport timeouts must be positive in " + source);
        }
        if (transport.getCircuitBreakerFailureThreshold() <= 0) {
            throw new ConfigurationException("transport.circuitBreakerFailureThreshold must be positive in " + source);
        }
    }

    private static void requireSection(Object section, String name, String source) {
        if (section == null) {
            throw new ConfigurationException("Section '" + name + "' is empty in " + source);
        }
    }

    /**
     * Follows the configuration file and reinstalls it when its content changes.
     * Does nothing when already watching, after {@link #close()}, or when the
     * configuration does not come from a file.
     */
    public void startWatching() {
        synchronized (watchLock) {
            if (closed || watcher != null) {
                return;
            }
            if (!Files.isRegularFile(configPath)) {
                log.warn("Configuration is not a file, hot reload disabled: path={}", configPath);
                return;
            }

            Path directory = configPath.toAbsolutePath().getParent();
            WatchService service;
            try {
                service = directory.getFileSystem().newWatchService();
                directory.register(service, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
            } catch (IOException e) {
                log.error("Failed to watch configuration directory, hot reload disabled: path={}", directory, e);
                return;
            }

            watchService = service;
            watcher = new Thread(() -> watch(service), "config-watcher");
            watcher.setDaemon(true);
            watcher.start();
            log.info("Configuration hot reload enabled: path={}", configPath);
        }
    }

    public boolean isWatching() {
        synchronized (watchLock) {
            return watcher != null;
        }
    }

    private void watch(WatchService service) {
        Path fileName = configPath.getFileName();
        try {
            while (true) {
                WatchKey key = service.take();
                boolean touched = key.pollEvents().stream().anyMatch(event -> fileName.equals(event.context()));
                key.reset();
                if (touched) {
                    reloadIfChanged();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Configuration watcher stopped: path={}", configPath);
        }
    }

    private void reloadIfChanged() {
        Document document;
        try {
            document = read();
        } catch (ConfigurationException e) {
            log.warn("Configuration file unreadable, keeping current: path={}, error={}", configPath, e.getMessage());
            return;
        }
        if (document.content().equals(installedContent)) {
            log.debug("Configuration file touched without changes: path={}", configPath);
            return;
        }

        log.info("Configuration file changed, reloading: path={}", configPath);
        try {
            install(document);
        } catch (ConfigurationException e) {
            log.error("Configuration rejected, keeping current: path={}", configPath, e);
        }
    }

    /**
     * Stops watching. The loader keeps its current configuration.
     */
    @Override
    public void close() {
        WatchService service;
        Thread stopping;
        synchronized (watchLock) {
            closed = true;
            service = watchService;
            stopping = watcher;
            watchService = null;
            watcher = null;
        }

        if (service != null) {
            try {
                service.close();
            } catch (IOException e) {
                log.warn("Error closing configuration watch service", e);
            }
        }
        if (stopping != null) {
            stopping.interrupt();
            try {
                stopping.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private record Document(String source, String content) {
    }

    /**
     * Raised when a configuration document cannot be found, read or accepted.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
