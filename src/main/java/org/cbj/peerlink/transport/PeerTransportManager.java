package org.cbj.peerlink.transport;

import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.error.ErrorCode;
import org.cbj.peerlink.error.PeerLinkException;
import org.cbj.peerlink.transport.platform.PeerPlatform;
import org.cbj.peerlink.transport.platform.PlatformChannel;
import org.cbj.peerlink.transport.platform.PlatformConnection;
import org.cbj.peerlink.transport.platform.PlatformConnectionState;
import org.cbj.peerlink.transport.platform.PlatformStats;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
public class PeerTransportManager {

    private final PeerPlatform platform;
    private final TransportConfig defaultConfig;
    private final Map<String, ManagedTransport> transports = new ConcurrentHashMap<>();
    private final List<PeerTransportListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService statsExecutor;
    private volatile boolean destroyed = false;

    public PeerTransportManager(PeerPlatform platform, TransportConfig defaultConfig, Duration statsInterval) {
        this.platform = platform;
        this.defaultConfig = defaultConfig;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("peer-transport-stats-");
        threadFactory.setDaemon(true);
        this.statsExecutor = Executors.newSingleThreadScheduledExecutor(threadFactory);
        long periodMs = statsInterval.toMillis();
        statsExecutor.scheduleWithFixedDelay(this::pollStatistics, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public void addListener(PeerTransportListener listener) {
        listeners.add(listener);
    }

    public void removeListener(PeerTransportListener listener) {
        listeners.remove(listener);
    }

    public String createConnection(String deviceId) {
        return createConnection(deviceId, null, List.of());
    }

    public String createConnection(String deviceId, TransportConfig config, List<ChannelSpec> channels) {
        if (destroyed) {
            throw new PeerLinkException(ErrorCode.TRANSPORT_CREATE_FAILED, Map.of("deviceId", deviceId, "reason", "destroyed"));
        }
        TransportConfig effective = config != null ? config : defaultConfig;
        ManagedTransport transport = new ManagedTransport(UUID.randomUUID().toString(), deviceId);
        try {
            transport.connection = platform.createConnection(effective, new TransportObserver(transport));
        } catch (Exception e) {
            log.error("Failed to create peer transport for device {}", deviceId, e);
            throw new PeerLinkException(ErrorCode.TRANSPORT_CREATE_FAILED, Map.of("deviceId", deviceId), e);
        }
        transports.put(transport.id, transport);

        if (channels != null) {
            for (ChannelSpec spec : channels) {
                try {
                    createChannel(transport.id, spec);
                } catch (PeerLinkException e) {
                    close(transport.id);
                    throw new PeerLinkException(ErrorCode.TRANSPORT_CREATE_FAILED,
                            Map.of("deviceId", deviceId, "channel", String.valueOf(spec.getLabel())), e);
                }
            }
        }

        log.info("Peer transport created: connectionId={}, deviceId={}, iceServers={}",
                transport.id, deviceId, effective.getIceServers().size());
        return transport.id;
    }

    public CompletableFuture<SessionDescription> createOffer(String connectionId) {
        return enqueue(connectionId, ErrorCode.OFFER_CREATE_FAILED, t -> t.connection.createOffer())
                .thenApply(offer -> {
                    log.debug("Offer created: connectionId={}", connectionId);
                    return offer;
                });
    }

    public CompletableFuture<SessionDescription> createAnswer(String connectionId) {
        return enqueue(connectionId, ErrorCode.ANSWER_CREATE_FAILED, t -> t.connection.createAnswer())
                .thenApply(answer -> {
                    log.debug("Answer created: connectionId={}", connectionId);
                    return answer;
                });
    }

    /**
     * Applied after every previously submitted negotiation step of the same connection. Remote candidates
     * submitted earlier are held back until this completes.
     */
    public CompletableFuture<Void> setRemoteDescription(String connectionId, SessionDescription description) {
        return enqueue(connectionId, ErrorCode.REMOTE_DESCRIPTION_FAILED,
                t -> t.connection.setRemoteDescription(description).thenRun(t::onRemoteDescriptionApplied));
    }

    public CompletableFuture<Void> addRemoteCandidate(String connectionId, IceCandidate candidate) {
        return enqueue(connectionId, ErrorCode.ICE_CANDIDATE_FAILED, t -> {
            try {
                t.applyOrBuffer(candidate);
                return CompletableFuture.<Void>completedFuture(null);
            } catch (Exception e) {
                return CompletableFuture.<Void>failedFuture(e);
            }
        });
    }

    public String createChannel(String connectionId, ChannelSpec spec) {
        ManagedTransport transport = require(connectionId);
        String label = spec.getLabel();
        if (label == null || transport.channels.containsKey(label)) {
            throw new PeerLinkException(ErrorCode.CHANNEL_CREATE_FAILED,
                    Map.of("connectionId", connectionId, "label", String.valueOf(label)));
        }
        PlatformChannel channel;
        try {
            channel = transport.connection.createChannel(spec);
        } catch (Exception e) {
            log.error("Failed to create channel {} on {}", label, connectionId, e);
            throw new PeerLinkException(ErrorCode.CHANNEL_CREATE_FAILED,
                    Map.of("connectionId", connectionId, "label", label), e);
        }
        transport.channels.put(label, channel);
        attachChannel(transport, channel, true);
        log.info("Channel created: connectionId={}, label={}, ordered={}", connectionId, label, spec.isOrdered());
        return label;
    }

    public void send(String connectionId, String channelId, byte[] data) {
        ManagedTransport transport = require(connectionId);
        PlatformChannel channel = transport.channels.get(channelId);
        if (channel == null) {
            throw new PeerLinkException(ErrorCode.CHANNEL_NOT_FOUND,
                    Map.of("connectionId", connectionId, "channel", channelId));
        }
        if (!channel.isOpen()) {
            throw new PeerLinkException(ErrorCode.CHANNEL_NOT_OPEN,
                    Map.of("connectionId", connectionId, "channel", channelId));
        }
        try {
            channel.send(data);
        } catch (Exception e) {
            throw new PeerLinkException(ErrorCode.DATA_SEND_FAILED,
                    Map.of("connectionId", connectionId, "channel", channelId), e);
        }
        transport.recordSent(data.length);
        log.trace("Sent {} bytes on {}/{}", data.length, connectionId, channelId);
    }

    /**
     * Closes all channels and then the transport. Unknown ids and repeated calls are ignored.
     */
    public void close(String connectionId) {
        ManagedTransport transport = transports.remove(connectionId);
        if (transport == null) {
            log.debug("Peer transport {} already closed or unknown", connectionId);
            return;
        }
        transport.closed = true;
        List<PlatformChannel> channels = new ArrayList<>(transport.channels.values());
        channels.addAll(transport.duplicateChannels);
        for (PlatformChannel channel : channels) {
            try {
                if (!channel.isClosed()) {
                    channel.close();
                }
            } catch (Exception e) {
                log.debug("Error closing channel {} of {} during cleanup", channel.getLabel(), connectionId, e);
            }
        }
        transport.channels.clear();
        transport.duplicateChannels.clear();
        try {
            transport.connection.close();
        } catch (Exception e) {
            log.debug("Error closing peer transport {} during cleanup", connectionId, e);
        }
        transport.state = ConnectionState.CLOSED;
        log.info("Peer transport closed: connectionId={}, deviceId={}", connectionId, transport.deviceId);
    }

    public Optional<ConnectionState> getState(String connectionId) {
        return Optional.ofNullable(transports.get(connectionId)).map(t -> t.state);
    }

    public Optional<TransportStatistics> getStatistics(String connectionId) {
        return Optional.ofNullable(transports.get(connectionId)).map(ManagedTransport::snapshot);
    }

    public Set<String> getConnectionIds() {
        return Set.copyOf(transports.keySet());
    }

    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        statsExecutor.shutdownNow();
        for (String connectionId : List.copyOf(transports.keySet())) {
            close(connectionId);
        }
        listeners.clear();
        try {
            platform.shutdown();
        } catch (Exception e) {
            log.warn("Peer platform shutdown failed", e);
        }
        log.info("PeerTransportManager destroyed");
    }

    static ConnectionState mapPlatformState(PlatformConnectionState state) {
        switch (state) {
            case NEW:
            case CONNECTING:
                return ConnectionState.CONNECTING;
            case CONNECTED:
                return ConnectionState.CONNECTED;
            case DISCONNECTED:
                return ConnectionState.RECONNECTING;
            case FAILED:
                return ConnectionState.FAILED;
            default:
                return ConnectionState.CLOSED;
        }
    }

    void pollStatistics() {
        for (ManagedTransport transport : transports.values()) {
            if (transport.state != ConnectionState.CONNECTED) {
                continue;
            }
            try {
                transport.connection.getStats().whenComplete((stats, error) -> {
                    if (error != null) {
                        log.debug("Failed to get statistics for {}", transport.id, error);
                    } else {
                        transport.applyStats(stats);
                    }
                });
            } catch (Exception e) {
                log.debug("Failed to get statistics for {}", transport.id, e);
            }
        }
    }

    private ManagedTransport require(String connectionId) {
        ManagedTransport transport = transports.get(connectionId);
        if (transport == null) {
            throw new PeerLinkException(ErrorCode.NO_SUCH_CONNECTION, Map.of("connectionId", connectionId));
        }
        return transport;
    }

    private <T> CompletableFuture<T> enqueue(String connectionId, ErrorCode failure,
                                             Function<ManagedTransport, CompletableFuture<T>> step) {
        ManagedTransport transport = transports.get(connectionId);
        if (transport == null) {
            return CompletableFuture.failedFuture(
                    new PeerLinkException(ErrorCode.NO_SUCH_CONNECTION, Map.of("connectionId", connectionId)));
        }
        return transport.enqueue(() -> step.apply(transport)).handle((result, error) -> {
            if (error == null) {
                return result;
            }
            PeerLinkException known = PeerLinkException.unwrap(error);
            if (known != null && known.is(ErrorCode.NO_SUCH_CONNECTION)) {
                throw known;
            }
            log.error("{} for {}", failure.getDefaultMessage(), connectionId, PeerLinkException.stripCompletion(error));
            throw new PeerLinkException(failure, Map.of("connectionId", connectionId),
                    PeerLinkException.stripCompletion(error));
        });
    }

    // a duplicate only carries inbound traffic, its lifecycle belongs to the registered channel
    private void attachChannel(ManagedTransport transport, PlatformChannel channel, boolean registered) {
        String label = channel.getLabel();
        channel.setObserver(new PlatformChannel.Observer() {
            @Override
            public void onOpen() {
                log.debug("Channel opened: {}/{}", transport.id, label);
                if (registered) {
                    emit(l -> l.onChannelOpened(transport.id, label));
                }
            }

            @Override
            public void onClose() {
                log.debug("Channel closed: {}/{}", transport.id, label);
                if (registered) {
                    emit(l -> l.onChannelClosed(transport.id, label));
                } else {
                    transport.duplicateChannels.remove(channel);
                }
            }

            @Override
            public void onMessage(byte[] data) {
                transport.recordReceived(data.length);
                emit(l -> l.onChannelMessage(transport.id, label, data));
            }

            @Override
            public void onError(Throwable error) {
                log.error("Channel error: {}/{}", transport.id, label, error);
                emit(l -> l.onChannelError(transport.id, label, error));
            }
        });
    }

    private void emit(Consumer<PeerTransportListener> event) {
        for (PeerTransportListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Peer transport listener failed", e);
            }
        }
    }

    private final class TransportObserver implements PlatformConnection.Observer {
        private final ManagedTransport transport;

        private TransportObserver(ManagedTransport transport) {
            this.transport = transport;
        }

        @Override
        public void onStateChange(PlatformConnectionState platformState) {
            if (transport.closed) {
                return;
            }
            ConnectionState state = mapPlatformState(platformState);
            ConnectionState previous;
            synchronized (transport) {
                previous = transport.state;
                if (previous == state) {
                    return;
                }
                transport.state = state;
                if (state == ConnectionState.CONNECTED && transport.connectedAt == null) {
                    transport.connectedAt = Instant.now();
                }
            }
            log.debug("Peer transport state changed: connectionId={}, {} -> {} ({})",
                    transport.id, previous, state, platformState);
            emit(l -> l.onStateChanged(transport.id, state));
        }

        @Override
        public void onIceCandidate(IceCandidate candidate) {
            if (!transport.closed) {
                emit(l -> l.onLocalCandidate(transport.id, candidate));
            }
        }

        @Override
        public void onIceFailed() {
            if (!transport.closed) {
                log.warn("ICE failed: connectionId={}, deviceId={}", transport.id, transport.deviceId);
                emit(l -> l.onIceFailed(transport.id));
            }
        }

        @Override
        public void onRemoteChannel(PlatformChannel channel) {
            if (transport.closed) {
                channel.close();
                return;
            }
            // a local channel with the same label keeps carrying outbound traffic
            boolean registered = transport.channels.putIfAbsent(channel.getLabel(), channel) == null;
            if (!registered) {
                transport.duplicateChannels.add(channel);
            }
            attachChannel(transport, channel, registered);
            log.info("Remote channel received: connectionId={}, label={}", transport.id, channel.getLabel());
            if (registered && channel.isOpen()) {
                emit(l -> l.onChannelOpened(transport.id, channel.getLabel()));
            }
        }
    }

    private static final class ManagedTransport {
        private final String id;
        private final String deviceId;
        private final Map<String, PlatformChannel> channels = new ConcurrentHashMap<>();
        private final List<PlatformChannel> duplicateChannels = new CopyOnWriteArrayList<>();
        private final List<IceCandidate> bufferedCandidates = new ArrayList<>();
        private final Object candidateLock = new Object();
        private PlatformConnection connection;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
        private boolean remoteDescriptionSet = false;
        private volatile boolean closed = false;
        private volatile ConnectionState state = ConnectionState.CONNECTING;
        private Instant connectedAt;
        private TransportStatistics statistics = TransportStatistics.EMPTY;

        private ManagedTransport(String id, String deviceId) {
            this.id = id;
            this.deviceId = deviceId;
        }

        <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> step) {
            CompletableFuture<Void> gate = new CompletableFuture<>();
            CompletableFuture<Void> previous;
            CompletableFuture<T> result;
            synchronized (this) {
                previous = tail;
                result = gate.thenCompose(ignored -> {
                    if (closed) {
                        return CompletableFuture.failedFuture(
                                new PeerLinkException(ErrorCode.NO_SUCH_CONNECTION, Map.of("connectionId", id)));
                    }
                    try {
                        return step.get();
                    } catch (Exception e) {
                        return CompletableFuture.failedFuture(e);
                    }
                });
                tail = result.handle((r, e) -> null);
            }
            // released outside the monitor so steps never call the platform while holding it
            previous.whenComplete((r, e) -> gate.complete(null));
            return result;
        }

        void applyOrBuffer(IceCandidate candidate) throws Exception {
            synchronized (candidateLock) {
                if (!remoteDescriptionSet) {
                    bufferedCandidates.add(candidate);
                    log.debug("Remote candidate buffered until remote description is set: connectionId={}", id);
                    return;
                }
            }
            connection.addIceCandidate(candidate);
        }

        void onRemoteDescriptionApplied() {
            List<IceCandidate> pending;
            synchronized (candidateLock) {
                remoteDescriptionSet = true;
                pending = new ArrayList<>(bufferedCandidates);
                bufferedCandidates.clear();
            }
            for (IceCandidate candidate : pending) {
                try {
                    connection.addIceCandidate(candidate);
                } catch (Exception e) {
                    log.warn("Failed to apply buffered candidate on {}", id, e);
                }
            }
        }

        synchronized void recordSent(int size) {
            statistics = statistics.toBuilder()
                    .bytesSent(statistics.getBytesSent() + size)
                    .packetsSent(statistics.getPacketsSent() + 1)
                    .build();
        }

        synchronized void recordReceived(int size) {
            statistics = statistics.toBuilder()
                    .bytesReceived(statistics.getBytesReceived() + size)
                    .packetsReceived(statistics.getPacketsReceived() + 1)
                    .build();
        }

        synchronized void applyStats(PlatformStats stats) {
            TransportStatistics.TransportStatisticsBuilder next = statistics.toBuilder();
            if (stats.getBytesSent() != null) {
                next.bytesSent(stats.getBytesSent());
            }
            if (stats.getBytesReceived() != null) {
                next.bytesReceived(stats.getBytesReceived());
            }
            if (stats.getPacketsSent() != null) {
                next.packetsSent(stats.getPacketsSent());
            }
            if (stats.getPacketsReceived() != null) {
                next.packetsReceived(stats.getPacketsReceived());
            }
            if (stats.getPacketsLost() != null) {
                next.packetsLost(stats.getPacketsLost());
            }
            if (stats.getRoundTripTimeMs() != null) {
                next.roundTripTimeMs(stats.getRoundTripTimeMs());
            }
            if (stats.getRelayed() != null) {
                next.relayed(stats.getRelayed());
            }
            statistics = next.build();
        }

        synchronized TransportStatistics snapshot() {
            long duration = connectedAt == null ? 0 : Duration.between(connectedAt, Instant.now()).toMillis();
            return statistics.toBuilder().connectionDurationMs(duration).build();
        }
    }
}
