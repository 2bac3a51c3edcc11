package org.cbj.peerlink.transport.platform;

import org.cbj.peerlink.transport.ChannelSpec;
import org.cbj.peerlink.transport.IceCandidate;
import org.cbj.peerlink.transport.SessionDescription;
import org.cbj.peerlink.transport.TransportConfig;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Loopback platform. Platforms sharing one {@link Network} find each other through the descriptors they
 * exchange: every description carries the key of the connection that produced it. Callbacks are delivered
 * on the network's single event thread, like a native stack would.
 */
public class FakePeerPlatform implements PeerPlatform {

    private static final String SDP_PREFIX = "fake:";

    private final Network network;
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private volatile boolean failCreate;
    private volatile boolean failOffers;
    private volatile boolean shutdown;

    public FakePeerPlatform(Network network) {
        this.network = network;
    }

    @Override
    public PlatformConnection createConnection(TransportConfig config, PlatformConnection.Observer observer) {
        if (failCreate) {
            throw new IllegalStateException("platform rejected configuration");
        }
        FakeConnection connection = new FakeConnection(this, config, observer);
        connections.add(connection);
        network.connections.put(connection.key, connection);
        return connection;
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public void setFailCreate(boolean failCreate) {
        this.failCreate = failCreate;
    }

    public void setFailOffers(boolean failOffers) {
        this.failOffers = failOffers;
    }

    public List<FakeConnection> getConnections() {
        return new ArrayList<>(connections);
    }

    public FakeConnection lastConnection() {
        return connections.isEmpty() ? null : connections.get(connections.size() - 1);
    }

    public static class Network {
        private final Map<String, FakeConnection> connections = new ConcurrentHashMap<>();
        private final ExecutorService events;
        private volatile boolean blocked;

        public Network() {
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("fake-network-");
            threadFactory.setDaemon(true);
            this.events = Executors.newSingleThreadExecutor(threadFactory);
        }

        /**
         * While blocked, negotiations complete but no transport reaches the connected state.
         */
        public void setBlocked(boolean blocked) {
            this.blocked = blocked;
        }

        public void shutdown() {
            events.shutdownNow();
        }

        void dispatch(Runnable task) {
            if (!events.isShutdown()) {
                events.execute(task);
            }
        }

        FakeConnection lookup(SessionDescription description) {
            if (description == null || description.getSdp() == null || !description.getSdp().startsWith(SDP_PREFIX)) {
                return null;
            }
            return connections.get(description.getSdp().substring(SDP_PREFIX.length()));
        }

        void link(FakeConnection offerer, FakeConnection answerer) {
            if (blocked) {
                return;
            }
            dispatch(() -> {
                if (offerer.closed || answerer.closed) {
                    return;
                }
                List<FakeChannel> toOpen = new ArrayList<>();
                List<FakeChannel> remote = new ArrayList<>();
                pairChannels(offerer, answerer, toOpen, remote);
                pairChannels(answerer, offerer, toOpen, remote);
                offerer.emitState(PlatformConnectionState.CONNECTED);
                answerer.emitState(PlatformConnectionState.CONNECTED);
                for (FakeChannel channel : toOpen) {
                    channel.open();
                }
                for (FakeChannel channel : remote) {
                    channel.owner.observer.onRemoteChannel(channel);
                }
            });
        }

        private static void pairChannels(FakeConnection from, FakeConnection to,
                                         List<FakeChannel> toOpen, List<FakeChannel> remote) {
            for (FakeChannel local : from.channels.values()) {
                if (local.peer != null) {
                    continue;
                }
                FakeChannel counterpart = to.channels.get(local.label);
                if (counterpart == null) {
                    counterpart = new FakeChannel(to, local.label);
                    counterpart.opened = true;
                    to.channels.put(local.label, counterpart);
                    remote.add(counterpart);
                } else {
                    toOpen.add(counterpart);
                }
                local.peer = counterpart;
                counterpart.peer = local;
                toOpen.add(local);
            }
        }
    }

    public static class FakeConnection implements PlatformConnection {
        private final String key = UUID.randomUUID().toString();
        private final FakePeerPlatform platform;
        private final TransportConfig config;
        private final Observer observer;
        private final Map<String, FakeChannel> channels = new ConcurrentHashMap<>();
        private final List<IceCandidate> appliedCandidates = new CopyOnWriteArrayList<>();
        private final AtomicLong bytesSent = new AtomicLong();
        private final AtomicLong bytesReceived = new AtomicLong();
        private volatile SessionDescription localDescription;
        private volatile SessionDescription remoteDescription;
        private volatile boolean closed;
        private volatile boolean gathered;

        FakeConnection(FakePeerPlatform platform, TransportConfig config, Observer observer) {
            this.platform = platform;
            this.config = config;
            this.observer = observer;
        }

        @Override
        public CompletableFuture<SessionDescription> createOffer() {
            if (platform.failOffers) {
                return CompletableFuture.failedFuture(new IllegalStateException("offer rejected"));
            }
            localDescription = SessionDescription.offer(SDP_PREFIX + key);
            gatherCandidate();
            return CompletableFuture.completedFuture(localDescription);
        }

        @Override
        public CompletableFuture<SessionDescription> createAnswer() {
            if (remoteDescription == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("no remote offer"));
            }
            localDescription = SessionDescription.answer(SDP_PREFIX + key);
            gatherCandidate();
            return CompletableFuture.completedFuture(localDescription);
        }

        @Override
        public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
            FakeConnection remote = platform.network.lookup(description);
            if (remote == null) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("unknown session description"));
            }
            remoteDescription = description;
            if (SessionDescription.ANSWER.equals(description.getType())) {
                platform.network.link(this, remote);
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void addIceCandidate(IceCandidate candidate) {
            if (remoteDescription == null) {
                throw new IllegalStateException("remote description not set");
            }
            appliedCandidates.add(candidate);
        }

        @Override
        public PlatformChannel createChannel(ChannelSpec spec) {
            if (closed) {
                throw new IllegalStateException("connection closed");
            }
            FakeChannel channel = new FakeChannel(this, spec.getLabel());
            channels.put(spec.getLabel(), channel);
            return channel;
        }

        @Override
        public CompletableFuture<PlatformStats> getStats() {
            return CompletableFuture.completedFuture(PlatformStats.builder()
                    .bytesSent(bytesSent.get())
                    .bytesReceived(bytesReceived.get())
                    .roundTripTimeMs(12.0)
                    .relayed(false)
                    .build());
        }

        @Override
        public void close() {
            closed = true;
            for (FakeChannel channel : channels.values()) {
                channel.closed = true;
                channel.opened = false;
            }
        }

        /**
         * Simulates a network drop on this side.
         */
        public void drop() {
            platform.network.dispatch(() -> emitState(PlatformConnectionState.DISCONNECTED));
        }

        public void fail() {
            platform.network.dispatch(() -> {
                observer.onIceFailed();
                emitState(PlatformConnectionState.FAILED);
            });
        }

        public boolean isClosed() {
            return closed;
        }

        public TransportConfig getConfig() {
            return config;
        }

        public List<IceCandidate> getAppliedCandidates() {
            return new ArrayList<>(appliedCandidates);
        }

        public SessionDescription getRemoteDescription() {
            return remoteDescription;
        }

        public FakeChannel channel(String label) {
            return channels.get(label);
        }

        void emitState(PlatformConnectionState state) {
            if (!closed) {
                observer.onStateChange(state);
            }
        }

        private void gatherCandidate() {
            IceCandidate candidate = new IceCandidate("0", 0, "candidate:1 1 udp 2122260223 10.0.0.1 5000 typ host " + key);
            // renegotiation keeps the current state
            boolean first = !gathered;
            gathered = true;
            platform.network.dispatch(() -> {
                if (first) {
                    emitState(PlatformConnectionState.CONNECTING);
                }
                if (!closed) {
                    observer.onIceCandidate(candidate);
                }
            });
        }
    }

    public static class FakeChannel implements PlatformChannel {
        private final FakeConnection owner;
        private final String label;
        private volatile Observer observer;
        private volatile FakeChannel peer;
        private volatile boolean opened;
        private volatile boolean closed;

        FakeChannel(FakeConnection owner, String label) {
            this.owner = owner;
            this.label = label;
        }

        @Override
        public String getLabel() {
            return label;
        }

        @Override
        public boolean isOpen() {
            return opened && !closed;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }

        @Override
        public void setObserver(Observer observer) {
            this.observer = observer;
        }

        @Override
        public void send(byte[] data) {
            if (!isOpen()) {
                throw new IllegalStateException("channel " + label + " is not open");
            }
            owner.bytesSent.addAndGet(data.length);
            FakeChannel target = peer;
            if (target != null) {
                owner.platform.network.dispatch(() -> target.deliver(data));
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            opened = false;
            Observer current = observer;
            if (current != null) {
                current.onClose();
            }
        }

        void open() {
            if (closed) {
                return;
            }
            opened = true;
            Observer current = observer;
            if (current != null) {
                current.onOpen();
            }
        }

        private void deliver(byte[] data) {
            if (closed || owner.closed) {
                return;
            }
            owner.bytesReceived.addAndGet(data.length);
            Observer current = observer;
            if (current != null) {
                current.onMessage(data);
            }
        }
    }
}
