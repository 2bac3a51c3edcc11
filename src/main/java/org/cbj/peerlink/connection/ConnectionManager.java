package org.cbj.peerlink.connection;

import org.cbj.peerlink.config.ConnectionProperties;
import org.cbj.peerlink.connection.dto.ConnectionInfo;
import org.cbj.peerlink.connection.dto.ConnectionOptions;
import org.cbj.peerlink.connection.dto.ConnectionQuality;
import org.cbj.peerlink.error.ErrorCode;
import org.cbj.peerlink.error.PeerLinkException;
import org.cbj.peerlink.network.NetworkOptimizer;
import org.cbj.peerlink.network.NetworkOptimizerListener;
import org.cbj.peerlink.network.dto.NetworkConditions;
import org.cbj.peerlink.signal.client.SignalingClient;
import org.cbj.peerlink.signal.client.SignalingListener;
import org.cbj.peerlink.signal.dto.CandidatePayload;
import org.cbj.peerlink.signal.dto.ConnectionRequest;
import org.cbj.peerlink.signal.dto.ConnectionResponse;
import org.cbj.peerlink.signal.dto.DiscoveryResult;
import org.cbj.peerlink.signal.dto.HandshakeOptions;
import org.cbj.peerlink.transport.ConnectionState;
import org.cbj.peerlink.transport.IceCandidate;
import org.cbj.peerlink.transport.PeerTransportListener;
import org.cbj.peerlink.transport.PeerTransportManager;
import org.cbj.peerlink.transport.SessionDescription;
import org.cbj.peerlink.transport.TransportStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * All table mutations, timers and reactions to component events run on a single control thread.
 */
public class ConnectionManager {

    private final Logger log;
    private final PeerTransportManager transports;
    private final SignalingClient signaling;
    private final NetworkOptimizer optimizer;
    private final ConnectionProperties properties;
    private final ScheduledThreadPoolExecutor loop;
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final Map<String, CompletableFuture<ConnectionInfo>> initiating = new HashMap<>();
    private final List<ConnectionEventListener> listeners = new CopyOnWriteArrayList<>();

    private final PeerTransportListener transportEvents = new TransportEvents();
    private final SignalingListener signalingEvents = new SignalingEvents();
    private final NetworkOptimizerListener optimizerEvents = new OptimizerEvents();

    private volatile Thread loopThread;
    private volatile boolean destroyed = false;
    private ScheduledFuture<?> heartbeatTask;

    public ConnectionManager(PeerTransportManager transports, SignalingClient signaling,
                             NetworkOptimizer optimizer, ConnectionProperties properties) {
        this(transports, signaling, optimizer, properties, LoggerFactory.getLogger(ConnectionManager.class));
    }

    public ConnectionManager(PeerTransportManager transports, SignalingClient signaling,
                             NetworkOptimizer optimizer, ConnectionProperties properties, Logger log) {
        this.log = log;
        this.transports = transports;
        this.signaling = signaling;
        this.optimizer = optimizer;
        this.properties = properties;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("connection-manager-") {
            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = super.newThread(runnable);
                loopThread = thread;
                return thread;
            }
        };
        threadFactory.setDaemon(true);
        this.loop = new ScheduledThreadPoolExecutor(1, threadFactory);
        loop.setRemoveOnCancelPolicy(true);

        transports.addListener(transportEvents);
        signaling.addListener(signalingEvents);
        optimizer.addListener(optimizerEvents);
    }

    public void addListener(ConnectionEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionEventListener listener) {
        listeners.remove(listener);
    }

    public void start() {
        if (destroyed) {
            throw new PeerLinkException(ErrorCode.MANAGER_DESTROYED);
        }
        post(() -> {
            if (heartbeatTask != null) {
                return;
            }
            long intervalMs = properties.getHeartbeatInterval().toMillis();
            heartbeatTask = loop.scheduleWithFixedDelay(guarded(this::sweepStaleConnections),
                    intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            optimizer.start();
            log.info("ConnectionManager initialized: device={}", signaling.getDeviceId());
            emit(ConnectionEventListener::onInitialized);
        });
    }

    public CompletableFuture<ConnectionInfo> initiate(String deviceId) {
        return initiate(deviceId, ConnectionOptions.defaults());
    }

    /**
     * Connects to the device, or returns the existing connection if there is a live one. Concurrent calls
     * for the same device share one attempt. Failures surface as {@link ErrorCode#CONNECTION_INIT_FAILED};
     * the record is left in {@link ConnectionState#FAILED} for inspection.
     */
    public CompletableFuture<ConnectionInfo> initiate(String deviceId, ConnectionOptions options) {
        return callOnLoop(() -> initiateOnLoop(deviceId, options));
    }

    public CompletableFuture<Void> close(String connectionId) {
        return close(connectionId, "closed by user");
    }

    /**
     * Notifies the peer, closes the transport and marks the connection closed. The record is dropped
     * from the table after a short grace period. Unknown or already closed ids are ignored.
     */
    public CompletableFuture<Void> close(String connectionId, String reason) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        boolean posted = post(() -> {
            try {
                ConnectionRecord record = registry.get(connectionId);
                if (record == null) {
                    log.debug("Close ignored, unknown connection {}", connectionId);
                } else {
                    closeRecord(record, reason, true);
                }
            } finally {
                done.complete(null);
            }
        });
        if (!posted) {
            done.complete(null);
        }
        return done;
    }

    public CompletableFuture<List<DiscoveryResult>> discoverDevices(long timeoutMs) {
        return ensureSignaling()
                .thenCompose(ignored -> signaling.discoverDevices(timeoutMs))
                .exceptionally(error -> {
                    log.warn("{}: signaling unavailable", ErrorCode.DISCOVERY_FAILED.getDefaultMessage(),
                            PeerLinkException.stripCompletion(error));
                    return List.of();
                })
                .thenApply(devices -> {
                    log.info("Device discovery completed: {} device(s)", devices.size());
                    post(() -> emit(l -> l.onDevicesDiscovered(devices)));
                    return devices;
                });
    }

    public void send(String deviceId, String channelLabel, byte[] data) {
        ConnectionRecord record = registry.findByDevice(deviceId);
        if (record == null || record.getState() == ConnectionState.CLOSED) {
            throw new PeerLinkException(ErrorCode.CONNECTION_NOT_FOUND, Map.of("deviceId", deviceId));
        }
        if (record.getState() != ConnectionState.CONNECTED || record.getTransportId() == null) {
            throw new PeerLinkException(ErrorCode.CONNECTION_NOT_READY,
                    Map.of("deviceId", deviceId, "state", record.getState().name()));
        }
        transports.send(record.getTransportId(), channelLabel, data);
        post(record::touch);
    }

    public CompletableFuture<Void> renegotiate(String connectionId) {
        return callOnLoop(() -> {
            ConnectionRecord record = requireLive(connectionId);
            String transportId = record.getTransportId();
            return transports.createOffer(transportId)
                    .thenAcceptAsync(offer -> {
                        if (record.isTransport(transportId)) {
                            signaling.sendOffer(record.getDeviceId(), offer);
                        }
                    }, loop);
        });
    }

    public CompletableFuture<ConnectionQuality> refreshQuality(String connectionId) {
        return callOnLoop(() -> {
            ConnectionRecord record = registry.get(connectionId);
            if (record == null) {
                throw new PeerLinkException(ErrorCode.CONNECTION_NOT_FOUND, Map.of("connectionId", connectionId));
            }
            return optimizer.measureConditionsAsync().thenApplyAsync(conditions -> {
                optimizer.adaptQuality(conditions);
                ConnectionQuality quality = ConnectionQuality.from(conditions);
                if (registry.contains(record)) {
                    applyQuality(record, quality);
                }
                return quality;
            }, loop);
        });
    }

    public Optional<ConnectionInfo> getConnection(String connectionId) {
        return Optional.ofNullable(registry.get(connectionId)).map(this::snapshot);
    }

    public Optional<ConnectionInfo> getConnectionByDeviceId(String deviceId) {
        return Optional.ofNullable(registry.findByDevice(deviceId)).map(this::snapshot);
    }

    public List<ConnectionInfo> getAllConnections() {
        return registry.all().stream().map(this::snapshot).collect(Collectors.toList());
    }

    public List<ConnectionInfo> getConnectionsByState(ConnectionState state) {
        return registry.inState(state).stream().map(this::snapshot).collect(Collectors.toList());
    }

    public Optional<TransportStatistics> getConnectionStatistics(String connectionId) {
        ConnectionRecord record = registry.get(connectionId);
        if (record == null || record.getTransportId() == null) {
            return Optional.empty();
        }
        return transports.getStatistics(record.getTransportId());
    }

    /**
     * Closes every connection and tears down the optimizer, the signaling client and the transport
     * manager, in that order. Never throws.
     */
    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        log.info("Destroying ConnectionManager");
        if (Thread.currentThread() == loopThread) {
            shutdownOnLoop();
        } else {
            CompletableFuture<Void> drained = new CompletableFuture<>();
            try {
                loop.execute(() -> {
                    try {
                        shutdownOnLoop();
                    } finally {
                        drained.complete(null);
                    }
                });
                drained.get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing connections", e);
            } catch (Exception e) {
                log.warn("Failed to close connections during shutdown", e);
            }
        }
        loop.shutdownNow();

        transports.removeListener(transportEvents);
        signaling.removeListener(signalingEvents);
        optimizer.removeListener(optimizerEvents);
        destroyQuietly("network optimizer", optimizer::destroy);
        destroyQuietly("signaling client", signaling::destroy);
        destroyQuietly("peer transport manager", transports::destroy);
        listeners.clear();
        log.info("ConnectionManager destroyed");
    }

    // ---- control loop ----

    private CompletableFuture<ConnectionInfo> initiateOnLoop(String deviceId, ConnectionOptions options) {
        CompletableFuture<ConnectionInfo> pending = initiating.get(deviceId);
        if (pending != null) {
            log.debug("Joining in-flight connection attempt to {}", deviceId);
            return pending;
        }
        ConnectionRecord existing = registry.findByDevice(deviceId);
        if (existing != null) {
            ConnectionState state = existing.getState();
            if (state == ConnectionState.CONNECTED) {
                log.info("Connection to {} already established: {}", deviceId, existing.getId());
                return CompletableFuture.completedFuture(snapshot(existing));
            }
            if (state == ConnectionState.CONNECTING || state == ConnectionState.RECONNECTING) {
                log.info("Connection to {} already in progress: {} ({})", deviceId, existing.getId(), state);
                return CompletableFuture.completedFuture(snapshot(existing));
            }
            discard(existing);
        }

        ConnectionRecord record = new ConnectionRecord(UUID.randomUUID().toString(), deviceId, options);
        registry.register(record);
        CompletableFuture<ConnectionInfo> result = new CompletableFuture<>();
        initiating.put(deviceId, result);
        log.info("Initiating connection to {}: connectionId={}", deviceId, record.getId());

        ensureSignaling()
                .thenComposeAsync(ignored -> handshake(record, false), loop)
                .whenCompleteAsync((ignored, error) -> {
                    initiating.remove(deviceId, result);
                    finishInitiate(record, result, error);
                }, loop);
        return result;
    }

    private void finishInitiate(ConnectionRecord record, CompletableFuture<ConnectionInfo> result, Throwable error) {
        Throwable cause = error != null ? PeerLinkException.stripCompletion(error) : null;
        if (cause instanceof StaleAttemptException && record.getState() != ConnectionState.CLOSED
                && registry.contains(record)) {
            log.debug("Initiate for {} superseded by a remote handshake", record.getDeviceId());
            result.complete(snapshot(record));
            return;
        }
        if (cause == null) {
            result.complete(snapshot(record));
            return;
        }
        if (cause instanceof StaleAttemptException) {
            cause = new PeerLinkException(ErrorCode.CONNECTION_NOT_FOUND, "Connection closed during handshake",
                    Map.of("connectionId", record.getId()), null);
        }
        log.error("Failed to initiate connection to {}", record.getDeviceId(), cause);
        if (registry.contains(record)) {
            failConnection(record, cause);
        }
        result.completeExceptionally(new PeerLinkException(ErrorCode.CONNECTION_INIT_FAILED,
                Map.of("deviceId", record.getDeviceId(), "connectionId", record.getId()), cause));
    }

    // completes once the remote answer is applied
    private CompletableFuture<Void> handshake(ConnectionRecord record, boolean reconnect) {
        if (!registry.contains(record) || record.getState() == ConnectionState.CLOSED) {
            throw new StaleAttemptException(null);
        }
        String transportId = transports.createConnection(record.getDeviceId(),
                record.getOptions().getTransportConfig(), record.channels(properties));
        ConnectionRequest draft = signaling.buildRequest(record.getDeviceId(), null);
        record.beginAttempt(transportId, draft.getRequestId());

        return transports.createOffer(transportId)
                .thenComposeAsync(offer -> {
                    if (!isCurrent(record, transportId)) {
                        throw new StaleAttemptException(transportId);
                    }
                    ConnectionRequest request = new ConnectionRequest(draft.getRequestId(), draft.getFrom(),
                            draft.getTo(), new HandshakeOptions(offer, reconnect), draft.getTimestamp());
                    record.awaitingAnswer = true;
                    CompletableFuture<ConnectionResponse> response = signaling.requestConnection(request);
                    releaseLocalCandidates(record);
                    return response;
                }, loop)
                .thenComposeAsync(response -> {
                    if (!isCurrent(record, transportId)) {
                        throw new StaleAttemptException(transportId);
                    }
                    record.awaitingAnswer = false;
                    SessionDescription answer = response.getAnswer();
                    if (answer == null) {
                        throw new PeerLinkException(ErrorCode.REMOTE_DESCRIPTION_FAILED, "Response carried no answer",
                                Map.of("requestId", response.getRequestId()), null);
                    }
                    return transports.setRemoteDescription(transportId, answer);
                }, loop)
                .handleAsync((ignored, error) -> {
                    if (!isCurrent(record, transportId)) {
                        throw new StaleAttemptException(transportId);
                    }
                    record.awaitingAnswer = false;
                    if (error != null) {
                        throw new CompletionException(PeerLinkException.stripCompletion(error));
                    }
                    watchEstablishment(record, transportId);
                    return null;
                }, loop);
    }

    private void acceptIncoming(ConnectionRequest request) {
        String deviceId = request.getFrom();
        log.info("Incoming connection request from {}: requestId={}", deviceId, request.getRequestId());
        emit(l -> l.onIncoming(request));

        HandshakeOptions handshake = request.getOptions();
        if (deviceId == null || handshake == null || handshake.getOffer() == null) {
            log.warn("Rejecting connection request {} without offer", request.getRequestId());
            signaling.respondToConnection(request, false, "missing offer", null);
            return;
        }

        ConnectionRecord record = registry.findByDevice(deviceId);
        if (record != null && record.awaitingAnswer && isLive(record)
                && signaling.getDeviceId().compareTo(deviceId) < 0) {
            log.info("Simultaneous connection attempt with {}, keeping local request", deviceId);
            signaling.respondToConnection(request, false, "glare", null);
            return;
        }

        if (record == null || !isLive(record)) {
            if (record != null) {
                discard(record);
            }
            record = new ConnectionRecord(UUID.randomUUID().toString(), deviceId, ConnectionOptions.defaults());
            registry.register(record);
        } else {
            log.info("Replacing transport of {} for remote handshake (reconnect={})", record.getId(),
                    handshake.isReconnect());
            record.cancelReconnectTimer();
            if (record.getState() == ConnectionState.CONNECTED) {
                transition(record, ConnectionState.RECONNECTING);
            }
            closeTransportQuietly(record.getTransportId());
            record.detachTransport();
        }

        ConnectionRecord target = record;
        String transportId;
        try {
            transportId = transports.createConnection(deviceId, target.getOptions().getTransportConfig(),
                    target.channels(properties));
        } catch (PeerLinkException e) {
            log.error("Failed to accept connection from {}", deviceId, e);
            signaling.respondToConnection(request, false, e.getMessage(), null);
            attemptFailed(target, null, e);
            return;
        }
        target.beginAttempt(transportId, request.getRequestId());

        transports.setRemoteDescription(transportId, handshake.getOffer())
                .thenCompose(ignored -> transports.createAnswer(transportId))
                .whenCompleteAsync((answer, error) -> {
                    if (!isCurrent(target, transportId)) {
                        log.debug("Dropping answer for superseded transport {}", transportId);
                        return;
                    }
                    if (error != null) {
                        Throwable cause = PeerLinkException.stripCompletion(error);
                        log.error("Failed to answer connection request {} from {}",
                                request.getRequestId(), deviceId, cause);
                        signaling.respondToConnection(request, false, String.valueOf(cause.getMessage()), null);
                        attemptFailed(target, transportId, cause);
                        return;
                    }
                    signaling.respondToConnection(request, true, null, answer);
                    releaseLocalCandidates(target);
                    watchEstablishment(target, transportId);
                }, loop);
    }

    private void onTransportState(String transportId, ConnectionState transportState) {
        ConnectionRecord record = registry.findByTransport(transportId);
        if (record == null) {
            log.debug("Ignoring {} from superseded transport {}", transportState, transportId);
            return;
        }
        switch (transportState) {
            case CONNECTED:
                if (record.getState() == ConnectionState.CONNECTING || record.getState() == ConnectionState.RECONNECTING) {
                    boolean recovered = record.getState() == ConnectionState.RECONNECTING;
                    record.cancelWatchdog();
                    record.cancelReconnectTimer();
                    record.resetReconnectAttempts();
                    record.touch();
                    NetworkConditions conditions = optimizer.getLastConditions();
                    if (conditions != null) {
                        record.setQuality(ConnectionQuality.from(conditions));
                    }
                    transition(record, ConnectionState.CONNECTED);
                    ConnectionInfo info = snapshot(record);
                    if (recovered) {
                        log.info("Connection {} to {} re-established", record.getId(), record.getDeviceId());
                        emit(l -> l.onReconnected(info));
                    } else {
                        log.info("Connection {} to {} established", record.getId(), record.getDeviceId());
                        emit(l -> l.onEstablished(info));
                    }
                }
                break;
            case RECONNECTING:
            case CLOSED:
                if (record.getState() == ConnectionState.CONNECTED) {
                    handleConnectionLoss(record, "transport " + transportState.name().toLowerCase());
                }
                break;
            case FAILED:
                if (record.getState() == ConnectionState.CONNECTED) {
                    handleConnectionLoss(record, "transport failed");
                } else {
                    attemptFailed(record, transportId,
                            new PeerLinkException(ErrorCode.CONNECTION_FAILED, "Peer transport failed",
                                    Map.of("connectionId", record.getId()), null));
                }
                break;
            default:
                break;
        }
    }

    void handleConnectionLoss(ConnectionRecord record, String reason) {
        if (record.getState() != ConnectionState.CONNECTED) {
            return;
        }
        log.warn("Connection {} to {} lost: {}", record.getId(), record.getDeviceId(), reason);
        transition(record, ConnectionState.RECONNECTING);
        ConnectionInfo info = snapshot(record);
        emit(l -> l.onLost(info));
        if (!record.getOptions().isEnableReconnect()) {
            failConnection(record, new PeerLinkException(ErrorCode.CONNECTION_FAILED, "Connection lost",
                    Map.of("connectionId", record.getId(), "reason", reason), null));
            return;
        }
        scheduleReconnect(record);
    }

    private void scheduleReconnect(ConnectionRecord record) {
        if (record.reconnectTimer != null) {
            return;
        }
        int max = record.maxReconnectAttempts(properties);
        if (record.getReconnectAttempts() >= max) {
            log.error("Max reconnection attempts ({}) reached for {}", max, record.getId());
            failConnection(record, new PeerLinkException(ErrorCode.CONNECTION_FAILED, "Max reconnection attempts reached",
                    Map.of("connectionId", record.getId(), "attempts", max), null));
            return;
        }
        int attempt = record.nextReconnectAttempt();
        long delayMs = record.reconnectDelay(properties).toMillis() * attempt;
        log.info("Reconnecting {} in {} ms (attempt {}/{})", record.getId(), delayMs, attempt, max);
        record.reconnectTimer = loop.schedule(guarded(() -> runReconnect(record, attempt)), delayMs, TimeUnit.MILLISECONDS);
    }

    private void runReconnect(ConnectionRecord record, int attempt) {
        record.reconnectTimer = null;
        if (!registry.contains(record) || record.getState() != ConnectionState.RECONNECTING) {
            return;
        }
        log.info("Reconnection attempt {} for {} to {}", attempt, record.getId(), record.getDeviceId());
        closeTransportQuietly(record.getTransportId());
        record.detachTransport();

        ensureSignaling()
                .thenComposeAsync(ignored -> handshake(record, true), loop)
                .whenCompleteAsync((ignored, error) -> {
                    if (error == null) {
                        return;
                    }
                    Throwable cause = PeerLinkException.stripCompletion(error);
                    if (cause instanceof StaleAttemptException) {
                        log.debug("Reconnection attempt {} for {} superseded", attempt, record.getId());
                        return;
                    }
                    log.warn("Reconnection attempt {} for {} failed: {}", attempt, record.getId(), cause.toString());
                    attemptFailed(record, record.getTransportId(), cause);
                }, loop);
    }

    // a fresh connection fails, a reconnecting one moves on to the next attempt
    private void attemptFailed(ConnectionRecord record, String transportId, Throwable cause) {
        if (!registry.contains(record) || (transportId != null && !record.isTransport(transportId))) {
            return;
        }
        if (record.getState() == ConnectionState.CONNECTING) {
            failConnection(record, cause);
        } else if (record.getState() == ConnectionState.RECONNECTING) {
            closeTransportQuietly(record.getTransportId());
            record.detachTransport();
            scheduleReconnect(record);
        }
    }

    private void watchEstablishment(ConnectionRecord record, String transportId) {
        if (record.getState() == ConnectionState.CONNECTED) {
            return;
        }
        record.cancelWatchdog();
        long timeoutMs = record.connectionTimeout(properties).toMillis();
        record.establishWatchdog = loop.schedule(guarded(() -> {
            record.establishWatchdog = null;
            if (!isCurrent(record, transportId) || record.getState() == ConnectionState.CONNECTED) {
                return;
            }
            log.warn("Connection {} not established within {} ms", record.getId(), timeoutMs);
            attemptFailed(record, transportId, new PeerLinkException(ErrorCode.CONNECTION_FAILED,
                    "Peer transport not established in time", Map.of("connectionId", record.getId()), null));
        }), timeoutMs, TimeUnit.MILLISECONDS);
    }

    private void failConnection(ConnectionRecord record, Throwable cause) {
        if (record.getState() == ConnectionState.FAILED || record.getState() == ConnectionState.CLOSED) {
            return;
        }
        record.cancelReconnectTimer();
        closeTransportQuietly(record.getTransportId());
        record.detachTransport();
        record.setFailureReason(String.valueOf(cause.getMessage()));
        transition(record, ConnectionState.FAILED);
        ConnectionInfo info = snapshot(record);
        log.error("Connection {} to {} failed: {}", record.getId(), record.getDeviceId(), cause.getMessage());
        emit(l -> l.onFailed(info, cause));
    }

    private void closeRecord(ConnectionRecord record, String reason, boolean notifyPeer) {
        if (record.getState() == ConnectionState.CLOSED) {
            log.debug("Connection {} already closed", record.getId());
            return;
        }
        log.info("Closing connection {} to {}: {}", record.getId(), record.getDeviceId(), reason);
        if (notifyPeer) {
            try {
                signaling.closeConnection(record.getDeviceId(), reason);
            } catch (Exception e) {
                log.warn("Failed to notify {} about close", record.getDeviceId(), e);
            }
        }
        record.cancelReconnectTimer();
        closeTransportQuietly(record.getTransportId());
        record.detachTransport();
        transition(record, ConnectionState.CLOSED);
        ConnectionInfo info = snapshot(record);
        emit(l -> l.onClosed(info, reason));

        long graceMs = properties.getCloseGrace().toMillis();
        loop.schedule(guarded(() -> registry.remove(record)), graceMs, TimeUnit.MILLISECONDS);
    }

    // drops a failed or closed record that is being replaced
    private void discard(ConnectionRecord record) {
        record.cancelReconnectTimer();
        closeTransportQuietly(record.getTransportId());
        record.detachTransport();
        registry.remove(record);
    }

    void sweepStaleConnections() {
        Instant now = Instant.now();
        Duration timeout = properties.getHeartbeatTimeout();
        for (ConnectionRecord record : registry.inState(ConnectionState.CONNECTED)) {
            if (record.getTransportId() == null) {
                continue;
            }
            transports.getStatistics(record.getTransportId()).ifPresent(stats -> {
                if (stats.getBytesReceived() > record.lastBytesReceived) {
                    record.lastBytesReceived = stats.getBytesReceived();
                    record.touch();
                }
            });
            if (Duration.between(record.getLastActivity(), now).compareTo(timeout) > 0) {
                log.warn("Connection timeout detected: {} idle since {}", record.getId(), record.getLastActivity());
                handleConnectionLoss(record, "heartbeat timeout");
            }
        }
    }

    private void releaseLocalCandidates(ConnectionRecord record) {
        record.signalingReady = true;
        List<IceCandidate> buffered = new ArrayList<>(record.pendingLocalCandidates);
        record.pendingLocalCandidates.clear();
        for (IceCandidate candidate : buffered) {
            signaling.sendIceCandidate(record.getDeviceId(), record.getSessionId(), candidate);
        }
    }

    private void onLocalCandidate(String transportId, IceCandidate candidate) {
        ConnectionRecord record = registry.findByTransport(transportId);
        if (record == null) {
            return;
        }
        if (record.signalingReady) {
            signaling.sendIceCandidate(record.getDeviceId(), record.getSessionId(), candidate);
        } else {
            record.pendingLocalCandidates.add(candidate);
        }
    }

    private void onRemoteCandidate(String from, CandidatePayload payload) {
        ConnectionRecord record = registry.findByDevice(from);
        if (record == null || record.getTransportId() == null || payload == null || payload.getCandidate() == null) {
            log.debug("Dropping candidate from {} without a live transport", from);
            return;
        }
        if (payload.getSessionId() != null && !payload.getSessionId().equals(record.getSessionId())) {
            log.debug("Dropping candidate from {} for old session {}", from, payload.getSessionId());
            return;
        }
        String transportId = record.getTransportId();
        transports.addRemoteCandidate(transportId, payload.getCandidate()).whenComplete((ignored, error) -> {
            if (error != null) {
                log.debug("Failed to add candidate from {} to {}", from, transportId, error);
            }
        });
    }

    private void onRemoteOffer(String from, SessionDescription offer) {
        ConnectionRecord record = registry.findByDevice(from);
        if (record == null || record.getTransportId() == null || !isLive(record)) {
            log.warn("Ignoring offer from {} without a live connection", from);
            return;
        }
        String transportId = record.getTransportId();
        transports.setRemoteDescription(transportId, offer)
                .thenCompose(ignored -> transports.createAnswer(transportId))
                .whenCompleteAsync((answer, error) -> {
                    if (error != null) {
                        log.error("Renegotiation with {} failed", from, PeerLinkException.stripCompletion(error));
                    } else if (record.isTransport(transportId)) {
                        signaling.sendAnswer(from, answer);
                    }
                }, loop);
    }

    private void onRemoteAnswer(String from, SessionDescription answer) {
        ConnectionRecord record = registry.findByDevice(from);
        if (record == null || record.getTransportId() == null) {
            log.warn("Ignoring answer from {} without a live connection", from);
            return;
        }
        transports.setRemoteDescription(record.getTransportId(), answer).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Failed to apply renegotiated answer from {}", from, PeerLinkException.stripCompletion(error));
            }
        });
    }

    private void onRemoteClose(String from, String reason) {
        ConnectionRecord record = registry.findByDevice(from);
        if (record != null && record.getState() != ConnectionState.CLOSED) {
            closeRecord(record, reason != null ? reason : "closed by peer", false);
        }
    }

    private void onConditionsChanged(NetworkConditions conditions) {
        ConnectionQuality quality = ConnectionQuality.from(conditions);
        for (ConnectionRecord record : registry.inState(ConnectionState.CONNECTED)) {
            applyQuality(record, quality);
        }
    }

    private void applyQuality(ConnectionRecord record, ConnectionQuality quality) {
        record.setQuality(quality);
        log.debug("Quality updated for {}: {}", record.getId(), quality.getRating());
        emit(l -> l.onQualityUpdated(record.getId(), quality));
    }

    private void onChannelMessage(String transportId, String label, byte[] data) {
        ConnectionRecord record = registry.findByTransport(transportId);
        if (record == null) {
            return;
        }
        record.touch();
        emit(l -> l.onDataReceived(record.getId(), record.getDeviceId(), label, data));
    }

    private void shutdownOnLoop() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
        for (ConnectionRecord record : registry.all()) {
            try {
                closeRecord(record, "manager destroyed", true);
            } catch (Exception e) {
                log.warn("Failed to close connection {} during shutdown", record.getId(), e);
            }
        }
        for (CompletableFuture<ConnectionInfo> pending : initiating.values()) {
            pending.completeExceptionally(new PeerLinkException(ErrorCode.MANAGER_DESTROYED));
        }
        initiating.clear();
        registry.clear();
    }

    // ---- helpers ----

    private boolean transition(ConnectionRecord record, ConnectionState next) {
        ConnectionState previous = record.getState();
        if (!previous.canTransitionTo(next)) {
            log.debug("Ignoring transition {} -> {} for {}", previous, next, record.getId());
            return false;
        }
        record.setState(next);
        log.debug("Connection {} state {} -> {}", record.getId(), previous, next);
        ConnectionInfo info = snapshot(record);
        emit(l -> l.onStateChanged(info));
        return true;
    }

    private boolean isCurrent(ConnectionRecord record, String transportId) {
        return registry.contains(record) && record.isTransport(transportId) && record.getState() != ConnectionState.CLOSED;
    }

    private static boolean isLive(ConnectionRecord record) {
        ConnectionState state = record.getState();
        return state != ConnectionState.FAILED && state != ConnectionState.CLOSED;
    }

    private ConnectionRecord requireLive(String connectionId) {
        ConnectionRecord record = registry.get(connectionId);
        if (record == null || record.getState() == ConnectionState.CLOSED) {
            throw new PeerLinkException(ErrorCode.CONNECTION_NOT_FOUND, Map.of("connectionId", connectionId));
        }
        if (record.getState() != ConnectionState.CONNECTED || record.getTransportId() == null) {
            throw new PeerLinkException(ErrorCode.CONNECTION_NOT_READY,
                    Map.of("connectionId", connectionId, "state", record.getState().name()));
        }
        return record;
    }

    private ConnectionInfo snapshot(ConnectionRecord record) {
        String transportId = record.getTransportId();
        TransportStatistics statistics = transportId != null
                ? transports.getStatistics(transportId).orElse(TransportStatistics.EMPTY)
                : TransportStatistics.EMPTY;
        return record.snapshot(statistics);
    }

    private CompletableFuture<Void> ensureSignaling() {
        if (signaling.isConnected()) {
            return CompletableFuture.completedFuture(null);
        }
        return signaling.connect();
    }

    private void closeTransportQuietly(String transportId) {
        if (transportId == null) {
            return;
        }
        try {
            transports.close(transportId);
        } catch (Exception e) {
            log.warn("Failed to close transport {}", transportId, e);
        }
    }

    private void destroyQuietly(String component, Runnable destroy) {
        try {
            destroy.run();
        } catch (Exception e) {
            log.warn("Failed to destroy {}", component, e);
        }
    }

    private <T> CompletableFuture<T> callOnLoop(Supplier<CompletableFuture<T>> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (destroyed) {
            result.completeExceptionally(new PeerLinkException(ErrorCode.MANAGER_DESTROYED));
            return result;
        }
        try {
            loop.execute(() -> {
                try {
                    action.get().whenComplete((value, error) -> {
                        if (error != null) {
                            result.completeExceptionally(PeerLinkException.stripCompletion(error));
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new PeerLinkException(ErrorCode.MANAGER_DESTROYED));
        }
        return result;
    }

    private boolean post(Runnable task) {
        try {
            loop.execute(guarded(task));
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Dropping event after shutdown");
            return false;
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Connection manager task failed", e);
            }
        };
    }

    private void emit(Consumer<ConnectionEventListener> event) {
        for (ConnectionEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Connection listener failed", e);
            }
        }
    }

    private static final class StaleAttemptException extends RuntimeException {
        private StaleAttemptException(String transportId) {
            super("Superseded transport " + transportId, null, false, false);
        }
    }

    private final class TransportEvents implements PeerTransportListener {
        @Override
        public void onStateChanged(String connectionId, ConnectionState state) {
            post(() -> onTransportState(connectionId, state));
        }

        @Override
        public void onLocalCandidate(String connectionId, IceCandidate candidate) {
            post(() -> ConnectionManager.this.onLocalCandidate(connectionId, candidate));
        }

        @Override
        public void onIceFailed(String connectionId) {
            post(() -> onTransportState(connectionId, ConnectionState.FAILED));
        }

        @Override
        public void onChannelMessage(String connectionId, String label, byte[] data) {
            post(() -> ConnectionManager.this.onChannelMessage(connectionId, label, data));
        }

        @Override
        public void onChannelError(String connectionId, String label, Throwable error) {
            log.warn("Channel {} error on transport {}", label, connectionId, error);
        }
    }

    private final class SignalingEvents implements SignalingListener {
        @Override
        public void onConnectionRequest(ConnectionRequest request) {
            post(() -> acceptIncoming(request));
        }

        @Override
        public void onIceCandidate(String from, CandidatePayload payload) {
            post(() -> onRemoteCandidate(from, payload));
        }

        @Override
        public void onOffer(String from, SessionDescription offer) {
            post(() -> onRemoteOffer(from, offer));
        }

        @Override
        public void onAnswer(String from, SessionDescription answer) {
            post(() -> onRemoteAnswer(from, answer));
        }

        @Override
        public void onConnectionClose(String from, String reason) {
            post(() -> onRemoteClose(from, reason));
        }

        @Override
        public void onDisconnected(String reason) {
            log.warn("Signaling disconnected: {}", reason);
        }

        @Override
        public void onReconnectFailed() {
            log.error("Signaling reconnection failed, call connect() to retry");
            post(() -> emit(ConnectionEventListener::onSignalingReconnectFailed));
        }
    }

    private final class OptimizerEvents implements NetworkOptimizerListener {
        @Override
        public void onConditionsChanged(NetworkConditions conditions) {
            post(() -> ConnectionManager.this.onConditionsChanged(conditions));
        }
    }
}
