package org.cbj.peerlink.signal.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.config.SignalingProperties;
import org.cbj.peerlink.error.ErrorCode;
import org.cbj.peerlink.error.PeerLinkException;
import org.cbj.peerlink.signal.dto.CandidatePayload;
import org.cbj.peerlink.signal.dto.ClosePayload;
import org.cbj.peerlink.signal.dto.ConnectionRequest;
import org.cbj.peerlink.signal.dto.ConnectionResponse;
import org.cbj.peerlink.signal.dto.DeviceInfo;
import org.cbj.peerlink.signal.dto.DiscoveryReply;
import org.cbj.peerlink.signal.dto.DiscoveryRequest;
import org.cbj.peerlink.signal.dto.DiscoveryResult;
import org.cbj.peerlink.signal.dto.HandshakeOptions;
import org.cbj.peerlink.signal.dto.SignalEstimate;
import org.cbj.peerlink.signal.dto.SignalMessage;
import org.cbj.peerlink.signal.dto.SignalType;
import org.cbj.peerlink.transport.IceCandidate;
import org.cbj.peerlink.transport.SessionDescription;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

@Slf4j
public class SignalingClient {

    private static final SignalEstimate LOCAL_SIGNAL = new SignalEstimate(100, 10);

    private final String deviceId;
    private final DeviceInfo localDevice;
    private final SignalingProperties properties;
    private final SignalingTransport transport;
    private final ObjectMapper objectMapper;
    private final ScheduledThreadPoolExecutor scheduler;

    private final List<SignalingListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<SignalMessage> outbound = new ArrayDeque<>();
    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final Map<String, DiscoveryCollector> discoveries = new ConcurrentHashMap<>();

    private volatile boolean connected = false;
    private volatile boolean destroyed = false;
    private CompletableFuture<Void> connecting;
    private boolean userDisconnect = false;
    private int reconnectAttempts = 0;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> reconnectTask;

    public SignalingClient(String deviceId, DeviceInfo localDevice, SignalingProperties properties,
                           SignalingTransport transport, ObjectMapper objectMapper) {
        this.deviceId = deviceId;
        this.localDevice = localDevice;
        this.properties = properties;
        this.transport = transport;
        this.objectMapper = objectMapper;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("signaling-");
        threadFactory.setDaemon(true);
        this.scheduler = new ScheduledThreadPoolExecutor(1, threadFactory);
        scheduler.setRemoveOnCancelPolicy(true);
    }

    public void addListener(SignalingListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SignalingListener listener) {
        listeners.remove(listener);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public boolean isConnected() {
        return connected && transport.isConnected();
    }

    /**
     * Opens the session. Concurrent calls share one attempt; calling while connected is a no-op.
     * Fails with {@link ErrorCode#CONNECTION_TIMEOUT} if the server does not accept the session in time.
     */
    public synchronized CompletableFuture<Void> connect() {
        if (destroyed) {
            return CompletableFuture.failedFuture(new PeerLinkException(ErrorCode.DISCONNECTED,
                    Map.of("deviceId", deviceId, "reason", "destroyed")));
        }
        if (isConnected()) {
            log.warn("Already connected to signaling server");
            return CompletableFuture.completedFuture(null);
        }
        if (connecting != null) {
            return connecting;
        }
        userDisconnect = false;
        String serverUrl = properties.getServerUrl();
        long timeoutMs = properties.getConnectTimeout().toMillis();
        log.info("Connecting to signaling server {} as {}", serverUrl, deviceId);

        CompletableFuture<Void> attempt = new CompletableFuture<>();
        CompletableFuture<Void> result = attempt.whenComplete((ignored, error) -> onConnectFinished(error));
        connecting = result;

        ScheduledFuture<?> timeout = scheduler.schedule(() -> {
            if (attempt.completeExceptionally(new PeerLinkException(ErrorCode.CONNECTION_TIMEOUT,
                    Map.of("serverUrl", serverUrl, "timeoutMs", timeoutMs)))) {
                transport.disconnect();
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);

        CompletableFuture<Void> transportConnect;
        try {
            transportConnect = transport.connect(deviceId, new TransportHandler());
        } catch (Exception e) {
            transportConnect = CompletableFuture.failedFuture(e);
        }
        transportConnect.whenComplete((ignored, error) -> {
            timeout.cancel(false);
            if (error == null) {
                attempt.complete(null);
            } else {
                attempt.completeExceptionally(new PeerLinkException(ErrorCode.CONNECTION_FAILED,
                        Map.of("serverUrl", serverUrl), PeerLinkException.stripCompletion(error)));
            }
        });
        return result;
    }

    /**
     * Caller-initiated disconnect. Pending connection requests fail with {@link ErrorCode#DISCONNECTED}
     * and no reconnection is attempted.
     */
    public void disconnect() {
        synchronized (this) {
            userDisconnect = true;
            connected = false;
            stopHeartbeat();
            if (reconnectTask != null) {
                reconnectTask.cancel(false);
                reconnectTask = null;
            }
        }
        rejectPendingRequests("client disconnect");
        try {
            transport.disconnect();
        } catch (Exception e) {
            log.warn("Error while closing signaling transport", e);
        }
        log.info("Disconnected from signaling server");
        emit(l -> l.onDisconnected("client disconnect"));
    }

    public void destroy() {
        if (destroyed) {
            return;
        }
        destroyed = true;
        disconnect();
        synchronized (outbound) {
            outbound.clear();
        }
        for (String discoveryId : List.copyOf(discoveries.keySet())) {
            finishDiscovery(discoveryId);
        }
        scheduler.shutdownNow();
        listeners.clear();
        log.info("SignalingClient destroyed");
    }

    public SignalMessage send(SignalType type, String to, Object data) {
        SignalMessage message = SignalMessage.of(type, deviceId, to, data);
        send(message);
        return message;
    }

    /**
     * Hands the message to the server, or queues it if the session is down. Queued messages keep their
     * order and go out before anything sent later.
     */
    public void send(SignalMessage message) {
        synchronized (outbound) {
            if (isConnected()) {
                flushQueue();
            }
            if (!isConnected() || !outbound.isEmpty()) {
                outbound.addLast(message);
                log.debug("Signaling message queued: type={}, to={}, queued={}",
                        message.getType(), message.getTo(), outbound.size());
                return;
            }
            try {
                transport.send(message);
                log.debug("Signaling message sent: type={}, to={}", message.getType(), message.getTo());
            } catch (Exception e) {
                log.warn("Failed to send signaling message type={} to={}, queued for retry",
                        message.getType(), message.getTo(), e);
                outbound.addLast(message);
            }
        }
    }

    public int getQueuedMessageCount() {
        synchronized (outbound) {
            return outbound.size();
        }
    }

    public boolean hasPendingRequest(String requestId) {
        return pendingRequests.containsKey(requestId);
    }

    public int getPendingRequestCount() {
        return pendingRequests.size();
    }

    public ConnectionRequest buildRequest(String targetDeviceId, HandshakeOptions options) {
        return new ConnectionRequest(UUID.randomUUID().toString(), deviceId, targetDeviceId, options, Instant.now());
    }

    public CompletableFuture<ConnectionResponse> requestConnection(String targetDeviceId, HandshakeOptions options) {
        return requestConnection(buildRequest(targetDeviceId, options));
    }

    /**
     * Sends the request and completes with the accepting response. A rejection fails with
     * {@link ErrorCode#CONNECTION_REJECTED}; no response within the request timeout fails with
     * {@link ErrorCode#REQUEST_TIMEOUT}.
     */
    public CompletableFuture<ConnectionResponse> requestConnection(ConnectionRequest request) {
        String requestId = request.getRequestId();
        if (destroyed) {
            return CompletableFuture.failedFuture(new PeerLinkException(ErrorCode.DISCONNECTED,
                    Map.of("requestId", requestId, "targetDeviceId", request.getTo(), "reason", "destroyed")));
        }
        CompletableFuture<ConnectionResponse> future = new CompletableFuture<>();
        PendingRequest pending = new PendingRequest(future);
        pendingRequests.put(requestId, pending);

        long timeoutMs = properties.getRequestTimeout().toMillis();
        pending.timer = scheduler.schedule(() -> {
            if (pendingRequests.remove(requestId) != null) {
                log.warn("Connection request {} to {} timed out after {} ms", requestId, request.getTo(), timeoutMs);
                future.completeExceptionally(new PeerLinkException(ErrorCode.REQUEST_TIMEOUT,
                        Map.of("requestId", requestId, "targetDeviceId", request.getTo())));
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);

        log.info("Requesting connection to {}: requestId={}", request.getTo(), requestId);
        send(SignalType.CONNECTION_REQUEST, request.getTo(), request);
        return future;
    }

    public void respondToConnection(ConnectionRequest request, boolean accepted, String error,
                                    SessionDescription answer) {
        ConnectionResponse response = new ConnectionResponse(request.getRequestId(), accepted, deviceId,
                request.getFrom(), error, answer, Instant.now());
        log.info("Responding to connection request {} from {}: accepted={}",
                request.getRequestId(), request.getFrom(), accepted);
        send(SignalType.CONNECTION_RESPONSE, request.getFrom(), response);
    }

    /**
     * Broadcasts a discovery query and collects replies until the timeout. Always completes normally,
     * possibly with an empty list.
     */
    public CompletableFuture<List<DiscoveryResult>> discoverDevices(long timeoutMs) {
        if (destroyed) {
            return CompletableFuture.completedFuture(List.of());
        }
        String discoveryId = UUID.randomUUID().toString();
        DiscoveryCollector collector = new DiscoveryCollector();
        discoveries.put(discoveryId, collector);
        scheduler.schedule(() -> finishDiscovery(discoveryId), timeoutMs, TimeUnit.MILLISECONDS);

        log.info("Discovering devices: discoveryId={}, timeoutMs={}", discoveryId, timeoutMs);
        try {
            send(SignalType.DEVICE_DISCOVERY, SignalMessage.BROADCAST, new DiscoveryRequest(discoveryId, deviceId));
        } catch (Exception e) {
            log.warn("{}: discoveryId={}", ErrorCode.DISCOVERY_FAILED.getDefaultMessage(), discoveryId, e);
        }
        return collector.result;
    }

    public void sendOffer(String targetDeviceId, SessionDescription offer) {
        send(SignalType.OFFER, targetDeviceId, offer);
    }

    public void sendAnswer(String targetDeviceId, SessionDescription answer) {
        send(SignalType.ANSWER, targetDeviceId, answer);
    }

    public void sendIceCandidate(String targetDeviceId, String sessionId, IceCandidate candidate) {
        send(SignalType.ICE_CANDIDATE, targetDeviceId, new CandidatePayload(sessionId, candidate));
    }

    public void closeConnection(String targetDeviceId, String reason) {
        send(SignalType.CONNECTION_CLOSE, targetDeviceId, new ClosePayload(reason));
    }

    void handleMessage(SignalMessage message) {
        if (message == null || message.getType() == null) {
            log.warn("Dropping malformed signaling message: {}", message);
            return;
        }
        log.debug("Signaling message received: type={}, from={}", message.getType(), message.getFrom());
        emit(l -> l.onMessageReceived(message));
        String from = message.getFrom();
        try {
            switch (message.getType()) {
                case OFFER:
                    SessionDescription offer = payload(message, SessionDescription.class);
                    emit(l -> l.onOffer(from, offer));
                    break;
                case ANSWER:
                    SessionDescription answer = payload(message, SessionDescription.class);
                    emit(l -> l.onAnswer(from, answer));
                    break;
                case ICE_CANDIDATE:
                    CandidatePayload candidate = payload(message, CandidatePayload.class);
                    emit(l -> l.onIceCandidate(from, candidate));
                    break;
                case CONNECTION_REQUEST:
                    ConnectionRequest request = payload(message, ConnectionRequest.class);
                    emit(l -> l.onConnectionRequest(request));
                    break;
                case CONNECTION_RESPONSE:
                    handleConnectionResponse(payload(message, ConnectionResponse.class));
                    break;
                case CONNECTION_CLOSE:
                    ClosePayload close = payload(message, ClosePayload.class);
                    String reason = close != null ? close.getReason() : null;
                    emit(l -> l.onConnectionClose(from, reason));
                    break;
                case DEVICE_DISCOVERY:
                    respondToDiscovery(payload(message, DiscoveryRequest.class));
                    break;
                case DEVICE_RESPONSE:
                    handleDiscoveryReply(from, payload(message, DiscoveryReply.class));
                    break;
                case ERROR:
                    log.error("Signaling error from {}: {}", from, message.getData());
                    emit(l -> l.onSignalingError(from, message.getData()));
                    break;
                case HEARTBEAT:
                    break;
                default:
                    log.warn("Unknown signaling message type from {}: {}", from, message.getType());
            }
        } catch (IllegalArgumentException e) {
            log.warn("Dropping signaling message with unreadable payload: type={}, from={}",
                    message.getType(), from, e);
        }
    }

    private <T> T payload(SignalMessage message, Class<T> type) {
        return objectMapper.convertValue(message.getData(), type);
    }

    private void handleConnectionResponse(ConnectionResponse response) {
        if (response == null) {
            return;
        }
        PendingRequest pending = pendingRequests.remove(response.getRequestId());
        if (pending == null) {
            log.debug("Ignoring response for unknown or expired request {}", response.getRequestId());
            return;
        }
        pending.cancelTimer();
        if (response.isAccepted()) {
            log.info("Connection request {} accepted by {}", response.getRequestId(), response.getFrom());
            pending.future.complete(response);
        } else {
            log.info("Connection request {} rejected by {}: {}",
                    response.getRequestId(), response.getFrom(), response.getError());
            pending.future.completeExceptionally(new PeerLinkException(ErrorCode.CONNECTION_REJECTED,
                    Map.of("requestId", response.getRequestId(),
                            "reason", String.valueOf(response.getError()))));
        }
    }

    private void respondToDiscovery(DiscoveryRequest request) {
        if (request == null || request.getRequester() == null || deviceId.equals(request.getRequester())) {
            return;
        }
        log.debug("Answering discovery {} from {}", request.getDiscoveryId(), request.getRequester());
        send(SignalType.DEVICE_RESPONSE, request.getRequester(),
                new DiscoveryReply(request.getDiscoveryId(), localDevice, LOCAL_SIGNAL));
    }

    private void handleDiscoveryReply(String from, DiscoveryReply reply) {
        if (reply == null || from == null || deviceId.equals(from)) {
            return;
        }
        DiscoveryResult result = new DiscoveryResult(from, reply.getDeviceInfo(), reply.getSignal(), Instant.now());
        if (reply.getDiscoveryId() != null) {
            DiscoveryCollector collector = discoveries.get(reply.getDiscoveryId());
            if (collector != null) {
                collector.add(result);
            }
        } else {
            discoveries.values().forEach(c -> c.add(result));
        }
        log.info("Device discovered: {} ({})", from,
                reply.getDeviceInfo() != null ? reply.getDeviceInfo().getName() : "unknown");
        emit(l -> l.onDeviceDiscovered(result));
    }

    private void finishDiscovery(String discoveryId) {
        DiscoveryCollector collector = discoveries.remove(discoveryId);
        if (collector != null) {
            List<DiscoveryResult> found = collector.snapshot();
            log.info("Discovery {} finished: {} device(s) found", discoveryId, found.size());
            collector.result.complete(found);
        }
    }

    private synchronized void onConnectFinished(Throwable error) {
        connecting = null;
        if (error != null) {
            log.error("Failed to connect to signaling server {}", properties.getServerUrl(),
                    PeerLinkException.stripCompletion(error));
            return;
        }
        connected = true;
        reconnectAttempts = 0;
        startHeartbeat();
        synchronized (outbound) {
            flushQueue();
        }
        log.info("Connected to signaling server as {}", deviceId);
        emit(SignalingListener::onConnected);
    }

    private void handleTransportLoss(String reason) {
        synchronized (this) {
            if (!connected) {
                return;
            }
            connected = false;
            stopHeartbeat();
        }
        log.warn("Disconnected from signaling server: {}", reason);
        emit(l -> l.onDisconnected(reason));
        synchronized (this) {
            if (!userDisconnect && !destroyed) {
                scheduleReconnect();
            }
        }
    }

    private synchronized void scheduleReconnect() {
        if (reconnectAttempts >= properties.getMaxReconnectAttempts()) {
            log.error("Max reconnection attempts ({}) reached, giving up", properties.getMaxReconnectAttempts());
            emit(SignalingListener::onReconnectFailed);
            return;
        }
        reconnectAttempts++;
        long delayMs = properties.getReconnectDelay().toMillis() * (1L << (reconnectAttempts - 1));
        log.info("Reconnecting to signaling server in {} ms (attempt {}/{})",
                delayMs, reconnectAttempts, properties.getMaxReconnectAttempts());
        reconnectTask = scheduler.schedule(this::reconnect, delayMs, TimeUnit.MILLISECONDS);
    }

    private void reconnect() {
        synchronized (this) {
            reconnectTask = null;
            if (userDisconnect || destroyed) {
                return;
            }
        }
        connect().whenComplete((ignored, error) -> {
            if (error == null) {
                log.info("Reconnected to signaling server");
                emit(SignalingListener::onReconnected);
                return;
            }
            log.warn("Reconnection attempt {} failed", reconnectAttempts);
            synchronized (this) {
                if (!userDisconnect && !destroyed) {
                    scheduleReconnect();
                }
            }
        });
    }

    // must hold the outbound lock
    private void flushQueue() {
        while (!outbound.isEmpty()) {
            SignalMessage next = outbound.peekFirst();
            try {
                transport.send(next);
            } catch (Exception e) {
                log.warn("Failed to flush queued signaling message type={} to={}, {} still queued",
                        next.getType(), next.getTo(), outbound.size(), e);
                return;
            }
            outbound.pollFirst();
        }
    }

    private void startHeartbeat() {
        stopHeartbeat();
        long intervalMs = properties.getHeartbeatInterval().toMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(this::sendHeartbeat, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    private void sendHeartbeat() {
        if (!isConnected()) {
            return;
        }
        try {
            transport.send(SignalMessage.of(SignalType.HEARTBEAT, deviceId, SignalMessage.SERVER,
                    Map.of("deviceId", deviceId, "timestamp", Instant.now().toString())));
        } catch (Exception e) {
            log.debug("Heartbeat send failed", e);
        }
    }

    private void rejectPendingRequests(String reason) {
        List<String> requestIds = new ArrayList<>(pendingRequests.keySet());
        for (String requestId : requestIds) {
            PendingRequest pending = pendingRequests.remove(requestId);
            if (pending != null) {
                pending.cancelTimer();
                pending.future.completeExceptionally(new PeerLinkException(ErrorCode.DISCONNECTED,
                        Map.of("requestId", requestId, "reason", reason)));
            }
        }
    }

    private void emit(Consumer<SignalingListener> event) {
        for (SignalingListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.warn("Signaling listener failed", e);
            }
        }
    }

    private final class TransportHandler implements SignalingTransport.Handler {
        @Override
        public void onMessage(SignalMessage message) {
            handleMessage(message);
        }

        @Override
        public void onDisconnected(String reason) {
            handleTransportLoss(reason);
        }
    }

    private static final class PendingRequest {
        private final CompletableFuture<ConnectionResponse> future;
        private volatile ScheduledFuture<?> timer;

        private PendingRequest(CompletableFuture<ConnectionResponse> future) {
            this.future = future;
        }

        private void cancelTimer() {
            ScheduledFuture<?> current = timer;
            if (current != null) {
                current.cancel(false);
            }
        }
    }

    private static final class DiscoveryCollector {
        private final Map<String, DiscoveryResult> found = new ConcurrentHashMap<>();
        private final CompletableFuture<List<DiscoveryResult>> result = new CompletableFuture<>();

        private void add(DiscoveryResult discovered) {
            found.putIfAbsent(discovered.getDeviceId(), discovered);
        }

        private List<DiscoveryResult> snapshot() {
            return List.copyOf(found.values());
        }
    }
}
