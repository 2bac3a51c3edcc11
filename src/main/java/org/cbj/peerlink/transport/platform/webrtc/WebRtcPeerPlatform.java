package org.cbj.peerlink.transport.platform.webrtc;

import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCBundlePolicy;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCDataChannel;
import dev.onvoid.webrtc.RTCDataChannelBuffer;
import dev.onvoid.webrtc.RTCDataChannelInit;
import dev.onvoid.webrtc.RTCDataChannelObserver;
import dev.onvoid.webrtc.RTCDataChannelState;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceConnectionState;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.RTCIceTransportPolicy;
import dev.onvoid.webrtc.RTCOfferOptions;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.RTCStats;
import dev.onvoid.webrtc.RTCStatsReport;
import dev.onvoid.webrtc.RTCStatsType;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;
import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.transport.ChannelSpec;
import org.cbj.peerlink.transport.IceCandidate;
import org.cbj.peerlink.transport.SessionDescription;
import org.cbj.peerlink.transport.TransportConfig;
import org.cbj.peerlink.transport.platform.PeerPlatform;
import org.cbj.peerlink.transport.platform.PlatformChannel;
import org.cbj.peerlink.transport.platform.PlatformConnection;
import org.cbj.peerlink.transport.platform.PlatformConnectionState;
import org.cbj.peerlink.transport.platform.PlatformStats;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
public class WebRtcPeerPlatform implements PeerPlatform {

    private PeerConnectionFactory factory;

    @Override
    public PlatformConnection createConnection(TransportConfig config, PlatformConnection.Observer observer) {
        RTCConfiguration rtcConfig = new RTCConfiguration();
        List<RTCIceServer> iceServers = new ArrayList<>();
        for (TransportConfig.IceServer server : config.getIceServers()) {
            RTCIceServer iceServer = new RTCIceServer();
            iceServer.urls.addAll(server.getUrls());
            if (server.getUsername() != null) {
                iceServer.username = server.getUsername();
            }
            if (server.getCredential() != null) {
                iceServer.password = server.getCredential();
            }
            iceServers.add(iceServer);
        }
        rtcConfig.iceServers = iceServers;
        rtcConfig.bundlePolicy = toBundlePolicy(config.getBundlePolicy());
        rtcConfig.iceTransportPolicy = config.getIceTransportPolicy() == TransportConfig.IceTransportPolicy.RELAY
                ? RTCIceTransportPolicy.RELAY
                : RTCIceTransportPolicy.ALL;

        WebRtcConnection connection = new WebRtcConnection(observer);
        RTCPeerConnection peerConnection = factory().createPeerConnection(rtcConfig, connection.observer());
        if (peerConnection == null) {
            throw new IllegalStateException("WebRTC rejected the peer connection configuration");
        }
        connection.peerConnection = peerConnection;
        return connection;
    }

    @Override
    public synchronized void shutdown() {
        if (factory != null) {
            factory.dispose();
            factory = null;
            log.info("WebRTC peer connection factory disposed");
        }
    }

    private synchronized PeerConnectionFactory factory() {
        if (factory == null) {
            factory = new PeerConnectionFactory();
            log.info("WebRTC peer connection factory initialized");
        }
        return factory;
    }

    private static RTCBundlePolicy toBundlePolicy(TransportConfig.BundlePolicy policy) {
        switch (policy) {
            case BALANCED:
                return RTCBundlePolicy.BALANCED;
            case MAX_COMPAT:
                return RTCBundlePolicy.MAX_COMPAT;
            default:
                return RTCBundlePolicy.MAX_BUNDLE;
        }
    }

    static PlatformConnectionState toPlatformState(RTCPeerConnectionState state) {
        switch (state) {
            case NEW:
                return PlatformConnectionState.NEW;
            case CONNECTING:
                return PlatformConnectionState.CONNECTING;
            case CONNECTED:
                return PlatformConnectionState.CONNECTED;
            case DISCONNECTED:
                return PlatformConnectionState.DISCONNECTED;
            case FAILED:
                return PlatformConnectionState.FAILED;
            default:
                return PlatformConnectionState.CLOSED;
        }
    }

    private static final class WebRtcConnection implements PlatformConnection {
        private final Observer observer;
        private RTCPeerConnection peerConnection;

        private WebRtcConnection(Observer observer) {
            this.observer = observer;
        }

        PeerConnectionObserver observer() {
            return new PeerConnectionObserver() {
                @Override
                public void onIceCandidate(RTCIceCandidate candidate) {
                    observer.onIceCandidate(new IceCandidate(candidate.sdpMid, candidate.sdpMLineIndex, candidate.sdp));
                }

                @Override
                public void onConnectionChange(RTCPeerConnectionState state) {
                    observer.onStateChange(toPlatformState(state));
                }

                @Override
                public void onIceConnectionChange(RTCIceConnectionState state) {
                    if (state == RTCIceConnectionState.FAILED) {
                        observer.onIceFailed();
                    }
                }

                @Override
                public void onDataChannel(RTCDataChannel channel) {
                    observer.onRemoteChannel(new WebRtcChannel(channel));
                }
            };
        }

        @Override
        public CompletableFuture<SessionDescription> createOffer() {
            CompletableFuture<SessionDescription> result = new CompletableFuture<>();
            peerConnection.createOffer(new RTCOfferOptions(), commitLocal(result));
            return result;
        }

        @Override
        public CompletableFuture<SessionDescription> createAnswer() {
            CompletableFuture<SessionDescription> result = new CompletableFuture<>();
            peerConnection.createAnswer(new RTCAnswerOptions(), commitLocal(result));
            return result;
        }

        private CreateSessionDescriptionObserver commitLocal(CompletableFuture<SessionDescription> result) {
            return new CreateSessionDescriptionObserver() {
                @Override
                public void onSuccess(RTCSessionDescription description) {
                    peerConnection.setLocalDescription(description, new SetSessionDescriptionObserver() {
                        @Override
                        public void onSuccess() {
                            String type = description.sdpType == RTCSdpType.OFFER
                                    ? SessionDescription.OFFER
                                    : SessionDescription.ANSWER;
                            result.complete(new SessionDescription(type, description.sdp));
                        }

                        @Override
                        public void onFailure(String error) {
                            result.completeExceptionally(new IllegalStateException(error));
                        }
                    });
                }

                @Override
                public void onFailure(String error) {
                    result.completeExceptionally(new IllegalStateException(error));
                }
            };
        }

        @Override
        public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
            CompletableFuture<Void> result = new CompletableFuture<>();
            RTCSdpType type = SessionDescription.OFFER.equals(description.getType()) ? RTCSdpType.OFFER : RTCSdpType.ANSWER;
            peerConnection.setRemoteDescription(new RTCSessionDescription(type, description.getSdp()),
                    new SetSessionDescriptionObserver() {
                        @Override
                        public void onSuccess() {
                            result.complete(null);
                        }

                        @Override
                        public void onFailure(String error) {
                            result.completeExceptionally(new IllegalStateException(error));
                        }
                    });
            return result;
        }

        @Override
        public void addIceCandidate(IceCandidate candidate) {
            peerConnection.addIceCandidate(
                    new RTCIceCandidate(candidate.getSdpMid(), candidate.getSdpMLineIndex(), candidate.getCandidate()));
        }

        @Override
        public PlatformChannel createChannel(ChannelSpec spec) {
            RTCDataChannelInit init = new RTCDataChannelInit();
            init.ordered = spec.isOrdered();
            if (spec.getMaxRetransmits() != null) {
                init.maxRetransmits = spec.getMaxRetransmits();
            }
            if (spec.getMaxPacketLifeTime() != null) {
                init.maxPacketLifeTime = spec.getMaxPacketLifeTime();
            }
            if (spec.getProtocol() != null) {
                init.protocol = spec.getProtocol();
            }
            return new WebRtcChannel(peerConnection.createDataChannel(spec.getLabel(), init));
        }

        @Override
        public CompletableFuture<PlatformStats> getStats() {
            CompletableFuture<PlatformStats> result = new CompletableFuture<>();
            peerConnection.getStats(report -> {
                try {
                    result.complete(toPlatformStats(report));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
            return result;
        }

        @Override
        public void close() {
            peerConnection.close();
        }
    }

    static PlatformStats toPlatformStats(RTCStatsReport report) {
        Map<String, RTCStats> all = report.getStats();
        PlatformStats.PlatformStatsBuilder builder = PlatformStats.builder();
        long packetsLost = 0;
        boolean lossReported = false;

        for (RTCStats stats : all.values()) {
            Map<String, Object> members = stats.getMembers();
            if (stats.getType() == RTCStatsType.CANDIDATE_PAIR
                    && Boolean.TRUE.equals(members.get("nominated"))
                    && "succeeded".equalsIgnoreCase(String.valueOf(members.get("state")))) {
                builder.bytesSent(longValue(members.get("bytesSent")))
                        .bytesReceived(longValue(members.get("bytesReceived")))
                        .packetsSent(longValue(members.get("packetsSent")))
                        .packetsReceived(longValue(members.get("packetsReceived")));
                Object rtt = members.get("currentRoundTripTime");
                if (rtt instanceof Number) {
                    builder.roundTripTimeMs(((Number) rtt).doubleValue() * 1000);
                }
                RTCStats local = all.get(String.valueOf(members.get("localCandidateId")));
                if (local != null) {
                    builder.relayed("relay".equalsIgnoreCase(String.valueOf(local.getMembers().get("candidateType"))));
                }
            } else if (stats.getType() == RTCStatsType.INBOUND_RTP) {
                Long lost = longValue(members.get("packetsLost"));
                if (lost != null) {
                    packetsLost += lost;
                    lossReported = true;
                }
            }
        }
        if (lossReported) {
            builder.packetsLost(packetsLost);
        }
        return builder.build();
    }

    private static Long longValue(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    private static final class WebRtcChannel implements PlatformChannel {
        private final RTCDataChannel channel;

        private WebRtcChannel(RTCDataChannel channel) {
            this.channel = channel;
        }

        @Override
        public String getLabel() {
            return channel.getLabel();
        }

        @Override
        public boolean isOpen() {
            return channel.getState() == RTCDataChannelState.OPEN;
        }

        @Override
        public boolean isClosed() {
            return channel.getState() == RTCDataChannelState.CLOSED;
        }

        @Override
        public void setObserver(Observer observer) {
            channel.registerObserver(new RTCDataChannelObserver() {
                @Override
                public void onBufferedAmountChange(long previousAmount) {
                }

                @Override
                public void onStateChange() {
                    RTCDataChannelState state = channel.getState();
                    if (state == RTCDataChannelState.OPEN) {
                        observer.onOpen();
                    } else if (state == RTCDataChannelState.CLOSED) {
                        observer.onClose();
                    }
                }

                @Override
                public void onMessage(RTCDataChannelBuffer buffer) {
                    ByteBuffer data = buffer.data;
                    byte[] bytes = new byte[data.remaining()];
                    data.get(bytes);
                    observer.onMessage(bytes);
                }
            });
        }

        @Override
        public void send(byte[] data) throws Exception {
            channel.send(new RTCDataChannelBuffer(ByteBuffer.wrap(data), true));
        }

        @Override
        public void close() {
            channel.unregisterObserver();
            channel.close();
            channel.dispose();
        }
    }
}
