package org.cbj.peerlink.signal.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.signal.dto.SignalMessage;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;
import org.springframework.web.socket.sockjs.client.SockJsClient;
import org.springframework.web.socket.sockjs.client.WebSocketTransport;

import java.lang.reflect.Type;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
public class StompSignalingTransport implements SignalingTransport {

    static final String APP_DESTINATION = "/app/signal";
    static final String BROADCAST_TOPIC = "/topic/broadcast";
    static final String DEVICE_TOPIC_PREFIX = "/topic/device.";

    private final String serverUrl;
    private final WebSocketStompClient stompClient;
    private volatile StompSession session;
    private volatile boolean closing = false;

    public StompSignalingTransport(String serverUrl, ObjectMapper objectMapper) {
        this.serverUrl = serverUrl;
        SockJsClient sockJsClient = new SockJsClient(List.of(new WebSocketTransport(new StandardWebSocketClient())));
        this.stompClient = new WebSocketStompClient(sockJsClient);
        MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
        converter.setObjectMapper(objectMapper);
        stompClient.setMessageConverter(converter);
    }

    @Override
    public CompletableFuture<Void> connect(String deviceId, Handler handler) {
        closing = false;
        CompletableFuture<Void> connected = new CompletableFuture<>();
        StompHeaders connectHeaders = new StompHeaders();
        connectHeaders.add("deviceId", deviceId);

        stompClient.connectAsync(serverUrl, new WebSocketHttpHeaders(), connectHeaders, new StompSessionHandlerAdapter() {
            @Override
            public void afterConnected(StompSession stompSession, StompHeaders connectedHeaders) {
                session = stompSession;
                StompFrameHandler frames = new SignalFrameHandler(handler);
                stompSession.subscribe(DEVICE_TOPIC_PREFIX + deviceId, frames);
                stompSession.subscribe(BROADCAST_TOPIC, frames);
                log.debug("STOMP session {} established for device {}", stompSession.getSessionId(), deviceId);
                connected.complete(null);
            }

            @Override
            public void handleException(StompSession stompSession, StompCommand command, StompHeaders headers,
                                        byte[] payload, Throwable exception) {
                log.error("Failed to handle STOMP frame: command={}, destination={}",
                        command, headers.getDestination(), exception);
            }

            @Override
            public void handleTransportError(StompSession stompSession, Throwable exception) {
                if (!connected.isDone()) {
                    connected.completeExceptionally(exception);
                    return;
                }
                session = null;
                if (!closing) {
                    log.warn("Signaling transport lost: {}", exception.getMessage());
                    handler.onDisconnected(String.valueOf(exception.getMessage()));
                }
            }
        }).whenComplete((ignored, error) -> {
            if (error != null) {
                connected.completeExceptionally(error);
            }
        });
        return connected;
    }

    @Override
    public void send(SignalMessage message) {
        StompSession current = session;
        if (current == null || !current.isConnected()) {
            throw new IllegalStateException("STOMP session is not connected");
        }
        current.send(APP_DESTINATION, message);
    }

    @Override
    public boolean isConnected() {
        StompSession current = session;
        return current != null && current.isConnected();
    }

    @Override
    public void disconnect() {
        closing = true;
        StompSession current = session;
        session = null;
        if (current != null && current.isConnected()) {
            current.disconnect();
        }
    }

    private static final class SignalFrameHandler implements StompFrameHandler {
        private final Handler handler;

        private SignalFrameHandler(Handler handler) {
            this.handler = handler;
        }

        @Override
        public Type getPayloadType(StompHeaders headers) {
            return SignalMessage.class;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload) {
            handler.onMessage((SignalMessage) payload);
        }
    }
}
