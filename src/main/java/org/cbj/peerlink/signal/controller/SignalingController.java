package org.cbj.peerlink.signal.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cbj.peerlink.signal.dto.SignalMessage;
import org.cbj.peerlink.signal.dto.SignalType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Controller
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "peerlink.relay", name = "enabled", havingValue = "true")
public class SignalingController {

    public static final String BROADCAST_TOPIC = "/topic/broadcast";
    public static final String DEVICE_TOPIC_PREFIX = "/topic/device.";

    private final SimpMessageSendingOperations messagingTemplate;
    private final Set<String> activeDevices = ConcurrentHashMap.newKeySet();
    private final Map<String, String> sessionDevices = new ConcurrentHashMap<>();

    @MessageMapping("/signal")
    public void relay(@Payload SignalMessage message, SimpMessageHeaderAccessor headerAccessor) {
        if (message == null || message.getType() == null || message.getFrom() == null) {
            log.warn("### dropping malformed signaling message {}", message);
            return;
        }
        String from = message.getFrom();
        String sessionId = headerAccessor != null ? headerAccessor.getSessionId() : null;
        if (sessionId != null) {
            sessionDevices.put(sessionId, from);
        }
        if (activeDevices.add(from)) {
            log.info("### device joined: {} (active = {})", from, activeDevices.size());
        }

        if (message.getType() == SignalType.HEARTBEAT || SignalMessage.SERVER.equals(message.getTo())) {
            log.trace("### heartbeat from {}", from);
            return;
        }
        if (message.isBroadcast()) {
            log.debug("### broadcast {} from {}", message.getType(), from);
            messagingTemplate.convertAndSend(BROADCAST_TOPIC, message);
            return;
        }
        String to = message.getTo();
        if (to == null) {
            log.warn("### {} from {} has no target, dropped", message.getType(), from);
            return;
        }
        if (!activeDevices.contains(to)) {
            log.debug("### relaying {} to {} which has not been seen on this relay", message.getType(), to);
        }
        log.debug("### relay {} {} -> {}", message.getType(), from, to);
        messagingTemplate.convertAndSend(DEVICE_TOPIC_PREFIX + to, message);
    }

    @EventListener
    public void onSessionDisconnect(SessionDisconnectEvent event) {
        String deviceId = sessionDevices.remove(event.getSessionId());
        if (deviceId != null && !sessionDevices.containsValue(deviceId) && activeDevices.remove(deviceId)) {
            log.info("### device left: {} (active = {})", deviceId, activeDevices.size());
        }
    }

    public Set<String> getActiveDevices() {
        return Set.copyOf(activeDevices);
    }
}
