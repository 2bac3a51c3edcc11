package org.cbj.peerlink.connection;

import org.cbj.peerlink.TestUtils;
import org.cbj.peerlink.config.ConnectionProperties;
import org.cbj.peerlink.config.OptimizerProperties;
import org.cbj.peerlink.config.SignalingProperties;
import org.cbj.peerlink.connection.dto.ConnectionInfo;
import org.cbj.peerlink.connection.dto.ConnectionOptions;
import org.cbj.peerlink.connection.dto.ConnectionQuality;
import org.cbj.peerlink.connection.dto.QualityRating;
import org.cbj.peerlink.error.ErrorCode;
import org.cbj.peerlink.error.PeerLinkException;
import org.cbj.peerlink.network.BandwidthProbe;
import org.cbj.peerlink.network.NetworkMediumDetector;
import org.cbj.peerlink.network.NetworkOptimizer;
import org.cbj.peerlink.network.dto.NetworkMedium;
import org.cbj.peerlink.signal.client.InMemorySignalingHub;
import org.cbj.peerlink.signal.client.SignalingClient;
import org.cbj.peerlink.signal.dto.ConnectionRequest;
import org.cbj.peerlink.signal.dto.DeviceInfo;
import org.cbj.peerlink.signal.dto.DiscoveryResult;
import org.cbj.peerlink.signal.dto.SignalType;
import org.cbj.peerlink.transport.ChannelSpec;
import org.cbj.peerlink.transport.ConnectionState;
import org.cbj.peerlink.transport.PeerTransportManager;
import org.cbj.peerlink.transport.TransportConfig;
import org.cbj.peerlink.transport.platform.FakePeerPlatform;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import org.mockito.InOrder;
import org.slf4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ConnectionManagerTest {

    @Rule
    public Timeout globalTimeout = Timeout.seconds(30);

    private FakePeerPlatform.Network network;
    private InMemorySignalingHub hub;
    private final List<Peer> peers = new ArrayList<>();

    private Peer alice;
    private Peer bob;

    @Before
    public void setUp() {
        network = new FakePeerPlatform.Network();
        hub = new InMemorySignalingHub();
        alice = peer("alice", fastConnectionProperties());
        bob = peer("bob", fastConnectionProperties());
        alice.signaling.connect().join();
        bob.signaling.connect().join();
    }

    @After
    public void tearDown() {
        peers.forEach(p -> p.manager.destroy());
        hub.shutdown();
        network.shutdown();
    }

    @Test
    public void testInitiateEstablishesConnectionOnBothSides() throws Exception {
        //Act
        ConnectionInfo initiated = alice.manager.initiate("bob").get(5, TimeUnit.SECONDS);

        //Assert
        Assert.assertEquals("bob", initiated.getDeviceId());
        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(alice, "bob") == ConnectionState.CONNECTED));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(bob, "alice") == ConnectionState.CONNECTED));
        Assert.assertEquals(initiated.getId(), alice.manager.getConnectionByDeviceId("bob").orElseThrow().getId());
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.established.size() == 1));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> bob.events.established.size() == 1));
        Assert.assertEquals(1, bob.events.incoming.size());
        Assert.assertEquals("alice", bob.events.incoming.get(0).getFrom());
        Assert.assertTrue(alice.manager.getConnectionStatistics(initiated.getId()).isPresent());
        Assert.assertEquals(1, alice.manager.getConnectionsByState(ConnectionState.CONNECTED).size());
    }

    @Test
    public void testDataFlowsBetweenDevices() throws Exception {
        connect(alice, bob);
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.platform.lastConnection().channel("control").isOpen()));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> bob.platform.lastConnection().channel("control").isOpen()));

        alice.manager.send("bob", "control", "hello bob".getBytes(StandardCharsets.UTF_8));
        bob.manager.send("alice", "control", "hello alice".getBytes(StandardCharsets.UTF_8));

        Assert.assertTrue(TestUtils.waitFlagUp(() -> bob.events.data.size() == 1));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.data.size() == 1));
        Assert.assertEquals("alice/control/hello bob", bob.events.data.get(0));
        Assert.assertEquals("bob/control/hello alice", alice.events.data.get(0));
    }

    @Test
    public void testConcurrentInitiateConvergesOnOneConnection() throws Exception {
        //Act
        CompletableFuture<ConnectionInfo> first = alice.manager.initiate("bob");
        CompletableFuture<ConnectionInfo> second = alice.manager.initiate("bob");

        //Assert
        Assert.assertEquals(first.get(5, TimeUnit.SECONDS).getId(), second.get(5, TimeUnit.SECONDS).getId());
        Assert.assertEquals(1, alice.manager.getAllConnections().size());
        Assert.assertEquals(1, hub.relayed(SignalType.CONNECTION_REQUEST).size());
    }

    @Test
    public void testInitiateReturnsExistingConnectedRecord() throws Exception {
        ConnectionInfo established = connect(alice, bob);

        ConnectionInfo again = alice.manager.initiate("bob").get(5, TimeUnit.SECONDS);

        Assert.assertEquals(established.getId(), again.getId());
        Assert.assertEquals(ConnectionState.CONNECTED, again.getState());
        Assert.assertEquals(1, hub.relayed(SignalType.CONNECTION_REQUEST).size());
    }

    @Test
    public void testSimultaneousInitiateFromBothSidesConverges() throws Exception {
        CompletableFuture<ConnectionInfo> fromAlice = alice.manager.initiate("bob");
        CompletableFuture<ConnectionInfo> fromBob = bob.manager.initiate("alice");

        fromAlice.get(5, TimeUnit.SECONDS);
        fromBob.get(5, TimeUnit.SECONDS);

        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(alice, "bob") == ConnectionState.CONNECTED));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(bob, "alice") == ConnectionState.CONNECTED));
        Assert.assertEquals(1, alice.manager.getAllConnections().size());
        Assert.assertEquals(1, bob.manager.getAllConnections().size());
    }

    @Test
    public void testInitiateToUnreachableDeviceFailsAndKeepsRecord() throws Exception {
        //Act
        CompletableFuture<ConnectionInfo> attempt = alice.manager.initiate("ghost");

        //Assert
        PeerLinkException error = assertFailsWith(ErrorCode.CONNECTION_INIT_FAILED, attempt);
        Assert.assertEquals(ErrorCode.REQUEST_TIMEOUT, ((PeerLinkException) error.getCause()).getCode());
        ConnectionInfo failed = alice.manager.getConnectionByDeviceId("ghost").orElseThrow();
        Assert.assertEquals(ConnectionState.FAILED, failed.getState());
        Assert.assertEquals(ErrorCode.REQUEST_TIMEOUT.getDefaultMessage(), failed.getFailureReason());
        Assert.assertEquals(1, alice.events.failed.size());

        // a new attempt replaces the failed record
        CompletableFuture<ConnectionInfo> retry = alice.manager.initiate("ghost");
        Assert.assertTrue(TestUtils.waitFlagUp(
                () -> !failed.getId().equals(alice.manager.getConnectionByDeviceId("ghost").map(ConnectionInfo::getId).orElse(null))));
        assertFailsWith(ErrorCode.CONNECTION_INIT_FAILED, retry);
    }

    @Test
    public void testTransportCreationFailureFailsInitiate() {
        alice.platform.setFailCreate(true);

        PeerLinkException error = assertFailsWith(ErrorCode.CONNECTION_INIT_FAILED, alice.manager.initiate("bob"));

        Assert.assertEquals(ErrorCode.TRANSPORT_CREATE_FAILED, ((PeerLinkException) error.getCause()).getCode());
        Assert.assertEquals(ConnectionState.FAILED, stateOf(alice, "bob"));
    }

    @Test
    public void testEstablishmentTimeoutFailsFreshConnection() throws Exception {
        network.setBlocked(true);

        alice.manager.initiate("bob").get(5, TimeUnit.SECONDS);

        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.failed.size() == 1));
        Assert.assertEquals(ConnectionState.FAILED, stateOf(alice, "bob"));
        Assert.assertEquals("Peer transport not established in time",
                alice.manager.getConnectionByDeviceId("bob").orElseThrow().getFailureReason());
    }

    @Test
    public void testSendErrors() throws Exception {
        assertSendFails(ErrorCode.CONNECTION_NOT_FOUND, "nobody");

        network.setBlocked(true);
        alice.manager.initiate("bob").get(5, TimeUnit.SECONDS);

        Assert.assertEquals(ConnectionState.CONNECTING, stateOf(alice, "bob"));
        assertSendFails(ErrorCode.CONNECTION_NOT_READY, "bob");
    }

    @Test
    public void testCloseNotifiesPeerAndIsIdempotent() throws Exception {
        //Arrange
        ConnectionInfo connection = connect(alice, bob);

        //Act
        alice.manager.close(connection.getId()).get(5, TimeUnit.SECONDS);
        alice.manager.close(connection.getId()).get(5, TimeUnit.SECONDS);
        alice.manager.close("no-such-connection").get(5, TimeUnit.SECONDS);

        //Assert
        Assert.assertEquals(1, alice.events.closed.size());
        Assert.assertEquals("closed by user", alice.events.closeReasons.get(0));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> bob.events.closed.size() == 1));
        Assert.assertEquals("closed by user", bob.events.closeReasons.get(0));
        Assert.assertEquals(1, hub.relayed(SignalType.CONNECTION_CLOSE).size());
        assertSendFails(ErrorCode.CONNECTION_NOT_FOUND, "bob");
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.manager.getConnection(connection.getId()).isEmpty()));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> bob.manager.getAllConnections().isEmpty()));
    }

    @Test
    public void testLostConnectionReconnectsUnderSameId() throws Exception {
        //Arrange
        ConnectionInfo established = connect(alice, bob);

        //Act
        alice.platform.lastConnection().drop();

        //Assert
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.lost.size() == 1));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.reconnected.size() == 1));
        ConnectionInfo recovered = alice.manager.getConnectionByDeviceId("bob").orElseThrow();
        Assert.assertEquals(established.getId(), recovered.getId());
        Assert.assertEquals(ConnectionState.CONNECTED, recovered.getState());
        Assert.assertEquals(0, recovered.getReconnectAttempts());
        Assert.assertTrue(hub.relayed(SignalType.CONNECTION_REQUEST).stream()
                .anyMatch(m -> "alice".equals(m.getFrom()) && m.getData().toString().contains("reconnect=true")));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(bob, "alice") == ConnectionState.CONNECTED));
        Assert.assertEquals(1, bob.manager.getAllConnections().size());
    }

    @Test
    public void testReconnectGivesUpAfterMaxAttempts() throws Exception {
        ConnectionInfo established = connect(alice, bob);
        hub.drop(message -> "bob".equals(message.getFrom()));
        long lostAtMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime());

        alice.platform.lastConnection().drop();

        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.failed.size() == 1, 10, TimeUnit.SECONDS));
        ConnectionInfo failed = alice.manager.getConnection(established.getId()).orElseThrow();
        Assert.assertEquals(ConnectionState.FAILED, failed.getState());
        Assert.assertEquals("Max reconnection attempts reached", failed.getFailureReason());
        Assert.assertEquals(3, failed.getReconnectAttempts());
        Assert.assertEquals(3, hub.relayed(SignalType.CONNECTION_REQUEST).stream()
                .filter(m -> "alice".equals(m.getFrom())).count() - 1);

        // attempt n starts at least reconnectDelay * n after the previous one
        long delayMs = fastConnectionProperties().getReconnectDelay().toMillis();
        List<Long> requests = hub.arrivalTimes(SignalType.CONNECTION_REQUEST, "alice");
        long previous = lostAtMs;
        for (int attempt = 1; attempt <= 3; attempt++) {
            long gap = requests.get(attempt) - previous;
            Assert.assertTrue("attempt " + attempt + " after " + gap + " ms", gap >= delayMs * attempt);
            previous = requests.get(attempt);
        }
    }

    @Test
    public void testLossWithoutReconnectFails() throws Exception {
        alice.manager.initiate("bob", ConnectionOptions.builder().enableReconnect(false).build()).get(5, TimeUnit.SECONDS);
        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(alice, "bob") == ConnectionState.CONNECTED));

        alice.platform.lastConnection().drop();

        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.failed.size() == 1));
        Assert.assertEquals(1, alice.events.lost.size());
        Assert.assertEquals("Connection lost", alice.manager.getConnectionByDeviceId("bob").orElseThrow().getFailureReason());
    }

    @Test
    public void testIdleConnectionIsDetectedByHeartbeat() throws Exception {
        ConnectionProperties properties = fastConnectionProperties();
        properties.setHeartbeatInterval(Duration.ofMillis(100));
        properties.setHeartbeatTimeout(Duration.ofMillis(300));
        Peer carol = peer("carol", properties);
        carol.signaling.connect().join();
        carol.manager.start();

        connect(carol, bob);

        Assert.assertTrue(TestUtils.waitFlagUp(() -> carol.events.lost.size() >= 1));
    }

    @Test
    public void testRenegotiationKeepsConnection() throws Exception {
        ConnectionInfo established = connect(alice, bob);

        alice.manager.renegotiate(established.getId()).get(5, TimeUnit.SECONDS);

        Assert.assertEquals(1, hub.relayed(SignalType.OFFER).size());
        Assert.assertTrue(TestUtils.waitFlagUp(() -> hub.relayed(SignalType.ANSWER).size() == 1));
        Assert.assertEquals(ConnectionState.CONNECTED, stateOf(alice, "bob"));
        Assert.assertEquals(ConnectionState.CONNECTED, stateOf(bob, "alice"));
    }

    @Test
    public void testRenegotiateRequiresConnectedRecord() {
        assertFailsWith(ErrorCode.CONNECTION_NOT_FOUND, alice.manager.renegotiate("no-such-connection"));
    }

    @Test
    public void testRefreshQualityRatesConnection() throws Exception {
        ConnectionInfo established = connect(alice, bob);

        ConnectionQuality quality = alice.manager.refreshQuality(established.getId()).get(5, TimeUnit.SECONDS);

        Assert.assertEquals(QualityRating.GOOD, quality.getRating());
        Assert.assertEquals(8_000_000, quality.getBandwidth(), 1e-6);
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.qualityUpdates.get() >= 1));
        Assert.assertEquals(quality, alice.manager.getConnection(established.getId()).orElseThrow().getQuality());
    }

    @Test
    public void testMonitorPushesQualityToConnections() throws Exception {
        connect(alice, bob);

        alice.manager.start();

        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.initialized.get() == 1));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.qualityUpdates.get() >= 1));
        Assert.assertEquals(QualityRating.GOOD,
                alice.manager.getConnectionByDeviceId("bob").orElseThrow().getQuality().getRating());
    }

    @Test
    public void testDiscoveryFindsOnlineDevices() throws Exception {
        List<DiscoveryResult> found = alice.manager.discoverDevices(200).get(5, TimeUnit.SECONDS);

        Assert.assertEquals(1, found.size());
        Assert.assertEquals("bob", found.get(0).getDeviceId());
        Assert.assertTrue(TestUtils.waitFlagUp(() -> alice.events.discovered.size() == 1));
    }

    @Test
    public void testDiscoveryWithoutSignalingIsEmpty() throws Exception {
        hub.setRefuseConnections(true);
        Peer dave = peer("dave", fastConnectionProperties());

        List<DiscoveryResult> found = dave.manager.discoverDevices(200).get(5, TimeUnit.SECONDS);

        Assert.assertTrue(found.isEmpty());
    }

    @Test
    public void testDestroyClosesConnectionsAndTearsDownComponents() throws Exception {
        connect(alice, bob);

        alice.manager.destroy();
        alice.manager.destroy();

        Assert.assertTrue(TestUtils.waitFlagUp(() -> bob.events.closed.size() == 1));
        Assert.assertEquals("manager destroyed", bob.events.closeReasons.get(0));
        Assert.assertTrue(alice.platform.isShutdown());
        Assert.assertFalse(alice.signaling.isConnected());
        Assert.assertTrue(alice.manager.getAllConnections().isEmpty());
        assertFailsWith(ErrorCode.MANAGER_DESTROYED, alice.manager.initiate("bob"));
    }

    @Test
    public void testDestroyContinuesPastFailingComponent() {
        //Arrange
        PeerTransportManager transports = mock(PeerTransportManager.class);
        SignalingClient signaling = mock(SignalingClient.class);
        NetworkOptimizer optimizer = mock(NetworkOptimizer.class);
        Logger logger = mock(Logger.class);
        IllegalStateException failure = new IllegalStateException("native teardown failed");
        doThrow(failure).when(transports).destroy();
        doThrow(new IllegalStateException("already closed")).when(signaling).destroy();
        ConnectionManager manager = new ConnectionManager(transports, signaling, optimizer,
                fastConnectionProperties(), logger);

        //Act
        manager.destroy();

        //Assert
        InOrder order = inOrder(optimizer, signaling, transports);
        order.verify(optimizer).destroy();
        order.verify(signaling).destroy();
        order.verify(transports).destroy();
        verify(logger).warn(eq("Failed to destroy {}"), eq("signaling client"), any(IllegalStateException.class));
        verify(logger).warn(eq("Failed to destroy {}"), eq("peer transport manager"), eq(failure));
    }

    private ConnectionInfo connect(Peer from, Peer to) throws Exception {
        ConnectionInfo info = from.manager.initiate(to.id).get(5, TimeUnit.SECONDS);
        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(from, to.id) == ConnectionState.CONNECTED));
        Assert.assertTrue(TestUtils.waitFlagUp(() -> stateOf(to, from.id) == ConnectionState.CONNECTED));
        return info;
    }

    private static ConnectionState stateOf(Peer peer, String deviceId) {
        Optional<ConnectionInfo> connection = peer.manager.getConnectionByDeviceId(deviceId);
        return connection.map(ConnectionInfo::getState).orElse(null);
    }

    private void assertSendFails(ErrorCode expected, String deviceId) {
        try {
            alice.manager.send(deviceId, "control", new byte[]{1});
            Assert.fail("expected " + expected);
        } catch (PeerLinkException e) {
            Assert.assertEquals(expected, e.getCode());
        }
    }

    private static PeerLinkException assertFailsWith(ErrorCode expected, CompletableFuture<?> future) {
        try {
            future.get(10, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            PeerLinkException error = PeerLinkException.unwrap(e);
            Assert.assertNotNull("expected PeerLinkException but got " + e.getCause(), error);
            Assert.assertEquals(expected, error.getCode());
            return error;
        } catch (Exception e) {
            throw new AssertionError("unexpected " + e, e);
        }
        throw new AssertionError("expected " + expected);
    }

    private Peer peer(String id, ConnectionProperties connectionProperties) {
        Peer peer = new Peer(id, connectionProperties);
        peers.add(peer);
        return peer;
    }

    private static ConnectionProperties fastConnectionProperties() {
        ConnectionProperties properties = new ConnectionProperties();
        properties.setReconnectDelay(Duration.ofMillis(50));
        properties.setConnectionTimeout(Duration.ofSeconds(1));
        properties.setCloseGrace(Duration.ofMillis(100));
        properties.setChannels(List.of(ChannelSpec.ordered("control")));
        return properties;
    }

    private static SignalingProperties fastSignalingProperties() {
        SignalingProperties properties = new SignalingProperties();
        properties.setConnectTimeout(Duration.ofMillis(500));
        properties.setReconnectDelay(Duration.ofMillis(50));
        properties.setRequestTimeout(Duration.ofMillis(300));
        return properties;
    }

    private final class Peer {
        private final String id;
        private final FakePeerPlatform platform;
        private final SignalingClient signaling;
        private final ConnectionManager manager;
        private final Events events = new Events();

        private Peer(String id, ConnectionProperties connectionProperties) {
            this.id = id;
            this.platform = new FakePeerPlatform(network);
            PeerTransportManager transports = new PeerTransportManager(platform, TransportConfig.defaults(),
                    Duration.ofMillis(100));
            DeviceInfo device = new DeviceInfo();
            device.setName(id);
            this.signaling = new SignalingClient(id, device, fastSignalingProperties(), hub.transport(),
                    InMemorySignalingHub.OBJECT_MAPPER);
            NetworkMediumDetector detector = mock(NetworkMediumDetector.class);
            when(detector.detect()).thenReturn(NetworkMedium.ETHERNET);
            OptimizerProperties optimizerProperties = new OptimizerProperties();
            optimizerProperties.setMonitorInterval(Duration.ofMillis(100));
            NetworkOptimizer optimizer = new NetworkOptimizer(optimizerProperties,
                    () -> new BandwidthProbe.ProbeResult(8_000_000, 2_000_000, 20), detector, new Random(3));
            this.manager = new ConnectionManager(transports, signaling, optimizer, connectionProperties);
            manager.addListener(events);
        }
    }

    private static final class Events implements ConnectionEventListener {
        private final AtomicInteger initialized = new AtomicInteger();
        private final AtomicInteger qualityUpdates = new AtomicInteger();
        private final List<ConnectionRequest> incoming = new CopyOnWriteArrayList<>();
        private final List<ConnectionInfo> established = new CopyOnWriteArrayList<>();
        private final List<ConnectionInfo> lost = new CopyOnWriteArrayList<>();
        private final List<ConnectionInfo> reconnected = new CopyOnWriteArrayList<>();
        private final List<ConnectionInfo> failed = new CopyOnWriteArrayList<>();
        private final List<ConnectionInfo> closed = new CopyOnWriteArrayList<>();
        private final List<String> closeReasons = new CopyOnWriteArrayList<>();
        private final List<String> data = new CopyOnWriteArrayList<>();
        private final List<List<DiscoveryResult>> discovered = new CopyOnWriteArrayList<>();

        @Override
        public void onInitialized() {
            initialized.incrementAndGet();
        }

        @Override
        public void onIncoming(ConnectionRequest request) {
            incoming.add(request);
        }

        @Override
        public void onEstablished(ConnectionInfo connection) {
            established.add(connection);
        }

        @Override
        public void onLost(ConnectionInfo connection) {
            lost.add(connection);
        }

        @Override
        public void onReconnected(ConnectionInfo connection) {
            reconnected.add(connection);
        }

        @Override
        public void onFailed(ConnectionInfo connection, Throwable cause) {
            failed.add(connection);
        }

        @Override
        public void onClosed(ConnectionInfo connection, String reason) {
            closed.add(connection);
            closeReasons.add(reason);
        }

        @Override
        public void onQualityUpdated(String connectionId, ConnectionQuality quality) {
            qualityUpdates.incrementAndGet();
        }

        @Override
        public void onDataReceived(String connectionId, String deviceId, String channel, byte[] bytes) {
            data.add(deviceId + "/" + channel + "/" + new String(bytes, StandardCharsets.UTF_8));
        }

        @Override
        public void onDevicesDiscovered(List<DiscoveryResult> devices) {
            discovered.add(devices);
        }
    }
}
