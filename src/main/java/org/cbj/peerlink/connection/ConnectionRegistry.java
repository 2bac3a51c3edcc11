package org.cbj.peerlink.connection;

import org.cbj.peerlink.transport.ConnectionState;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class ConnectionRegistry {

    private final Map<String, ConnectionRecord> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByDevice = new ConcurrentHashMap<>();

    public void register(ConnectionRecord record) {
        byId.put(record.getId(), record);
        idByDevice.put(record.getDeviceId(), record.getId());
    }

    public ConnectionRecord get(String connectionId) {
        return connectionId != null ? byId.get(connectionId) : null;
    }

    public ConnectionRecord findByDevice(String deviceId) {
        String connectionId = deviceId != null ? idByDevice.get(deviceId) : null;
        return connectionId != null ? byId.get(connectionId) : null;
    }

    public ConnectionRecord findByTransport(String transportId) {
        if (transportId == null) {
            return null;
        }
        for (ConnectionRecord record : byId.values()) {
            if (record.isTransport(transportId)) {
                return record;
            }
        }
        return null;
    }

    /** Removes exactly this record. A newer record for the same device stays registered. */
    public boolean remove(ConnectionRecord record) {
        boolean removed = byId.remove(record.getId(), record);
        idByDevice.remove(record.getDeviceId(), record.getId());
        return removed;
    }

    public boolean contains(ConnectionRecord record) {
        return byId.get(record.getId()) == record;
    }

    public List<ConnectionRecord> all() {
        return List.copyOf(byId.values());
    }

    public List<ConnectionRecord> inState(ConnectionState state) {
        return byId.values().stream().filter(r -> r.getState() == state).collect(Collectors.toList());
    }

    public int size() {
        return byId.size();
    }

    public void clear() {
        byId.clear();
        idByDevice.clear();
    }
}
