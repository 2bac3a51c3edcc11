package org.cbj.peerlink.transport.platform;

public interface PlatformChannel {

    interface Observer {
        void onOpen();

        void onClose();

        void onMessage(byte[] data);

        void onError(Throwable error);
    }

    String getLabel();

    boolean isOpen();

    boolean isClosed();

    void setObserver(Observer observer);

    void send(byte[] data) throws Exception;

    void close();
}
