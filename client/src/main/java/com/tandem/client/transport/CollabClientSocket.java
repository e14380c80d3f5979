package com.tandem.client.transport;

import io.micronaut.websocket.CloseReason;
import io.micronaut.websocket.WebSocketSession;
import io.micronaut.websocket.annotation.ClientWebSocket;
import io.micronaut.websocket.annotation.OnClose;
import io.micronaut.websocket.annotation.OnMessage;
import io.micronaut.websocket.annotation.OnOpen;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Client end of {@code /ws/collab}, adapted to {@link TransportChannel}. */
@ClientWebSocket
public abstract class CollabClientSocket implements TransportChannel {

    private static final Logger log = LoggerFactory.getLogger(CollabClientSocket.class);

    private volatile WebSocketSession session;
    private volatile ChannelListener listener;

    void bind(ChannelListener listener) {
        this.listener = listener;
    }

    @OnOpen
    public void onOpen(WebSocketSession session) {
        this.session = session;
        log.debug("Collab socket open: {}", session.getId());
    }

    @OnMessage
    public void onMessage(String frame) {
        ChannelListener l = listener;
        if (l != null) {
            l.onFrame(frame);
        }
    }

    @OnClose
    public void onClose(CloseReason reason) {
        log.debug("Collab socket closed: {}", reason);
        ChannelListener l = listener;
        if (l != null) {
            l.onClosed();
        }
    }

    @Override
    public boolean send(String frame) {
        WebSocketSession s = session;
        if (s == null || !s.isOpen()) {
            return false;
        }
        s.sendAsync(frame).whenComplete((sent, error) -> {
            if (error != null) {
                log.debug("Send failed: {}", error.getMessage());
            }
        });
        return true;
    }

    @Override
    public boolean isOpen() {
        WebSocketSession s = session;
        return s != null && s.isOpen();
    }

    @Override
    public void close() {
        WebSocketSession s = session;
        if (s != null && s.isOpen()) {
            s.close(CloseReason.NORMAL);
        }
    }
}
