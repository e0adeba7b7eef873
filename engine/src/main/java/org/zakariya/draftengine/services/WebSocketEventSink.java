package org.zakariya.draftengine.services;

import org.eclipse.jetty.websocket.api.Session;
import org.zakariya.draftengine.transport.DraftEvent;
import org.zakariya.draftengine.transport.JsonCodec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Sink pushing events as JSON text frames over a Jetty websocket session. Text frames are sent
 * asynchronously so a slow client never blocks a broadcast; keep-alive is a websocket ping.
 */
public class WebSocketEventSink implements EventSink {

	private static final byte[] PING_PAYLOAD = "keep-alive".getBytes(StandardCharsets.UTF_8);

	private final Session session;

	public WebSocketEventSink(Session session) {
		this.session = session;
	}

	public Session getSession() {
		return session;
	}

	@Override
	public void send(DraftEvent event) throws IOException {
		if (!session.isOpen()) {
			throw new IOException("websocket session is closed");
		}
		session.getRemote().sendStringByFuture(JsonCodec.toJson(event));
	}

	@Override
	public void sendKeepAlive() throws IOException {
		if (session.isOpen()) {
			session.getRemote().sendPing(ByteBuffer.wrap(PING_PAYLOAD));
		}
	}

	@Override
	public boolean isOpen() {
		return session.isOpen();
	}

	@Override
	public void close() {
		if (session.isOpen()) {
			session.close();
		}
	}

	@Override
	public String toString() {
		return "WebSocketEventSink{" + session.getRemoteAddress() + "}";
	}
}
