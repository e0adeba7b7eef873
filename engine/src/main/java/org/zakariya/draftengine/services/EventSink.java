package org.zakariya.draftengine.services;

import org.zakariya.draftengine.transport.DraftEvent;

import java.io.IOException;

/**
 * The output side of one live viewer's transport, e.g. an SSE response stream or a websocket
 * session. Implementations need not be thread safe; {@link DraftConnection} serializes calls.
 */
public interface EventSink {

	void send(DraftEvent event) throws IOException;

	/**
	 * Push a no-op frame so idle-connection timeouts in proxies don't fire.
	 */
	void sendKeepAlive() throws IOException;

	boolean isOpen();

	/**
	 * Called when the registry gives up on the viewer after a failed or stuck send. Must not
	 * block; a transport that is mid-write should just be marked finished.
	 */
	void close();
}
