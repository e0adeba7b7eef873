package org.zakariya.draftengine.services;

import org.zakariya.draftengine.transport.DraftEvent;
import org.zakariya.draftengine.transport.JsonCodec;

import java.io.IOException;
import java.io.Writer;

/**
 * Server-Sent Events sink writing one "data:" frame per event. The keep-alive frame is an SSE
 * comment, which clients ignore. The terminal marker of a stream is the request layer's business.
 */
public class SseEventSink implements EventSink {

	static final String KEEP_ALIVE_FRAME = ": keep-alive\n\n";

	private final Writer writer;
	private volatile boolean open = true;

	public SseEventSink(Writer writer) {
		this.writer = writer;
	}

	@Override
	public void send(DraftEvent event) throws IOException {
		write("data: " + JsonCodec.toJson(event) + "\n\n");
	}

	@Override
	public void sendKeepAlive() throws IOException {
		write(KEEP_ALIVE_FRAME);
	}

	@Override
	public boolean isOpen() {
		return open;
	}

	/**
	 * Mark the stream finished; later sends fail. A write already blocked in the writer is not
	 * interrupted.
	 */
	@Override
	public void close() {
		open = false;
	}

	private void write(String frame) throws IOException {
		if (!open) {
			throw new IOException("SSE stream is closed");
		}

		try {
			writer.write(frame);
			writer.flush();
		} catch (IOException e) {
			// the client went away; nothing further will get through
			open = false;
			throw e;
		}
	}
}
