package org.zakariya.draftengine.fakes;

import org.zakariya.draftengine.relay.DraftEventRelay;
import org.zakariya.draftengine.transport.DraftEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Relay that records publications, or fails every one of them.
 */
public class RecordingRelay implements DraftEventRelay {

	private final boolean failing;
	private final List<DraftEvent> published = new ArrayList<>();
	private final List<Long> excludedUserIds = new ArrayList<>();

	public RecordingRelay() {
		this(false);
	}

	public RecordingRelay(boolean failing) {
		this.failing = failing;
	}

	public synchronized List<DraftEvent> getPublished() {
		return new ArrayList<>(published);
	}

	public synchronized List<Long> getExcludedUserIds() {
		return new ArrayList<>(excludedUserIds);
	}

	@Override
	public synchronized void publish(long draftId, DraftEvent event, Long excludeUserId) {
		if (failing) {
			throw new IllegalStateException("redis unavailable");
		}
		published.add(event);
		excludedUserIds.add(excludeUserId);
	}
}
