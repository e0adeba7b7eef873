package org.zakariya.draftengine.relay;

import org.jetbrains.annotations.Nullable;
import org.zakariya.draftengine.transport.DraftEvent;

/**
 * Hands draft events to other processes so their local viewers see them too. Publication is
 * best effort: callers never wait on it and failures are only logged.
 */
public interface DraftEventRelay {

	/**
	 * @param draftId       the draft the event belongs to
	 * @param event         the event
	 * @param excludeUserId a user who must not receive it on any process, or null
	 */
	void publish(long draftId, DraftEvent event, @Nullable Long excludeUserId);
}
