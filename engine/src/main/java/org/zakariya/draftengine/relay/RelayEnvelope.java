package org.zakariya.draftengine.relay;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.jetbrains.annotations.Nullable;
import org.zakariya.draftengine.transport.DraftEvent;

/**
 * What travels between processes: the event plus enough routing data for the receiving process
 * to deliver it locally with the same echo suppression, and to ignore its own publications.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
		getterVisibility = JsonAutoDetect.Visibility.NONE,
		isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RelayEnvelope {

	private String origin;
	private long draftId;
	private String eventType;
	@Nullable
	private Long excludeUserId;
	private DraftEvent event;

	public RelayEnvelope() {
	}

	public RelayEnvelope(String origin, long draftId, DraftEvent event, @Nullable Long excludeUserId) {
		this.origin = origin;
		this.draftId = draftId;
		this.eventType = event.getType().getWireName();
		this.excludeUserId = excludeUserId;
		this.event = event;
	}

	/**
	 * @return id of the process which published the envelope
	 */
	public String getOrigin() {
		return origin;
	}

	public long getDraftId() {
		return draftId;
	}

	public String getEventType() {
		return eventType;
	}

	@Nullable
	public Long getExcludeUserId() {
		return excludeUserId;
	}

	public DraftEvent getEvent() {
		return event;
	}
}
