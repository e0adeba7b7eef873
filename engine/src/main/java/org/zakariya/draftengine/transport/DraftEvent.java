package org.zakariya.draftengine.transport;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.zakariya.draftengine.drafts.ContentDiff;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * DraftEvent
 * Events pushed to the viewers of a draft. The set of event kinds is closed: every kind is a
 * nested subclass here, and code that must handle all of them does so through {@link Visitor}.
 * On the wire each event is a JSON object whose "type" property names its kind, e.g.
 * <pre>
 * {"type":"section_change_applied","draftId":12,"timestamp":"...","changeId":7}
 * </pre>
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
		getterVisibility = JsonAutoDetect.Visibility.NONE,
		isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
		@JsonSubTypes.Type(value = DraftEvent.UserJoined.class, name = "user_joined"),
		@JsonSubTypes.Type(value = DraftEvent.UserLeft.class, name = "user_left"),
		@JsonSubTypes.Type(value = DraftEvent.ContentUpdate.class, name = "content_update"),
		@JsonSubTypes.Type(value = DraftEvent.SectionChangeApplied.class, name = "section_change_applied"),
		@JsonSubTypes.Type(value = DraftEvent.SectionChangeDismissed.class, name = "section_change_dismissed"),
		@JsonSubTypes.Type(value = DraftEvent.DraftSaved.class, name = "draft_saved"),
		@JsonSubTypes.Type(value = DraftEvent.DraftDeleted.class, name = "draft_deleted")
})
public abstract class DraftEvent {

	public enum Type {
		USER_JOINED("user_joined"),
		USER_LEFT("user_left"),
		CONTENT_UPDATE("content_update"),
		SECTION_CHANGE_APPLIED("section_change_applied"),
		SECTION_CHANGE_DISMISSED("section_change_dismissed"),
		DRAFT_SAVED("draft_saved"),
		DRAFT_DELETED("draft_deleted");

		private final String wireName;

		Type(String wireName) {
			this.wireName = wireName;
		}

		public String getWireName() {
			return wireName;
		}
	}

	public interface Visitor<R> {
		R visit(UserJoined event);

		R visit(UserLeft event);

		R visit(ContentUpdate event);

		R visit(SectionChangeApplied event);

		R visit(SectionChangeDismissed event);

		R visit(DraftSaved event);

		R visit(DraftDeleted event);
	}

	private long draftId;
	private Instant timestamp;

	// no subclasses outside this file
	private DraftEvent() {
	}

	private DraftEvent(long draftId, Instant timestamp) {
		this.draftId = draftId;
		this.timestamp = timestamp;
	}

	public long getDraftId() {
		return draftId;
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	@JsonIgnore
	public abstract Type getType();

	public abstract <R> R accept(Visitor<R> visitor);

	@Override
	public String toString() {
		return getType().getWireName() + "{draftId=" + draftId + ", timestamp=" + timestamp + "}";
	}

	///////////////////////////////////////////////////////////////////

	public static final class UserJoined extends DraftEvent {
		private long userId;

		private UserJoined() {
		}

		public UserJoined(long draftId, long userId, Instant timestamp) {
			super(draftId, timestamp);
			this.userId = userId;
		}

		public long getUserId() {
			return userId;
		}

		@Override
		public Type getType() {
			return Type.USER_JOINED;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class UserLeft extends DraftEvent {
		private long userId;

		private UserLeft() {
		}

		public UserLeft(long draftId, long userId, Instant timestamp) {
			super(draftId, timestamp);
			this.userId = userId;
		}

		public long getUserId() {
			return userId;
		}

		@Override
		public Type getType() {
			return Type.USER_LEFT;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	/**
	 * A manual content edit, carried as a diff against the previous content.
	 */
	public static final class ContentUpdate extends DraftEvent {
		private long userId;
		private List<ContentDiff> diffs = new ArrayList<>();

		private ContentUpdate() {
		}

		public ContentUpdate(long draftId, long userId, List<ContentDiff> diffs, Instant timestamp) {
			super(draftId, timestamp);
			this.userId = userId;
			this.diffs = new ArrayList<>(diffs);
		}

		public long getUserId() {
			return userId;
		}

		public List<ContentDiff> getDiffs() {
			return diffs;
		}

		@Override
		public Type getType() {
			return Type.CONTENT_UPDATE;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	/**
	 * Notification only; receivers re-fetch section state.
	 */
	public static final class SectionChangeApplied extends DraftEvent {
		private long changeId;

		private SectionChangeApplied() {
		}

		public SectionChangeApplied(long draftId, long changeId, Instant timestamp) {
			super(draftId, timestamp);
			this.changeId = changeId;
		}

		public long getChangeId() {
			return changeId;
		}

		@Override
		public Type getType() {
			return Type.SECTION_CHANGE_APPLIED;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	/**
	 * Notification only; receivers re-fetch section state.
	 */
	public static final class SectionChangeDismissed extends DraftEvent {
		private long changeId;

		private SectionChangeDismissed() {
		}

		public SectionChangeDismissed(long draftId, long changeId, Instant timestamp) {
			super(draftId, timestamp);
			this.changeId = changeId;
		}

		public long getChangeId() {
			return changeId;
		}

		@Override
		public Type getType() {
			return Type.SECTION_CHANGE_DISMISSED;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class DraftSaved extends DraftEvent {
		private long docId;
		private long userId;

		private DraftSaved() {
		}

		public DraftSaved(long draftId, long docId, long userId, Instant timestamp) {
			super(draftId, timestamp);
			this.docId = docId;
			this.userId = userId;
		}

		public long getDocId() {
			return docId;
		}

		public long getUserId() {
			return userId;
		}

		@Override
		public Type getType() {
			return Type.DRAFT_SAVED;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}

	public static final class DraftDeleted extends DraftEvent {
		private long userId;

		private DraftDeleted() {
		}

		public DraftDeleted(long draftId, long userId, Instant timestamp) {
			super(draftId, timestamp);
			this.userId = userId;
		}

		public long getUserId() {
			return userId;
		}

		@Override
		public Type getType() {
			return Type.DRAFT_DELETED;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visit(this);
		}
	}
}
