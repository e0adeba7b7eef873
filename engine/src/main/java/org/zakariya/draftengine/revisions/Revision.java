package org.zakariya.draftengine.revisions;

import com.google.common.collect.ImmutableSet;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable snapshot in a draft's undo/redo timeline. Besides the full content at this
 * point, a revision records which section changes became applied or dismissed by reaching it,
 * so undo can reverse those flags and redo can restore them.
 */
public final class Revision {

	private final String content;
	private final Instant timestamp;
	private final long authorId;
	private final String description;
	private final ImmutableSet<Long> appliedChangeIds;
	private final ImmutableSet<Long> dismissedChangeIds;

	Revision(String content, Instant timestamp, long authorId, String description,
	         Collection<Long> appliedChangeIds, Collection<Long> dismissedChangeIds) {
		this.content = checkNotNull(content, "content");
		this.timestamp = checkNotNull(timestamp, "timestamp");
		this.authorId = authorId;
		this.description = description != null ? description : "";
		this.appliedChangeIds = ImmutableSet.copyOf(appliedChangeIds);
		this.dismissedChangeIds = ImmutableSet.copyOf(dismissedChangeIds);
	}

	public String getContent() {
		return content;
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	public long getAuthorId() {
		return authorId;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @return ids of section changes newly marked applied by reaching this revision
	 */
	public Set<Long> getAppliedChangeIds() {
		return appliedChangeIds;
	}

	/**
	 * @return ids of section changes newly marked dismissed by reaching this revision
	 */
	public Set<Long> getDismissedChangeIds() {
		return dismissedChangeIds;
	}

	RevisionInfo toInfo() {
		return new RevisionInfo(timestamp, authorId, description, appliedChangeIds, dismissedChangeIds);
	}

	@Override
	public String toString() {
		return "Revision{author=" + authorId + ", description='" + description + "', timestamp=" + timestamp
				+ ", applied=" + appliedChangeIds + ", dismissed=" + dismissedChangeIds + "}";
	}
}
