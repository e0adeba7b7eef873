package org.zakariya.draftengine.drafts;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Snapshot of a draft row as the engine sees it.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class Draft {

	private long id;
	private String title;
	private String content;

	public Draft() {
	}

	public Draft(long id, String title, String content) {
		this.id = id;
		this.title = title;
		this.content = content;
	}

	public long getId() {
		return id;
	}

	public String getTitle() {
		return title;
	}

	public String getContent() {
		return content;
	}
}
