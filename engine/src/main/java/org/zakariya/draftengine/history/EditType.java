package org.zakariya.draftengine.history;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an edit history entry records.
 */
public enum EditType {
	CONTENT("content"),
	TITLE("title"),
	SECTION_APPLY("section_apply"),
	SECTION_DISMISS("section_dismiss");

	private final String wireName;

	EditType(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String getWireName() {
		return wireName;
	}
}
