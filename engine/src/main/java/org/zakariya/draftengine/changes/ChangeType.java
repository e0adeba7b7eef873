package org.zakariya.draftengine.changes;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of edit a section change proposes relative to its target section.
 */
public enum ChangeType {
	INSERT_BEFORE("insert-before"),
	INSERT_AFTER("insert-after"),
	UPDATE("update"),
	DELETE("delete");

	private final String wireName;

	ChangeType(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String getWireName() {
		return wireName;
	}
}
