package org.zakariya.draftengine.changes;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.jetbrains.annotations.Nullable;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class ProposedEdit {

	private String value;

	@Nullable
	private String description;

	public ProposedEdit() {
	}

	public ProposedEdit(String value, @Nullable String description) {
		this.value = value;
		this.description = description;
	}

	/**
	 * @return the proposed replacement or inserted text
	 */
	public String getValue() {
		return value;
	}

	@Nullable
	public String getDescription() {
		return description;
	}
}
