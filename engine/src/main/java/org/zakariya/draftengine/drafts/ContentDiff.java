package org.zakariya.draftengine.drafts;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * One line-oriented hunk of difference between two versions of a draft's content. Receivers
 * apply hunks in order; positions refer to the old content.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class ContentDiff {

	public enum Operation {
		INSERT("insert"),
		DELETE("delete"),
		REPLACE("replace");

		private final String wireName;

		Operation(String wireName) {
			this.wireName = wireName;
		}

		@JsonValue
		public String getWireName() {
			return wireName;
		}
	}

	private Operation operation;
	private int line;
	private List<String> removedLines = new ArrayList<>();
	private List<String> addedLines = new ArrayList<>();

	public ContentDiff() {
	}

	public ContentDiff(Operation operation, int line, List<String> removedLines, List<String> addedLines) {
		this.operation = operation;
		this.line = line;
		this.removedLines = new ArrayList<>(removedLines);
		this.addedLines = new ArrayList<>(addedLines);
	}

	public Operation getOperation() {
		return operation;
	}

	/**
	 * @return zero-based line in the old content where this hunk starts
	 */
	public int getLine() {
		return line;
	}

	public List<String> getRemovedLines() {
		return removedLines;
	}

	public List<String> getAddedLines() {
		return addedLines;
	}

	@Override
	public String toString() {
		return operation.getWireName() + "@" + line + " -" + removedLines.size() + " +" + addedLines.size();
	}
}
