package org.zakariya.draftengine.changes;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.ArrayList;
import java.util.List;

/**
 * One section of a draft as annotated by {@link SectionMarkup}, with the ids of the pending
 * section changes that target it.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class SectionAnnotation {

	private String path;
	private String title;
	private int startLine;
	private int endLine;
	private List<Long> changeIds = new ArrayList<>();

	public SectionAnnotation() {
	}

	public SectionAnnotation(String path, String title, int startLine, int endLine, List<Long> changeIds) {
		this.path = path;
		this.title = title;
		this.startLine = startLine;
		this.endLine = endLine;
		this.changeIds = new ArrayList<>(changeIds);
	}

	public String getPath() {
		return path;
	}

	public String getTitle() {
		return title;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public List<Long> getChangeIds() {
		return changeIds;
	}
}
