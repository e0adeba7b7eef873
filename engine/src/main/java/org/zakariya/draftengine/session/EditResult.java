package org.zakariya.draftengine.session;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.zakariya.draftengine.changes.SectionAnnotation;
import org.zakariya.draftengine.changes.SectionChange;

import java.util.List;

/**
 * Full draft state handed back to the acting user after undo, redo, apply or dismiss, so the
 * client can replace its local state wholesale.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class EditResult {

	private String content;
	private List<SectionAnnotation> sections;
	private List<SectionChange> changes;
	private boolean canUndo;
	private boolean canRedo;

	public EditResult() {
	}

	EditResult(String content, List<SectionAnnotation> sections, List<SectionChange> changes, boolean canUndo, boolean canRedo) {
		this.content = content;
		this.sections = sections;
		this.changes = changes;
		this.canUndo = canUndo;
		this.canRedo = canRedo;
	}

	public String getContent() {
		return content;
	}

	public List<SectionAnnotation> getSections() {
		return sections;
	}

	public List<SectionChange> getChanges() {
		return changes;
	}

	public boolean isCanUndo() {
		return canUndo;
	}

	public boolean isCanRedo() {
		return canRedo;
	}
}
