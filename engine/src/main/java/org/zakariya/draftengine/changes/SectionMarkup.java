package org.zakariya.draftengine.changes;

import java.util.List;

/**
 * Section boundary detection and patching. The algorithms live outside the engine.
 */
public interface SectionMarkup {

	/**
	 * Split the text into sections and attach the draft's pending changes to them.
	 */
	List<SectionAnnotation> annotate(long draftId, String text);

	/**
	 * @return text with the change merged in
	 */
	String applyChangeToContent(String text, SectionChange change);
}
