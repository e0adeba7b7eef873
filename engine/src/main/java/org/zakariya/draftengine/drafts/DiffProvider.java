package org.zakariya.draftengine.drafts;

import java.util.List;

/**
 * Computes the structured difference broadcast to viewers on content edits.
 */
public interface DiffProvider {

	List<ContentDiff> diff(String oldText, String newText);
}
