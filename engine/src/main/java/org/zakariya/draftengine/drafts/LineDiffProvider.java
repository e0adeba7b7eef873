package org.zakariya.draftengine.drafts;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Default {@link DiffProvider}: a line diff computed with java-diff-utils' Myers implementation.
 */
public class LineDiffProvider implements DiffProvider {

	@Override
	public List<ContentDiff> diff(String oldText, String newText) {
		Patch<String> patch = DiffUtils.diff(lines(oldText), lines(newText));

		List<ContentDiff> diffs = new ArrayList<>();
		for (AbstractDelta<String> delta : patch.getDeltas()) {
			ContentDiff.Operation operation;
			switch (delta.getType()) {
				case INSERT:
					operation = ContentDiff.Operation.INSERT;
					break;
				case DELETE:
					operation = ContentDiff.Operation.DELETE;
					break;
				case CHANGE:
					operation = ContentDiff.Operation.REPLACE;
					break;
				default:
					continue;
			}

			diffs.add(new ContentDiff(operation,
					delta.getSource().getPosition(),
					delta.getSource().getLines(),
					delta.getTarget().getLines()));
		}

		return diffs;
	}

	private static List<String> lines(String text) {
		if (text == null || text.isEmpty()) {
			return Collections.emptyList();
		}
		return Arrays.asList(text.split("\n", -1));
	}
}
