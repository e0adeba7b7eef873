package org.zakariya.draftengine.errors;

/**
 * The target is already in the requested state: a change already applied or dismissed,
 * or an undo/redo with nothing to undo/redo.
 */
public class ConflictException extends DraftEngineException {

	public ConflictException(String message) {
		super(message);
	}

	@Override
	public int getStatusCode() {
		return 409;
	}
}
