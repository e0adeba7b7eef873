package org.zakariya.draftengine.errors;

/**
 * A section change was addressed through a draft it does not belong to.
 */
public class ForbiddenException extends DraftEngineException {

	public ForbiddenException(String message) {
		super(message);
	}

	@Override
	public int getStatusCode() {
		return 403;
	}
}
