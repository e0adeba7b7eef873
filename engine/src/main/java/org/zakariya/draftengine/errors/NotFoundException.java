package org.zakariya.draftengine.errors;

/**
 * Unknown draft or section change id.
 */
public class NotFoundException extends DraftEngineException {

	public NotFoundException(String message) {
		super(message);
	}

	@Override
	public int getStatusCode() {
		return 404;
	}
}
