package org.zakariya.draftengine.errors;

/**
 * An external collaborator (draft store, section change store, markup or diff) failed
 * while performing the primary mutation of a request.
 */
public class UpstreamFailureException extends DraftEngineException {

	public UpstreamFailureException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public int getStatusCode() {
		return 502;
	}
}
