package org.zakariya.draftengine.errors;

/**
 * Base class for failures surfaced by the draft engine. Each failure carries the status
 * a request layer should respond with; the engine itself never speaks HTTP.
 */
public abstract class DraftEngineException extends RuntimeException {

	DraftEngineException(String message) {
		super(message);
	}

	DraftEngineException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return the HTTP-style status code matching this failure
	 */
	public abstract int getStatusCode();
}
