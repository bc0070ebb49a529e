package org.springaicommunity.crm.extractor;

/**
 * Polled predicate used for cancel and pause requests.
 *
 * <p>
 * Evaluated synchronously once per page and, for pause, once per record. Implementations
 * should be cheap and must not block.
 */
@FunctionalInterface
public interface ControlSignal {

	boolean isRequested(String runId);

	static ControlSignal never() {
		return runId -> false;
	}

}
