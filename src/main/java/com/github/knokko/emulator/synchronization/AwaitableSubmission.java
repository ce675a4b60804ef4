package com.github.knokko.emulator.synchronization;

/**
 * Represents an emulated queue submission that can be awaited from the host
 */
public interface AwaitableSubmission {

	/**
	 * @return true if and only if the corresponding submission has completed
	 */
	boolean hasCompleted();

	/**
	 * Waits until the submission completes, by executing the pending submissions of the runtime
	 * @throws IllegalStateException When the submission can never complete
	 */
	void awaitCompletion();
}
