package com.github.knokko.emulator.submission;

import java.util.Objects;

/**
 * A unit of work of a submission
 * @param label The debug label of the task
 * @param action The work to do. When the submission allows parallel tasks, it may be run on a worker thread of the
 *               job system.
 */
public record EmulatedTask(String label, Runnable action) {

	public EmulatedTask {
		Objects.requireNonNull(label, "label");
		Objects.requireNonNull(action, "action");
	}
}
