package com.github.knokko.emulator.exceptions;

/**
 * This exception will be thrown by {@link com.github.knokko.emulator.runtime.EmulatedRuntime#executeAll()} when a
 * task of a submission throws an exception, and by
 * {@link com.github.knokko.emulator.jobs.ParallelFor#parallelFor1d} when one of its chunks throws. The original
 * exception is the cause. When multiple tasks of the same submission failed in parallel, the other failures are
 * added as suppressed exceptions.
 */
public class TaskFailureException extends RuntimeException {

	public final String taskLabel;
	public final String submissionLabel;

	public TaskFailureException(String taskLabel, String submissionLabel, Throwable cause) {
		super("Task " + taskLabel + " of " + submissionLabel + " failed: " + cause, cause);
		this.taskLabel = taskLabel;
		this.submissionLabel = submissionLabel;
	}

	/**
	 * Gathers the failures of tasks that run concurrently, so that they can be rethrown on the thread that waited
	 * for them.
	 */
	public static class Collector {

		private TaskFailureException first;

		public synchronized void add(String taskLabel, String submissionLabel, Throwable failure) {
			if (first == null) first = new TaskFailureException(taskLabel, submissionLabel, failure);
			else first.addSuppressed(failure);
		}

		public synchronized void throwIfAny() {
			if (first != null) throw first;
		}
	}
}
