package com.github.knokko.emulator.submission;

import com.github.knokko.emulator.queues.QueueClass;
import com.github.knokko.emulator.synchronization.SignalTimelineSemaphore;
import com.github.knokko.emulator.synchronization.WaitTimelineSemaphore;

import java.util.List;
import java.util.Objects;

/**
 * An emulated queue submission: a batch of tasks together with the timeline semaphores it waits for and signals.
 * You can use {@link SubmissionBuilder} to create instances of this class.
 * @param queue The queue class whose pending list the submission will be added to
 * @param waits The timeline semaphore values that must be reached before the tasks can start
 * @param signals The timeline semaphore values that will be signalled after all tasks have completed
 * @param fenceId The fence that will be signaled after all tasks have completed, or 0 for no fence
 * @param allowParallelTasks Whether the tasks may be run concurrently on the job system
 * @param tasks The tasks, in the order in which they are run when they are not run in parallel
 * @param label The debug label
 */
public record EmulatedSubmission(
		QueueClass queue, List<WaitTimelineSemaphore> waits, List<SignalTimelineSemaphore> signals,
		long fenceId, boolean allowParallelTasks, List<EmulatedTask> tasks, String label
) {

	public EmulatedSubmission {
		Objects.requireNonNull(queue, "queue");
		Objects.requireNonNull(label, "label");
		waits = List.copyOf(waits);
		signals = List.copyOf(signals);
		tasks = List.copyOf(tasks);
	}

	@Override
	public String toString() {
		return "Submission(" + label + " on " + queue + ", " + tasks.size() + " tasks)";
	}
}
