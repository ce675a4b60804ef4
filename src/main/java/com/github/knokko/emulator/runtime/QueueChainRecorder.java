package com.github.knokko.emulator.runtime;

import com.github.knokko.emulator.queues.QueueClass;
import com.github.knokko.emulator.submission.EmulatedSubmission;
import com.github.knokko.emulator.submission.EmulatedTask;
import com.github.knokko.emulator.submission.SubmissionBuilder;

import java.util.EnumMap;
import java.util.Map;

/**
 * <p>
 *     Records render passes as submissions that are chained per queue class: each recorded submission waits until
 *     the timeline semaphore of its queue reaches the value that the previous submission on that queue signals.
 *     Submissions on different queues are not ordered relative to each other.
 * </p>
 *
 * <p>
 *     You should create a new recorder after each {@link EmulatedRuntime#beginFrame}, since it reads the current
 *     values of the queue timeline semaphores during construction.
 * </p>
 */
public class QueueChainRecorder {

	private final EmulatedRuntime runtime;
	private final Map<QueueClass, Long> semaphores = new EnumMap<>(QueueClass.class);
	private final Map<QueueClass, Long> cursors = new EnumMap<>(QueueClass.class);

	public QueueChainRecorder(EmulatedRuntime runtime) {
		this.runtime = runtime;
		for (var queue : QueueClass.values()) {
			long semaphore = runtime.queueTimelineSemaphore(queue);
			semaphores.put(queue, semaphore);
			cursors.put(queue, runtime.timelineValue(semaphore));
		}
	}

	/**
	 * @return The semaphore value that the next submission recorded on {@code queue} will wait for
	 */
	public long cursor(QueueClass queue) {
		return cursors.get(queue);
	}

	/**
	 * Submits a single-task submission that runs after the previous submission on the same queue
	 */
	public EmulatedSubmission record(QueueClass queue, String label, Runnable pass) {
		return submit(chain(queue, label).task(label, pass));
	}

	/**
	 * Submits a submission whose tasks may run in parallel, after the previous submission on the same queue
	 */
	public EmulatedSubmission recordParallel(QueueClass queue, String label, EmulatedTask... tasks) {
		var builder = chain(queue, label).allowParallelTasks(true);
		for (var task : tasks) builder.task(task);
		return submit(builder);
	}

	private SubmissionBuilder chain(QueueClass queue, String label) {
		long semaphore = semaphores.get(queue);
		long current = cursors.get(queue);

		var builder = new SubmissionBuilder(queue, label);
		if (current > 0L) builder.waitFor(semaphore, current);
		builder.signal(semaphore, current + 1L);
		cursors.put(queue, current + 1L);
		return builder;
	}

	private EmulatedSubmission submit(SubmissionBuilder builder) {
		var submission = builder.build();
		runtime.submit(submission);
		return submission;
	}
}
