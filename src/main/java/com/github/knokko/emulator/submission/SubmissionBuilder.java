package com.github.knokko.emulator.submission;

import com.github.knokko.emulator.queues.QueueClass;
import com.github.knokko.emulator.synchronization.PipelineStage;
import com.github.knokko.emulator.synchronization.SignalTimelineSemaphore;
import com.github.knokko.emulator.synchronization.WaitTimelineSemaphore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A builder for {@link EmulatedSubmission}s. By default, the submission will go to the graphics queue, and it won't
 * have any waits, signals, fence, or tasks.
 */
public class SubmissionBuilder {

	private QueueClass queue = QueueClass.GRAPHICS;
	private String label = "";
	private final List<WaitTimelineSemaphore> waits = new ArrayList<>();
	private final List<SignalTimelineSemaphore> signals = new ArrayList<>();
	private long fenceId;
	private boolean allowParallelTasks;
	private final List<EmulatedTask> tasks = new ArrayList<>();

	public SubmissionBuilder() {}

	public SubmissionBuilder(QueueClass queue, String label) {
		queue(queue);
		label(label);
	}

	public SubmissionBuilder queue(QueueClass queue) {
		this.queue = Objects.requireNonNull(queue, "queue");
		return this;
	}

	public SubmissionBuilder label(String label) {
		this.label = Objects.requireNonNull(label, "label");
		return this;
	}

	/**
	 * Lets the submission wait (at {@link PipelineStage#TOP}) until the given semaphore reaches {@code value}
	 */
	public SubmissionBuilder waitFor(long semaphoreId, long value) {
		return waitFor(semaphoreId, value, PipelineStage.TOP);
	}

	public SubmissionBuilder waitFor(long semaphoreId, long value, PipelineStage stage) {
		waits.add(new WaitTimelineSemaphore(semaphoreId, value, stage));
		return this;
	}

	/**
	 * Lets the submission signal the given semaphore to {@code value} (at {@link PipelineStage#BOTTOM})
	 */
	public SubmissionBuilder signal(long semaphoreId, long value) {
		return signal(semaphoreId, value, PipelineStage.BOTTOM);
	}

	public SubmissionBuilder signal(long semaphoreId, long value, PipelineStage stage) {
		signals.add(new SignalTimelineSemaphore(semaphoreId, value, stage));
		return this;
	}

	/**
	 * Lets the submission signal the given fence when it completes. Use 0 for no fence.
	 */
	public SubmissionBuilder fence(long fenceId) {
		this.fenceId = fenceId;
		return this;
	}

	public SubmissionBuilder allowParallelTasks(boolean allowParallelTasks) {
		this.allowParallelTasks = allowParallelTasks;
		return this;
	}

	public SubmissionBuilder task(String label, Runnable action) {
		tasks.add(new EmulatedTask(label, action));
		return this;
	}

	public SubmissionBuilder task(EmulatedTask task) {
		tasks.add(Objects.requireNonNull(task, "task"));
		return this;
	}

	public EmulatedSubmission build() {
		return new EmulatedSubmission(queue, waits, signals, fenceId, allowParallelTasks, tasks, label);
	}
}
