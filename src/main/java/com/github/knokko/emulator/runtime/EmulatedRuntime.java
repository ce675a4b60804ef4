package com.github.knokko.emulator.runtime;

import com.github.knokko.emulator.exceptions.TaskFailureException;
import com.github.knokko.emulator.jobs.JobSystem;
import com.github.knokko.emulator.jobs.WaitGroup;
import com.github.knokko.emulator.queues.QueueClass;
import com.github.knokko.emulator.submission.EmulatedSubmission;
import com.github.knokko.emulator.submission.EmulatedTask;
import com.github.knokko.emulator.synchronization.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <p>
 *     Emulates the queue submission and synchronization model of Vulkan on the CPU: submissions are added to the
 *     pending list of their queue class, and {@link #executeAll()} runs them in an order that respects their timeline
 *     semaphore waits. Fences and frame slots are used to limit the number of frames in flight.
 * </p>
 *
 * <p>
 *     This class is <b>not</b> thread-safe: a single 'frame driver' thread should call
 *     {@link #beginFrame}, {@link #submit}, {@link #executeAll()}, and {@link #endFrame()}, typically in that order
 *     for each frame. The only concurrency happens inside {@link #executeAll()}, where the tasks of a submission may
 *     be dispatched to the job system. The runtime waits until all those tasks are finished before it touches its
 *     own state again, so its state is never accessed by the worker threads.
 * </p>
 */
public class EmulatedRuntime {

	private static final Logger log = LoggerFactory.getLogger(EmulatedRuntime.class);

	private final SemaphoreRegistry semaphores = new SemaphoreRegistry();
	private final FenceRegistry fences = new FenceRegistry();
	private final Map<QueueClass, List<EmulatedSubmission>> pending = new EnumMap<>(QueueClass.class);
	private final Map<QueueClass, Long> queueTimelineSemaphores = new EnumMap<>(QueueClass.class);

	private RuntimeConfig config;
	private FrameSlot[] frameSlots;
	private JobSystem jobSystem;
	private long currentFrameIndex;

	private long submissions, submissionsExecuted, stalledSubmissions, tasksExecuted, tasksParallel;

	/**
	 * Creates a runtime with the default configuration and without job system, so all tasks will be run on the
	 * thread that calls {@link #executeAll()}
	 */
	public EmulatedRuntime() {
		this(null);
	}

	/**
	 * Creates a runtime with the default configuration
	 * @param jobSystem The job system to which parallel tasks will be dispatched, may be <b>null</b>
	 */
	public EmulatedRuntime(JobSystem jobSystem) {
		for (var queue : QueueClass.values()) pending.put(queue, new ArrayList<>());
		this.jobSystem = jobSystem;
		configure(RuntimeConfig.DEFAULT);
	}

	/**
	 * Changes the configuration of this runtime. This will reset all frame slots, so you should normally call this
	 * before the first {@link #beginFrame}.
	 */
	public void configure(RuntimeConfig config) {
		Objects.requireNonNull(config, "config");
		if (config.framesInFlight() < 1) config = new RuntimeConfig(1, config.allowParallelTasks());
		this.config = config;
		this.frameSlots = new FrameSlot[config.framesInFlight()];
		for (int index = 0; index < frameSlots.length; index++) frameSlots[index] = new FrameSlot();
	}

	/**
	 * A shortcut for {@code configure(new RuntimeConfig(framesInFlight, allowParallelTasks))}
	 */
	public void configure(int framesInFlight, boolean allowParallelTasks) {
		configure(new RuntimeConfig(framesInFlight, allowParallelTasks));
	}

	/**
	 * Changes the job system to which parallel tasks will be dispatched. When {@code jobSystem} is <b>null</b>, all
	 * tasks will be run on the thread that calls {@link #executeAll()}.
	 */
	public void setJobSystem(JobSystem jobSystem) {
		this.jobSystem = jobSystem;
	}

	public JobSystem jobSystem() {
		return jobSystem;
	}

	public RuntimeConfig config() {
		return config;
	}

	public int framesInFlight() {
		return frameSlots.length;
	}

	public long currentFrameIndex() {
		return currentFrameIndex;
	}

	private FrameSlot currentSlot() {
		return frameSlots[(int) Long.remainderUnsigned(currentFrameIndex, frameSlots.length)];
	}

	/**
	 * <p>
	 *     Starts frame {@code frameIndex}: resets the stats, drops all submissions that were not executed yet, and
	 *     claims the frame slot {@code frameIndex % framesInFlight}.
	 * </p>
	 *
	 * <p>
	 *     When the previous frame that used the same slot is still in flight, this method will wait until the job
	 *     system is idle, and then consider that frame retired. This ensures that at most {@code framesInFlight}
	 *     frames are in flight at the same time.
	 * </p>
	 */
	public void beginFrame(long frameIndex) {
		currentFrameIndex = frameIndex;
		submissions = 0;
		submissionsExecuted = 0;
		stalledSubmissions = 0;
		tasksExecuted = 0;
		tasksParallel = 0;

		int dropped = pendingSubmissionCount();
		if (dropped > 0) {
			log.warn("Dropping {} submissions that were not executed before frame {} began", dropped, frameIndex);
		}
		for (var queue : pending.values()) queue.clear();

		var slot = currentSlot();
		if (slot.inFlight && slot.fenceId != 0L && !fences.isSignaled(slot.fenceId)) {
			log.debug("Frame {} waits until frame {} has retired", frameIndex, slot.frameIndex);
			if (jobSystem != null) jobSystem.waitIdle();
			fences.signal(slot.fenceId);
		}
		// The retired fence reads as signaled after it's destroyed
		if (slot.fenceId != 0L) fences.destroy(slot.fenceId);
		slot.inFlight = false;
		slot.frameIndex = frameIndex;
		slot.fenceId = 0L;
	}

	/**
	 * Gets the fence that will retire the current frame, and creates it (unsignaled) when this frame doesn't have
	 * one yet. You can pass this fence to the last submission of the frame, so that the next frame that reuses this
	 * frame slot won't need to wait.
	 */
	public long frameFence() {
		var slot = currentSlot();
		if (slot.fenceId == 0L) slot.fenceId = fences.newFence(false);
		return slot.fenceId;
	}

	/**
	 * Ends the current frame, and marks its frame slot as in flight. When the frame slot doesn't have a fence yet,
	 * an unsignaled fence will be created, which the next {@link #beginFrame} of this slot will wait for.
	 */
	public void endFrame() {
		var slot = currentSlot();
		slot.inFlight = true;
		if (slot.fenceId == 0L) slot.fenceId = fences.newFence(false);
		log.debug("Ended frame {} with {}", currentFrameIndex, slot);
	}

	/**
	 * Gets the timeline semaphore of the given queue class, and creates it when it doesn't exist yet
	 */
	public long queueTimelineSemaphore(QueueClass queue) {
		return queueTimelineSemaphores.computeIfAbsent(queue, q -> semaphores.newSemaphore());
	}

	/**
	 * @return The current value of the timeline semaphore, or 0 when it has never been signalled
	 */
	public long timelineValue(long semaphoreId) {
		return semaphores.value(semaphoreId);
	}

	/**
	 * Creates a new timeline semaphore with initial value 0, and returns its id
	 */
	public long newSemaphore() {
		return semaphores.newSemaphore();
	}

	/**
	 * Creates a new fence, and returns its id
	 */
	public long newFence(boolean startSignaled) {
		return fences.newFence(startSignaled);
	}

	/**
	 * @return True if the fence is signaled. Unknown fences are considered to be signaled.
	 */
	public boolean isFenceSignaled(long fenceId) {
		return fences.isSignaled(fenceId);
	}

	/**
	 * Signals the fence from the host
	 */
	public void signalFence(long fenceId) {
		fences.signal(fenceId);
	}

	/**
	 * Marks the fence as unsignaled
	 */
	public void resetFence(long fenceId) {
		fences.reset(fenceId);
	}

	/**
	 * @return The number of fences that are currently tracked. The fence of a frame slot stops being tracked once
	 * the next frame that uses the same slot begins.
	 */
	public int fenceCount() {
		return fences.size();
	}

	public FenceInfo fenceInfo(long fenceId) {
		return fences.info(fenceId);
	}

	/**
	 * @return An {@link AwaitableSubmission} that completes when the semaphore reaches {@code value}
	 */
	public TimelineInstant timelineInstant(long semaphoreId, long value) {
		return new TimelineInstant(this, semaphoreId, value);
	}

	/**
	 * @return An {@link AwaitableSubmission} that completes when the fence is signaled
	 */
	public FenceSubmission fenceSubmission(long fenceId) {
		return new FenceSubmission(this, fenceId);
	}

	/**
	 * Adds the submission to the pending list of its queue. It won't be executed until {@link #executeAll()} is
	 * called. Submissions can be submitted in any order: {@link #executeAll()} takes care of their dependencies.
	 */
	public void submit(EmulatedSubmission submission) {
		Objects.requireNonNull(submission, "submission");
		pending.get(submission.queue()).add(submission);
		submissions += 1;
	}

	/**
	 * @return The total number of submissions that are waiting in the pending lists
	 */
	public int pendingSubmissionCount() {
		int count = 0;
		for (var queue : pending.values()) count += queue.size();
		return count;
	}

	/**
	 * <p>
	 *     Executes all pending submissions. Submissions whose waits are satisfied are executed first, in queue order
	 *     (graphics, compute, transfer, present) and submission order. This is repeated until no pending
	 *     submissions are left.
	 * </p>
	 *
	 * <p>
	 *     When none of the pending submissions can make progress (for instance because of a dependency cycle, or
	 *     because they wait for a semaphore that nothing signals), the first submission of the first non-empty queue
	 *     will be executed anyway, and it will be counted in {@link RuntimeStats#stalledSubmissions()}. Therefore,
	 *     this method always terminates.
	 * </p>
	 * @throws TaskFailureException When a task throws an exception, or when the job system refuses to run a task.
	 * The failing submission is removed, but its signals won't be applied. The other pending submissions remain
	 * pending.
	 */
	public void executeAll() {
		while (true) {
			boolean progressed = false;
			for (var queue : pending.values()) {
				int index = 0;
				while (index < queue.size()) {
					var submission = queue.get(index);
					if (!waitsSatisfied(submission)) {
						index += 1;
						continue;
					}
					queue.remove(index);
					executeSubmission(submission);
					progressed = true;
				}
			}

			if (pendingSubmissionCount() == 0) break;
			if (!progressed) {
				for (var queue : pending.values()) {
					if (queue.isEmpty()) continue;
					var submission = queue.remove(0);
					stalledSubmissions += 1;
					log.warn("Forcing {} although it still waits for {}", submission, unmetWaits(submission));
					executeSubmission(submission);
					break;
				}
			}
		}
	}

	private boolean waitsSatisfied(EmulatedSubmission submission) {
		for (var wait : submission.waits()) {
			if (!semaphores.hasReached(wait.semaphoreId(), wait.value())) return false;
		}
		return true;
	}

	private List<WaitTimelineSemaphore> unmetWaits(EmulatedSubmission submission) {
		var unmet = new ArrayList<WaitTimelineSemaphore>();
		for (var wait : submission.waits()) {
			if (!semaphores.hasReached(wait.semaphoreId(), wait.value())) unmet.add(wait);
		}
		return unmet;
	}

	private void executeSubmission(EmulatedSubmission submission) {
		var tasks = submission.tasks();
		boolean parallel = submission.allowParallelTasks() && config.allowParallelTasks() &&
				jobSystem != null && tasks.size() > 1;

		if (parallel) {
			var waitGroup = new WaitGroup();
			var failures = new TaskFailureException.Collector();
			for (var task : tasks) {
				waitGroup.add(1);
				try {
					jobSystem.enqueue(() -> {
						try {
							task.action().run();
						} catch (Throwable failure) {
							failures.add(task.label(), submission.label(), failure);
						} finally {
							waitGroup.done();
						}
					});
				} catch (RuntimeException rejected) {
					// The job system refused the task, so the remaining tasks won't be dispatched either
					waitGroup.done();
					failures.add(task.label(), submission.label(), rejected);
					break;
				}
			}
			waitGroup.await();
			failures.throwIfAny();
		} else {
			for (EmulatedTask task : tasks) {
				try {
					task.action().run();
				} catch (RuntimeException failure) {
					throw new TaskFailureException(task.label(), submission.label(), failure);
				}
			}
		}

		for (var signal : submission.signals()) semaphores.signal(signal.semaphoreId(), signal.value());
		if (submission.fenceId() != 0L) fences.signal(submission.fenceId());

		submissionsExecuted += 1;
		tasksExecuted += tasks.size();
		if (parallel) tasksParallel += tasks.size();
		log.debug("Executed {} (parallel = {})", submission, parallel);
	}

	/**
	 * @return A snapshot of the counters of the current frame
	 */
	public RuntimeStats stats() {
		return new RuntimeStats(submissions, submissionsExecuted, stalledSubmissions, tasksExecuted, tasksParallel);
	}
}
