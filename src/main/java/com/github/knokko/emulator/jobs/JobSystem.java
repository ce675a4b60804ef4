package com.github.knokko.emulator.jobs;

/**
 * The thread pool that the emulator dispatches parallel tasks to. The emulator never creates threads itself: the
 * host application should supply an implementation, for instance a {@link ThreadPoolJobSystem}.
 */
public interface JobSystem {

	/**
	 * Schedules {@code job} to be run on one of the worker threads
	 */
	void enqueue(Runnable job);

	/**
	 * Blocks until all jobs that have been enqueued so far have completed
	 */
	void waitIdle();

	/**
	 * @return The number of worker threads
	 */
	int workerCount();
}
