package com.github.knokko.emulator.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;

/**
 * A simple {@link JobSystem} that runs its jobs on a fixed number of daemon worker threads. Jobs that throw an
 * exception are logged, and won't kill their worker thread.
 */
public class ThreadPoolJobSystem implements JobSystem, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(ThreadPoolJobSystem.class);

	private final List<Thread> workers;
	private final Queue<Runnable> jobs = new ArrayDeque<>();

	private int activeJobs;
	private boolean stopped;

	/**
	 * Starts {@code workerCount} worker threads, or 1 worker thread when {@code workerCount} is not positive
	 * @param name The prefix of the names of the worker threads
	 */
	public ThreadPoolJobSystem(int workerCount, String name) {
		int numWorkers = Math.max(1, workerCount);
		this.workers = new ArrayList<>(numWorkers);
		for (int index = 0; index < numWorkers; index++) {
			var worker = new Thread(this::workerLoop, name + "-" + index);
			worker.setDaemon(true);
			workers.add(worker);
		}
		for (var worker : workers) worker.start();
	}

	@Override
	public void enqueue(Runnable job) {
		Objects.requireNonNull(job, "job");
		synchronized (jobs) {
			if (stopped) throw new IllegalStateException("This job system has already been closed");
			jobs.add(job);
			jobs.notifyAll();
		}
	}

	@Override
	public void waitIdle() {
		synchronized (jobs) {
			while (!jobs.isEmpty() || activeJobs > 0) {
				try {
					jobs.wait();
				} catch (InterruptedException interrupted) {
					Thread.currentThread().interrupt();
					throw new RuntimeException(interrupted);
				}
			}
		}
	}

	@Override
	public int workerCount() {
		return workers.size();
	}

	private void workerLoop() {
		while (true) {
			Runnable job;
			synchronized (jobs) {
				while (jobs.isEmpty() && !stopped) {
					try {
						jobs.wait();
					} catch (InterruptedException interrupted) {
						log.warn("Worker {} was interrupted", Thread.currentThread().getName());
						return;
					}
				}
				if (jobs.isEmpty()) return;
				job = jobs.remove();
				activeJobs += 1;
			}

			try {
				job.run();
			} catch (Throwable failure) {
				log.error("Job failed on worker {}", Thread.currentThread().getName(), failure);
			} finally {
				synchronized (jobs) {
					activeJobs -= 1;
					if (jobs.isEmpty() && activeJobs == 0) jobs.notifyAll();
				}
			}
		}
	}

	/**
	 * Lets the workers finish all jobs that are still queued, and waits until all worker threads have stopped
	 */
	@Override
	public void close() {
		synchronized (jobs) {
			stopped = true;
			jobs.notifyAll();
		}
		for (var worker : workers) {
			try {
				worker.join();
			} catch (InterruptedException interrupted) {
				Thread.currentThread().interrupt();
				throw new RuntimeException(interrupted);
			}
		}
	}
}
