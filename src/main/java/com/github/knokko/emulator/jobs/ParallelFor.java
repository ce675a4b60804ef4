package com.github.knokko.emulator.jobs;

import com.github.knokko.emulator.exceptions.TaskFailureException;

public class ParallelFor {

	/**
	 * Processes the index range {@code [minIndex, maxIndex)} in chunks
	 */
	@FunctionalInterface
	public interface RangeTask {

		void run(int minIndex, int maxIndex);
	}

	/**
	 * <p>
	 *     Splits the range {@code [begin, end)} into contiguous chunks, runs {@code task} once for each chunk on the
	 *     job system, and blocks until all chunks have been processed.
	 * </p>
	 *
	 * <p>
	 *     When {@code jobSystem} is <b>null</b>, or the range contains at most {@code max(1, minGrain)} indices,
	 *     {@code task} will be called only once (on the calling thread) with the whole range.
	 * </p>
	 * @throws TaskFailureException When any chunk threw an exception, or when the job system refused a chunk. This
	 * is only thrown after all dispatched chunks have finished.
	 */
	public static void parallelFor1d(JobSystem jobSystem, int begin, int end, int minGrain, RangeTask task) {
		if (end <= begin) return;
		int count = end - begin;
		if (jobSystem == null || count <= Math.max(1, minGrain)) {
			task.run(begin, end);
			return;
		}

		int grain = Math.max(1, minGrain);
		int workers = Math.max(1, jobSystem.workerCount());
		int chunks = Math.max(1, Math.min(workers * 2, (count + grain - 1) / grain));
		int chunkSize = (count + chunks - 1) / chunks;

		var waitGroup = new WaitGroup();
		var failures = new TaskFailureException.Collector();
		for (int chunk = 0; chunk < chunks; chunk++) {
			int chunkBegin = begin + chunk * chunkSize;
			int chunkEnd = Math.min(end, chunkBegin + chunkSize);
			if (chunkBegin >= chunkEnd) continue;

			String label = "range [" + chunkBegin + ", " + chunkEnd + ")";
			waitGroup.add(1);
			try {
				jobSystem.enqueue(() -> {
					try {
						task.run(chunkBegin, chunkEnd);
					} catch (Throwable failure) {
						failures.add(label, "parallelFor1d", failure);
					} finally {
						waitGroup.done();
					}
				});
			} catch (RuntimeException rejected) {
				waitGroup.done();
				failures.add(label, "parallelFor1d", rejected);
				break;
			}
		}
		waitGroup.await();
		failures.throwIfAny();
	}
}
