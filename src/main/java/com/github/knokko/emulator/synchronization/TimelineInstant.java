package com.github.knokko.emulator.synchronization;

import com.github.knokko.emulator.runtime.EmulatedRuntime;

/**
 * A simple tuple of an emulated timeline semaphore with a corresponding value
 * @param runtime The runtime that owns the timeline semaphore
 * @param semaphoreId The id of the timeline semaphore
 * @param value The value that should be awaited
 */
public record TimelineInstant(EmulatedRuntime runtime, long semaphoreId, long value) implements AwaitableSubmission {

	@Override
	public boolean hasCompleted() {
		return Long.compareUnsigned(runtime.timelineValue(semaphoreId), value) >= 0;
	}

	@Override
	public void awaitCompletion() {
		if (hasCompleted()) return;
		runtime.executeAll();
		if (!hasCompleted()) {
			throw new IllegalStateException("Semaphore " + semaphoreId + " is stuck at " +
					runtime.timelineValue(semaphoreId) + " and will never reach " + value);
		}
	}
}
