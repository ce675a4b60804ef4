package com.github.knokko.emulator.synchronization;

import java.util.Objects;

/**
 * A simple tuple(semaphoreId, value, stage) that describes a timeline semaphore signal operation of a submission
 * @param semaphoreId The id of the timeline semaphore to signal
 * @param value The value that the semaphore should reach when the submission completes. When the semaphore already
 *              has a larger value, signalling it has no effect.
 * @param stage The pipeline stage that signals, which is only used for diagnostics
 */
public record SignalTimelineSemaphore(long semaphoreId, long value, PipelineStage stage) {

	public SignalTimelineSemaphore {
		Objects.requireNonNull(stage, "stage");
	}

	/**
	 * Signals at {@link PipelineStage#BOTTOM}
	 */
	public SignalTimelineSemaphore(long semaphoreId, long value) {
		this(semaphoreId, value, PipelineStage.BOTTOM);
	}
}
