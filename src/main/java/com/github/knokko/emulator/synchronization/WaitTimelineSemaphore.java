package com.github.knokko.emulator.synchronization;

import java.util.Objects;

/**
 * A simple tuple(semaphoreId, value, stage) that describes a timeline semaphore wait of a submission
 * @param semaphoreId The id of the timeline semaphore to wait for
 * @param value The submission can only start when the value of the semaphore is at least this value
 * @param stage The pipeline stage that waits, which is only used for diagnostics
 */
public record WaitTimelineSemaphore(long semaphoreId, long value, PipelineStage stage) {

	public WaitTimelineSemaphore {
		Objects.requireNonNull(stage, "stage");
	}

	/**
	 * Waits at {@link PipelineStage#TOP}
	 */
	public WaitTimelineSemaphore(long semaphoreId, long value) {
		this(semaphoreId, value, PipelineStage.TOP);
	}
}
