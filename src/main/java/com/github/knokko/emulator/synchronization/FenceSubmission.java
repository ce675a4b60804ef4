package com.github.knokko.emulator.synchronization;

import com.github.knokko.emulator.runtime.EmulatedRuntime;

/**
 * Represents a current or future submission that will signal an emulated fence
 */
public class FenceSubmission implements AwaitableSubmission {

	private final EmulatedRuntime runtime;
	private final long fenceId;

	/**
	 * Constructs a <i>FenceSubmission</i> that will be considered as <b>completed</b> when the given fence has been
	 * signaled. When the fence is already signaled, this submission will immediately be completed.
	 */
	public FenceSubmission(EmulatedRuntime runtime, long fenceId) {
		this.runtime = runtime;
		this.fenceId = fenceId;
	}

	public long getFenceId() {
		return fenceId;
	}

	@Override
	public boolean hasCompleted() {
		return runtime.isFenceSignaled(fenceId);
	}

	@Override
	public void awaitCompletion() {
		if (hasCompleted()) return;
		runtime.executeAll();
		if (!hasCompleted()) {
			throw new IllegalStateException("Fence " + fenceId + " is not signaled by any pending submission");
		}
	}

	@Override
	public String toString() {
		return "FenceSubmission(fence=" + fenceId + ",completed=" + hasCompleted() + ")";
	}
}
