package com.github.knokko.emulator.synchronization;

import java.util.HashMap;
import java.util.Map;

/**
 * Keeps track of the emulated fences, which are simply boolean 'signaled' flags. Like {@link SemaphoreRegistry},
 * this class is <b>not</b> thread-safe.
 */
public class FenceRegistry {

	private static final long FIRST_ID_OFFSET = 10L;

	private final Map<Long, Boolean> fences = new HashMap<>();
	private long nextId = FIRST_ID_OFFSET;

	/**
	 * Creates a new fence
	 * @param startSignaled True if the fence should initially be signaled, false if not
	 * @return The id of the new fence, which is never 0
	 */
	public long newFence(boolean startSignaled) {
		nextId += 1;
		fences.put(nextId, startSignaled);
		return nextId;
	}

	/**
	 * @return True if the fence is signaled. Unknown fence ids are considered to be signaled, so that nothing can
	 * wait forever on a fence that was never created.
	 */
	public boolean isSignaled(long fenceId) {
		Boolean signaled = fences.get(fenceId);
		return signaled == null || signaled;
	}

	/**
	 * Signals the fence. Signalling a fence that is already signaled has no effect. Unknown fence ids (including
	 * 0) are ignored, since they are considered to be signaled anyway.
	 */
	public void signal(long fenceId) {
		fences.replace(fenceId, true);
	}

	/**
	 * Marks a fence that was created by this registry as unsignaled
	 * @throws IllegalArgumentException When the fence was not created by this registry
	 */
	public void reset(long fenceId) {
		if (!fences.containsKey(fenceId)) throw new IllegalArgumentException("Unknown fence " + fenceId);
		fences.put(fenceId, false);
	}

	/**
	 * Forgets the fence. Afterwards, it will be treated like any other unknown fence, so it will be considered
	 * signaled, and it can no longer be reset.
	 */
	public void destroy(long fenceId) {
		fences.remove(fenceId);
	}

	/**
	 * @return The number of fences that were created and not yet destroyed
	 */
	public int size() {
		return fences.size();
	}

	/**
	 * @return The current state of the fence
	 */
	public FenceInfo info(long fenceId) {
		return new FenceInfo(fenceId, isSignaled(fenceId));
	}
}
