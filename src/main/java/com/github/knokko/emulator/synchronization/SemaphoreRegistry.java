package com.github.knokko.emulator.synchronization;

import java.util.HashMap;
import java.util.Map;

/**
 * <p>
 *     Keeps track of the values of the emulated timeline semaphores. Values are unsigned 64-bit numbers that can only
 *     increase: signalling a semaphore to a value smaller than its current value has no effect.
 * </p>
 *
 * <p>
 *     This class is <b>not</b> thread-safe: it should only be used by the thread that drives the runtime. You
 *     should normally access it via the {@code EmulatedRuntime} rather than creating an instance yourself.
 * </p>
 */
public class SemaphoreRegistry {

	private static final long FIRST_ID_OFFSET = 100L;

	private final Map<Long, Long> values = new HashMap<>();
	private long nextId = FIRST_ID_OFFSET;

	/**
	 * Allocates the id of a new timeline semaphore, whose value is 0. The id is never 0.
	 */
	public long newSemaphore() {
		nextId += 1;
		return nextId;
	}

	/**
	 * @return The current value of the semaphore, or 0 when it has never been signalled (including unknown ids)
	 */
	public long value(long semaphoreId) {
		Long value = values.get(semaphoreId);
		return value != null ? value : 0L;
	}

	/**
	 * @return True if and only if the value of the semaphore is at least {@code value}
	 */
	public boolean hasReached(long semaphoreId, long value) {
		return Long.compareUnsigned(value(semaphoreId), value) >= 0;
	}

	/**
	 * Sets the value of the semaphore to {@code max(currentValue, target)}
	 * @return The value of the semaphore after signalling it
	 */
	public long signal(long semaphoreId, long target) {
		long current = value(semaphoreId);
		if (Long.compareUnsigned(target, current) <= 0) return current;
		values.put(semaphoreId, target);
		return target;
	}
}
