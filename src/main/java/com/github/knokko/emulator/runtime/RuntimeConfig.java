package com.github.knokko.emulator.runtime;

/**
 * The configuration of an {@link EmulatedRuntime}
 * @param framesInFlight The maximum number of frames that can be in flight at the same time. Values smaller than 1
 *                       are treated as 1.
 * @param allowParallelTasks Whether tasks of submissions that allow it may be dispatched to the job system. When
 *                           this is false, all tasks run on the thread that calls {@code executeAll()}.
 */
public record RuntimeConfig(int framesInFlight, boolean allowParallelTasks) {

	public static final RuntimeConfig DEFAULT = new RuntimeConfig(2, true);
}
