package com.github.knokko.emulator.runtime;

/**
 * A snapshot of the counters of the current frame. All counters are reset by {@link EmulatedRuntime#beginFrame}.
 * @param submissions The number of submissions that were submitted
 * @param submissionsExecuted The number of submissions that were executed, including stalled ones
 * @param stalledSubmissions The number of submissions that were forcibly executed while their waits were not
 *                           satisfied
 * @param tasksExecuted The number of tasks of the executed submissions
 * @param tasksParallel The number of tasks that were dispatched to the job system
 */
public record RuntimeStats(
		long submissions, long submissionsExecuted, long stalledSubmissions, long tasksExecuted, long tasksParallel
) {
}
