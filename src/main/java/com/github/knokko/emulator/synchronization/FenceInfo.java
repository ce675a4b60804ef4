package com.github.knokko.emulator.synchronization;

/**
 * The state of an emulated fence at the moment it was queried
 * @param fenceId The id of the fence
 * @param signaled Whether the fence was signaled
 */
public record FenceInfo(long fenceId, boolean signaled) {
}
