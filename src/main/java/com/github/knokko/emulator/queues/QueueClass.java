package com.github.knokko.emulator.queues;

import static org.lwjgl.vulkan.VK10.*;

/**
 * The 4 queue classes to which submissions can be submitted. The emulator keeps 1 pending list per queue class, and
 * scans them in the order of their ordinals.
 */
public enum QueueClass {
	GRAPHICS(VK_QUEUE_GRAPHICS_BIT),
	COMPUTE(VK_QUEUE_COMPUTE_BIT),
	TRANSFER(VK_QUEUE_TRANSFER_BIT),
	/**
	 * Presentation is a capability of the surface rather than a queue flag, so its {@link #queueFlags} are 0
	 */
	PRESENT(0);

	/**
	 * The <i>VkQueueFlagBits</i> that a real queue family needs to support this queue class
	 */
	public final int queueFlags;

	QueueClass(int queueFlags) {
		this.queueFlags = queueFlags;
	}
}
