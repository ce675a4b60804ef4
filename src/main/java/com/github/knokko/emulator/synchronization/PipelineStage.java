package com.github.knokko.emulator.synchronization;

import static org.lwjgl.vulkan.VK10.*;

/**
 * The pipeline stage at which a semaphore is waited or signalled. The emulator only carries this for diagnostics
 * and compatibility with the Vulkan API: it never changes the scheduling.
 */
public enum PipelineStage {
	TOP(VK_PIPELINE_STAGE_TOP_OF_PIPE_BIT),
	DRAW_INDIRECT(VK_PIPELINE_STAGE_DRAW_INDIRECT_BIT),
	VERTEX_INPUT(VK_PIPELINE_STAGE_VERTEX_INPUT_BIT),
	VERTEX_SHADER(VK_PIPELINE_STAGE_VERTEX_SHADER_BIT),
	FRAGMENT_SHADER(VK_PIPELINE_STAGE_FRAGMENT_SHADER_BIT),
	COLOR_OUTPUT(VK_PIPELINE_STAGE_COLOR_ATTACHMENT_OUTPUT_BIT),
	COMPUTE_SHADER(VK_PIPELINE_STAGE_COMPUTE_SHADER_BIT),
	TRANSFER(VK_PIPELINE_STAGE_TRANSFER_BIT),
	BOTTOM(VK_PIPELINE_STAGE_BOTTOM_OF_PIPE_BIT);

	/**
	 * The corresponding <i>VkPipelineStageFlagBits</i>
	 */
	public final int stageMask;

	PipelineStage(int stageMask) {
		this.stageMask = stageMask;
	}
}
