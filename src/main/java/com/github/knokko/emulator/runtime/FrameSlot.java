package com.github.knokko.emulator.runtime;

class FrameSlot {

	long frameIndex;
	long fenceId;
	boolean inFlight;

	@Override
	public String toString() {
		return "FrameSlot(frame=" + frameIndex + ",fence=" + fenceId + ",inFlight=" + inFlight + ")";
	}
}
