package com.github.knokko.emulator.jobs;

/**
 * A counting barrier that is used to wait until a group of jobs has finished. You should call {@link #add(int)}
 * before enqueueing the jobs, let each job call {@link #done()} when it finishes, and call {@link #await()} to
 * block until all of them are done.
 */
public class WaitGroup {

	private int counter;

	/**
	 * Increases the counter by {@code amount}
	 */
	public synchronized void add(int amount) {
		if (amount < 0) throw new IllegalArgumentException("amount must be non-negative, but is " + amount);
		counter += amount;
	}

	/**
	 * Decreases the counter by 1, and wakes up the waiting threads when it reaches 0
	 * @throws IllegalStateException When the counter is already 0
	 */
	public synchronized void done() {
		if (counter == 0) throw new IllegalStateException("done() was called more often than add()");
		counter -= 1;
		if (counter == 0) notifyAll();
	}

	/**
	 * Blocks until the counter becomes 0. Returns immediately when it is already 0.
	 */
	public synchronized void await() {
		while (counter > 0) {
			try {
				wait();
			} catch (InterruptedException interrupted) {
				Thread.currentThread().interrupt();
				throw new RuntimeException(interrupted);
			}
		}
	}

	/**
	 * @return The current value of the counter
	 */
	public synchronized int getCount() {
		return counter;
	}
}
