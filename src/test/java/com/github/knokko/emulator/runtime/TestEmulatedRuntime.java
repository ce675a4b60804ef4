package com.github.knokko.emulator.runtime;

import com.github.knokko.emulator.exceptions.TaskFailureException;
import com.github.knokko.emulator.queues.QueueClass;
import com.github.knokko.emulator.submission.EmulatedSubmission;
import com.github.knokko.emulator.submission.SubmissionBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestEmulatedRuntime {

	private static EmulatedSubmission logging(List<String> log, SubmissionBuilder builder, String label) {
		return builder.label(label).task(label, () -> log.add(label)).build();
	}

	@Test
	public void testUnknownSemaphoreReadsZero() {
		var runtime = new EmulatedRuntime();
		assertEquals(0L, runtime.timelineValue(0L));
		assertEquals(0L, runtime.timelineValue(runtime.newSemaphore()));
		assertEquals(0L, runtime.timelineValue(987654321L));
	}

	@Test
	public void testOrderIndependence() {
		for (boolean signalerFirst : new boolean[] { false, true }) {
			var runtime = new EmulatedRuntime();
			runtime.beginFrame(0);
			long x = runtime.newSemaphore();
			var log = new ArrayList<String>();

			var s1 = logging(log, new SubmissionBuilder().signal(x, 1), "S1");
			var s2 = logging(log, new SubmissionBuilder().waitFor(x, 1), "S2");
			if (signalerFirst) {
				runtime.submit(s1);
				runtime.submit(s2);
			} else {
				runtime.submit(s2);
				runtime.submit(s1);
			}
			runtime.executeAll();

			assertEquals(List.of("S1", "S2"), log);
			assertEquals(1L, runtime.timelineValue(x));
			var stats = runtime.stats();
			assertEquals(2L, stats.submissions());
			assertEquals(2L, stats.submissionsExecuted());
			assertEquals(0L, stats.stalledSubmissions());
			assertEquals(2L, stats.tasksExecuted());
			assertEquals(0L, stats.tasksParallel());
		}
	}

	@Test
	public void testDependencyAcrossQueues() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		long upload = runtime.newSemaphore();
		long culling = runtime.newSemaphore();
		long render = runtime.newSemaphore();
		var log = new ArrayList<String>();

		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.PRESENT, "").waitFor(render, 1), "Present"));
		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.GRAPHICS, "")
				.waitFor(culling, 1).waitFor(upload, 1).signal(render, 1), "Render"));
		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.COMPUTE, "")
				.waitFor(upload, 1).signal(culling, 1), "Culling"));
		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.TRANSFER, "").signal(upload, 1), "Upload"));
		runtime.executeAll();

		assertEquals(List.of("Upload", "Culling", "Render", "Present"), log);
		assertEquals(0L, runtime.stats().stalledSubmissions());
		assertEquals(4L, runtime.stats().submissionsExecuted());
	}

	@Test
	public void testSignalsAppliedWithinTheSameQueueScan() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		long semaphore = runtime.newSemaphore();
		var log = new ArrayList<String>();

		runtime.submit(logging(log, new SubmissionBuilder().waitFor(semaphore, 2).signal(semaphore, 3), "Third"));
		runtime.submit(logging(log, new SubmissionBuilder().signal(semaphore, 1), "First"));
		runtime.submit(logging(log, new SubmissionBuilder().waitFor(semaphore, 1).signal(semaphore, 2), "Second"));
		runtime.executeAll();

		assertEquals(List.of("First", "Second", "Third"), log);
		assertEquals(3L, runtime.timelineValue(semaphore));
	}

	@Test
	public void testMonotonicSignals() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		long semaphore = runtime.newSemaphore();

		runtime.submit(new SubmissionBuilder().signal(semaphore, 10).build());
		runtime.submit(new SubmissionBuilder().signal(semaphore, 4).build());
		runtime.executeAll();
		assertEquals(10L, runtime.timelineValue(semaphore));

		runtime.submit(new SubmissionBuilder().signal(semaphore, 2).build());
		runtime.executeAll();
		assertEquals(10L, runtime.timelineValue(semaphore));
	}

	@Test
	public void testCycleTerminates() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		long a = runtime.newSemaphore();
		long b = runtime.newSemaphore();
		var log = new ArrayList<String>();

		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.COMPUTE, "").waitFor(b, 1).signal(a, 1), "A"));
		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.GRAPHICS, "").waitFor(a, 1).signal(b, 1), "B"));
		runtime.executeAll();

		// The graphics queue is scanned first, so B is forced, after which A can run normally
		assertEquals(List.of("B", "A"), log);
		assertEquals(1L, runtime.stats().stalledSubmissions());
		assertEquals(2L, runtime.stats().submissionsExecuted());
		assertEquals(0, runtime.pendingSubmissionCount());
	}

	@Test
	public void testUnreachableWaitIsForced() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		long nobodySignals = runtime.newSemaphore();
		var log = new ArrayList<String>();

		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.TRANSFER, "").waitFor(nobodySignals, 5), "T1"));
		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.TRANSFER, "").waitFor(nobodySignals, 6), "T2"));
		runtime.executeAll();

		assertEquals(List.of("T1", "T2"), log);
		assertEquals(2L, runtime.stats().stalledSubmissions());
		assertEquals(0L, runtime.timelineValue(nobodySignals));
	}

	@Test
	public void testExecuteAllIsIdempotent() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		runtime.submit(new SubmissionBuilder().task("Nothing", () -> {}).build());
		runtime.executeAll();
		var before = runtime.stats();
		runtime.executeAll();
		assertEquals(before, runtime.stats());
		assertEquals(new RuntimeStats(1, 1, 0, 1, 0), before);
	}

	@Test
	public void testSubmitDoesNotExecute() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		var log = new ArrayList<String>();
		long semaphore = runtime.newSemaphore();
		runtime.submit(logging(log, new SubmissionBuilder().signal(semaphore, 1), "S"));

		assertTrue(log.isEmpty());
		assertEquals(0L, runtime.timelineValue(semaphore));
		assertEquals(1, runtime.pendingSubmissionCount());
		assertEquals(new RuntimeStats(1, 0, 0, 0, 0), runtime.stats());
	}

	@Test
	public void testBeginFrameDropsPendingAndResetsStats() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		var log = new ArrayList<String>();
		runtime.submit(logging(log, new SubmissionBuilder(), "Executed"));
		runtime.executeAll();
		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.COMPUTE, ""), "Dropped"));
		runtime.endFrame();

		runtime.beginFrame(1);
		assertEquals(0, runtime.pendingSubmissionCount());
		assertEquals(new RuntimeStats(0, 0, 0, 0, 0), runtime.stats());
		runtime.executeAll();
		assertEquals(List.of("Executed"), log);
	}

	@Test
	public void testFenceOfSubmission() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		long fence = runtime.newFence(false);
		assertFalse(runtime.isFenceSignaled(fence));

		runtime.submit(new SubmissionBuilder().fence(fence).build());
		assertFalse(runtime.fenceInfo(fence).signaled());
		runtime.executeAll();
		assertTrue(runtime.isFenceSignaled(fence));

		runtime.resetFence(fence);
		assertFalse(runtime.isFenceSignaled(fence));
		runtime.signalFence(fence);
		assertTrue(runtime.isFenceSignaled(fence));
		assertTrue(runtime.isFenceSignaled(424242L));
	}

	@Test
	public void testQueueTimelineSemaphoresAreMemoized() {
		var runtime = new EmulatedRuntime();
		long graphics = runtime.queueTimelineSemaphore(QueueClass.GRAPHICS);
		assertEquals(graphics, runtime.queueTimelineSemaphore(QueueClass.GRAPHICS));
		assertNotEquals(graphics, runtime.queueTimelineSemaphore(QueueClass.COMPUTE));
		assertNotEquals(0L, graphics);
	}

	@Test
	public void testRuntimesAreIndependent() {
		var runtime1 = new EmulatedRuntime();
		var runtime2 = new EmulatedRuntime();
		runtime1.beginFrame(0);
		runtime2.beginFrame(0);
		long semaphore = runtime1.newSemaphore();
		assertEquals(semaphore, runtime2.newSemaphore());

		runtime1.submit(new SubmissionBuilder().signal(semaphore, 3).build());
		runtime1.executeAll();
		assertEquals(3L, runtime1.timelineValue(semaphore));
		assertEquals(0L, runtime2.timelineValue(semaphore));
	}

	@Test
	public void testFailingTask() {
		var runtime = new EmulatedRuntime();
		runtime.beginFrame(0);
		long semaphore = runtime.newSemaphore();
		var log = new ArrayList<String>();

		runtime.submit(new SubmissionBuilder(QueueClass.GRAPHICS, "Broken")
				.task("Explode", () -> {
					throw new IllegalStateException("Intentional failure");
				})
				.signal(semaphore, 1)
				.build());
		runtime.submit(logging(log, new SubmissionBuilder(QueueClass.COMPUTE, "").waitFor(semaphore, 1), "Waiter"));

		var failure = assertThrows(TaskFailureException.class, runtime::executeAll);
		assertEquals("Explode", failure.taskLabel);
		assertEquals("Broken", failure.submissionLabel);
		assertInstanceOf(IllegalStateException.class, failure.getCause());
		assertEquals(0L, runtime.timelineValue(semaphore));
		assertEquals(0L, runtime.stats().submissionsExecuted());
		assertEquals(1, runtime.pendingSubmissionCount());

		// The waiter can still be drained, but only by force
		runtime.executeAll();
		assertEquals(List.of("Waiter"), log);
		assertEquals(1L, runtime.stats().stalledSubmissions());
	}

	@Test
	public void testConfigure() {
		var runtime = new EmulatedRuntime();
		assertEquals(RuntimeConfig.DEFAULT, runtime.config());
		assertEquals(2, runtime.framesInFlight());

		runtime.configure(0, false);
		assertEquals(1, runtime.framesInFlight());
		assertEquals(new RuntimeConfig(1, false), runtime.config());

		runtime.configure(new RuntimeConfig(3, true));
		assertEquals(3, runtime.framesInFlight());
		assertTrue(runtime.config().allowParallelTasks());
	}
}
