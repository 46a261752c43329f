package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Runs one task per input on a bounded thread pool and gathers the results in completion
 * order.
 *
 * <p>
 * A task that throws is logged and counted; it never aborts the other tasks. The pool is
 * created per call and always shut down before returning.
 */
final class FanOut {

	private static final Logger logger = LoggerFactory.getLogger(FanOut.class);

	private FanOut() {
	}

	/**
	 * Outcome of a fan-out: the results of successful tasks in completion order and the
	 * number of failed tasks.
	 */
	record Outcome<R>(List<R> results, int failures) {
	}

	static <T, R> Outcome<R> map(String poolName, List<T> inputs, int maxConcurrency, Function<T, R> task,
			Function<T, String> describe, IntConsumer onCompleted) {
		if (inputs.isEmpty()) {
			return new Outcome<>(List.of(), 0);
		}

		int threads = Math.max(1, Math.min(maxConcurrency, inputs.size()));
		ExecutorService executor = Executors.newFixedThreadPool(threads, namedThreads(poolName));
		CompletionService<R> completionService = new ExecutorCompletionService<>(executor);
		Map<Future<R>, T> submitted = new HashMap<>();
		List<R> results = new ArrayList<>();
		int failures = 0;

		try {
			for (T input : inputs) {
				submitted.put(completionService.submit(() -> task.apply(input)), input);
			}

			for (int completed = 1; completed <= submitted.size(); completed++) {
				Future<R> future = completionService.take();
				try {
					results.add(future.get());
				}
				catch (ExecutionException e) {
					failures++;
					Throwable cause = e.getCause() != null ? e.getCause() : e;
					logger.error("Error processing {}: {}", describe.apply(submitted.get(future)), cause.getMessage(),
							cause);
				}
				onCompleted.accept(completed);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("{} pool interrupted; {} of {} tasks completed, abandoning the rest", poolName,
					results.size() + failures, inputs.size());
		}
		finally {
			executor.shutdownNow();
		}

		return new Outcome<>(results, failures);
	}

	private static ThreadFactory namedThreads(String poolName) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, poolName + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

}
