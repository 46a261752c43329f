package org.springaicommunity.github.harvester;

/**
 * Blocks the calling thread. Extracted so that rate limit waits and courtesy delays can
 * be observed in tests without actually sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Default implementation backed by {@link Thread#sleep(long)}.
	 */
	Sleeper THREAD = Thread::sleep;

	void sleep(long millis) throws InterruptedException;

}
