package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide remaining-request budget, one entry per {@link LimitClass}.
 *
 * <p>
 * Every worker thread publishes the rate limit headers of the response it just received;
 * the last writer wins. The budget is advisory: it only drives proactive pacing. The
 * authoritative exhaustion signal is the status of each individual response.
 */
public class RateBudget {

	private static final Logger logger = LoggerFactory.getLogger(RateBudget.class);

	private final Map<LimitClass, AtomicReference<RateLimitInfo>> budgets = new EnumMap<>(LimitClass.class);

	public RateBudget() {
		budgets.put(LimitClass.SEARCH, new AtomicReference<>(new RateLimitInfo(30, 30, -1, 0)));
		budgets.put(LimitClass.CORE, new AtomicReference<>(new RateLimitInfo(5000, 5000, -1, 0)));
	}

	/**
	 * Publish the latest observed rate limit for a limit class.
	 * @param limitClass the quota bucket the response belongs to
	 * @param info the rate limit parsed from the response headers
	 */
	public void update(LimitClass limitClass, RateLimitInfo info) {
		RateLimitInfo previous = budgets.get(limitClass).getAndSet(info);
		if (previous.remaining() != info.remaining()) {
			logger.trace("{} budget: {} -> {} remaining", limitClass.getDisplayName(), previous.remaining(),
					info.remaining());
		}
	}

	/**
	 * Returns the most recently published rate limit for a limit class.
	 * @param limitClass the quota bucket
	 * @return the last observed rate limit (never null)
	 */
	public RateLimitInfo get(LimitClass limitClass) {
		return budgets.get(limitClass).get();
	}

}
