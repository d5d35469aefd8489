package com.jreinhal.askdocs.ratelimit;

import java.time.Duration;

/**
 * Outcome of one check-and-increment against a fixed window bucket.
 *
 * @param admitted whether the request was counted
 * @param count requests counted in the current window, including this one when admitted
 * @param resetIn time until the window rolls over
 */
public record WindowState(boolean admitted, long count, Duration resetIn) {
}
