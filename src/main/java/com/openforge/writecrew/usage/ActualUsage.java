package com.openforge.writecrew.usage;

/**
 * What an executed action really consumed, as reported by the content producer.
 *
 * @param costMicros provider cost in micro-dollars
 * @param provider   provider id that served the call, may be null
 */
public record ActualUsage(int words, long tokens, long costMicros, String provider) {

    public ActualUsage {
        if (words < 0 || tokens < 0 || costMicros < 0) {
            throw new IllegalArgumentException("usage figures must be non-negative");
        }
    }

    public static ActualUsage none() {
        return new ActualUsage(0, 0, 0, null);
    }
}
