package tech.andrefsramos.elearning_harvester.adapters.outbound.http;

/**
 * Backoff exponencial com piso e teto: {@code clamp(multiplier * 2^(attempt-1), min, max)}.
 * Com os padrões (1s, 1s, 8s) as esperas são 1s, 2s, 4s, 8s, 8s...
 */
public record BackoffPolicy(long multiplierMs, long minMs, long maxMs) {

    public BackoffPolicy {
        multiplierMs = Math.max(0, multiplierMs);
        minMs = Math.max(0, minMs);
        maxMs = Math.max(minMs, maxMs);
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(1_000, 1_000, 8_000);
    }

    /** Espera antes da próxima tentativa, dado o número da tentativa que acabou de falhar (1-based). */
    public long waitMillis(int failedAttempt) {
        int exp = Math.min(Math.max(failedAttempt, 1) - 1, 30);
        long raw = multiplierMs * (1L << exp);
        if (raw < 0) raw = Long.MAX_VALUE;
        return Math.min(Math.max(raw, minMs), maxMs);
    }
}
