package tessera.engine;

import tessera.db.Bytes;

/**
 * Read-modify-write arithmetic shared by INCRBY and HINCRBY. Callers hold the write lock
 * of their container for the whole call.
 */
final class Counters {
    static final String BAD_TYPE = "Bad Type!";
    static final String OVERFLOW = "ERR increment or decrement would overflow";

    private Counters() { }

    /**
     * @param current stored value, null when absent (counts as 0)
     * @throws NumberFormatException if {@code current} is not a base-10 integer
     * @throws ArithmeticException if the sum does not fit in 64 bits
     */
    static long add(Bytes current, long delta) {
        long base = current == null ? 0 : current.parseLong();
        return Math.addExact(base, delta);
    }
}
