package net.recipecatalog.exception;

/**
 * Thrown when two embedding vectors of different lengths are compared.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    /**
     * @param expected dimensions of the first vector
     * @param actual dimensions of the second vector
     */
    public DimensionMismatchException(int expected, int actual) {
        super("Vector length mismatch: first vector has " + expected
            + " dimensions, second vector has " + actual + " dimensions");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
