package org.broadinstitute.strgenotyper.exceptions;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as malformed or inconsistent input data.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message, Throwable cause){
            super("Bad input: " + message, cause);
        }

        public BadInput(String message) {
            super("Bad input: " + message);
        }
    }

    /**
     * Parallel input collections whose lengths should agree but do not.
     */
    public static class DimensionMismatch extends BadInput {
        private static final long serialVersionUID = 0L;

        public DimensionMismatch(final String what, final int expected, final int actual) {
            super(String.format("%s has length %d but %d was expected", what, actual, expected));
        }
    }
}
