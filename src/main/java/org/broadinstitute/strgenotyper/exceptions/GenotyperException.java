package org.broadinstitute.strgenotyper.exceptions;

/**
 * <p/>
 * Class GenotyperException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures,
 * misuse of the genotyping engine API and "this should never happen" kinds of scenarios.
 */
public class GenotyperException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public GenotyperException( String msg ) {
        super(msg);
    }

    /*
      Subtypes of GenotyperException for common kinds of errors
     */

    /**
     * Thrown when a component is queried or run before one of its required collaborators has been set or learned.
     */
    public static class NotConfigured extends GenotyperException {
        private static final long serialVersionUID = 0L;

        public NotConfigured( final String componentName ) {
            super(String.format("No %s has been specified or learned", componentName));
        }
    }
}
