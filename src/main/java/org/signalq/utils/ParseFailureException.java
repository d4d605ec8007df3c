/**
 *
 */
package org.signalq.utils;

/**
 * This exception is thrown when a command's parameters are invalid.
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 3871645299308722610L;

    /**
     * Construct a parse-failure exception with a message.
     *
     * @param message	description of the invalid parameter
     */
    public ParseFailureException(String message) {
        super(message);
    }

    /**
     * Construct a parse-failure exception from a lower-level cause.
     *
     * @param message	description of the invalid parameter
     * @param cause		exception that revealed the problem
     */
    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
