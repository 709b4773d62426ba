/**
 * Validators shared by configuration records and CLI parsing. All failures surface as
 * {@link java.lang.IllegalArgumentException} with the option name in the message.
 */
package ca.gc.cra.frametap.validation;
