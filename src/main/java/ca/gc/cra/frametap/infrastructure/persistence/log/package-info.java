/**
 * Time-windowed annotation logs in JSON-lines or CSV form.
 */
package ca.gc.cra.frametap.infrastructure.persistence.log;
