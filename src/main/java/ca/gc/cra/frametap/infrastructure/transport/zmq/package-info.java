/**
 * JeroMQ SUB and PUB adapters for the multipart frame protocol.
 */
package ca.gc.cra.frametap.infrastructure.transport.zmq;
