/**
 * Ports through which the upload core reaches the outside world: the session store,
 * the durable catalog, the analysis dispatcher and live duplex connections.
 * Adapters live in the server module; {@code port.impl} holds the in-memory store.
 */
package vn.com.fecredit.videoupload.port;
