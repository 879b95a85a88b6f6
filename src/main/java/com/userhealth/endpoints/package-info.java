/**
 * Embedded HTTP endpoints.
 *
 * <p>The API endpoint serves discovery, health and user routes on the port configured in {@code server.json5}
 * under {@code api.port} (default 5000, overridable with {@code PORT}).
 * <br>The service endpoint serves Prometheus metrics and an uptime probe on {@code service.port} (default 5080).
 *
 * <p>Both run on the JDK {@code com.sun.net.httpserver} server with a fixed worker pool.
 *
 * @see com.userhealth.main.Server
 */
package com.userhealth.endpoints;
