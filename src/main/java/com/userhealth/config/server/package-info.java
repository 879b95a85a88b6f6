/**
 * Server configuration.
 *
 * <p>Server configuration lives in {@code server.json5} inside the configuration directory.
 */
package com.userhealth.config.server;
