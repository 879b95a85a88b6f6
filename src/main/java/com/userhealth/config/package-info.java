/**
 * Configuration foundation.
 *
 * <p>Configuration files are JSON5, parsed leniently so comments and unquoted keys are allowed.
 *
 * <p>The Log4j2 XML file can be replaced via the {@code log4j2} key in {@code server.json5}.
 * <br><b>Example:</b>
 * <pre>log4j2: "cfg/log4j2.xml"</pre>
 */
package com.userhealth.config;
