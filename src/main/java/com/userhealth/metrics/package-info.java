/**
 * Micrometer metrics.
 */
package com.userhealth.metrics;
