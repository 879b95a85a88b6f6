/**
 * Configuration bootstrap and server lifecycle.
 */
package com.userhealth.main;
