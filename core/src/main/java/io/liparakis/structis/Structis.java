package io.liparakis.structis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared constants and utilities for Structis core.
 * Host-agnostic.
 */
public class Structis {
    public static final String PROJECT_ID = "structis";
    public static final Logger LOGGER = LoggerFactory.getLogger(PROJECT_ID);
}
