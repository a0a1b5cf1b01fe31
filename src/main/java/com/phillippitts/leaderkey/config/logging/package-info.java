/**
 * Logging infrastructure: request correlation via Log4j2 ThreadContext.
 */
package com.phillippitts.leaderkey.config.logging;
