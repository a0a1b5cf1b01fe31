/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.leaderkey.exception.LeaderKeyException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.leaderkey.exception.ConfigDecodeException} - Thrown when
 *       the config document is malformed (bad JSON, unknown type, missing field)</li>
 *   <li>{@link com.phillippitts.leaderkey.exception.ConfigReadException} - Thrown when
 *       the config file cannot be read</li>
 *   <li>{@link com.phillippitts.leaderkey.exception.ConfigWriteException} - Thrown when
 *       the config file or directory cannot be written</li>
 * </ul>
 *
 * <p>Inside {@code ConfigStore} these are caught at the I/O boundary and turned into
 * application events; at the REST boundary they map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.leaderkey.exception.LeaderKeyException
 * @see com.phillippitts.leaderkey.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.leaderkey.exception;
