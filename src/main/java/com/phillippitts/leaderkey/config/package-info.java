/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.leaderkey.config.ThreadPoolConfig} - config I/O executor,
 *       main executor and the save debounce scheduler</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code leaderkey.*} properties</li>
 *   <li>{@code config.store} - config store collaborators and startup validation</li>
 *   <li>{@code config.navigation} - modifier assignment for sticky and group-run</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filter)</li>
 * </ul>
 */
package com.phillippitts.leaderkey.config;
