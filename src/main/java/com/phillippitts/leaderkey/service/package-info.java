/**
 * Business services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.config} - config file codec, tree edits and the conflict-aware store</li>
 *   <li>{@code service.validation} - validation rules for the config tree</li>
 *   <li>{@code service.navigation} - menu state machine and key handling</li>
 *   <li>{@code service.keys} - key and modifier normalization</li>
 *   <li>{@code service.dispatch} - handoff of actions to the OS integration</li>
 *   <li>{@code service.events}, {@code service.health}, {@code service.metrics} - operational concerns</li>
 * </ul>
 */
package com.phillippitts.leaderkey.service;
