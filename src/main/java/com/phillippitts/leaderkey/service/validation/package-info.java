/**
 * Validation of the configuration tree.
 *
 * <p>{@link com.phillippitts.leaderkey.service.validation.ConfigValidator} is the seam;
 * {@link com.phillippitts.leaderkey.service.validation.DefaultConfigValidator} is the shipped
 * rule set. Results are indexed by child-index path so a UI row can look up its error directly
 * (see {@code ConfigStore#validationErrorsByPath()}).
 */
package com.phillippitts.leaderkey.service.validation;
