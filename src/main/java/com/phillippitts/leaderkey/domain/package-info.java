/**
 * Configuration tree model.
 *
 * <p>{@link com.phillippitts.leaderkey.domain.Group} and
 * {@link com.phillippitts.leaderkey.domain.Action} are immutable records implementing
 * {@link com.phillippitts.leaderkey.domain.Node}. Structural equality ignores node identity,
 * so a decoded tree equals the tree it was encoded from.
 *
 * @see com.phillippitts.leaderkey.service.config.ConfigCodec
 */
package com.phillippitts.leaderkey.domain;
