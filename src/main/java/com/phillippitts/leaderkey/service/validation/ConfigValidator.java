package com.phillippitts.leaderkey.service.validation;

import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.ValidationError;

import java.util.List;

/**
 * Rule set applied to the configuration tree after every load and edit.
 *
 * <p>Implementations must be pure and total: the same tree always yields the same list,
 * and no input makes them throw.
 */
public interface ConfigValidator {

    List<ValidationError> validate(Group root);
}
