/**
 * Translation of exceptions into HTTP error responses at the REST boundary.
 */
package com.phillippitts.leaderkey.presentation.exception;
