/**
 * Presentation layer: REST controllers and the exception-to-HTTP mapping.
 */
package com.phillippitts.leaderkey.presentation;
