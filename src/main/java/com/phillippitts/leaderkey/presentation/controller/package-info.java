/**
 * REST controllers for local clients: {@code /api/config} and {@code /api/navigation}.
 */
package com.phillippitts.leaderkey.presentation.controller;
