/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /api/sessions/{sessionId}/status} - listeners and language mix of one session</li>
 *   <li>{@code GET /api/sessions/active} - every session with live connections or an active record</li>
 *   <li>{@code GET /api/classrooms/{code}} - resolves a classroom code without renewing it</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they delegate to services and let
 * {@code GlobalExceptionHandler} map exceptions to HTTP responses.
 */
package com.phillippitts.livetranslate.presentation.controller;
