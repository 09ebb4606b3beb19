/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.livetranslate.exception.InvalidSessionException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.livetranslate.exception.InvalidMessageException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.livetranslate.exception.PersistenceException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidSessionException",
 *   "message": "Session not found",
 *   "details": "Classroom session expired or invalid: AB12CD",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Stack traces never reach clients; details are logged server-side.
 */
package com.phillippitts.livetranslate.presentation.exception;
