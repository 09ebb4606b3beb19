/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>HTTP requests are tagged by {@link com.phillippitts.livetranslate.config.logging.MdcFilter};
 * WebSocket messages are tagged by the socket handler for the duration of each inbound frame.
 * Worker pools copy the context to their threads, so fan-out logs carry the originating
 * connection.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - HTTP request correlation id (UUID unless supplied)</li>
 *   <li>{@code connectionId} - WebSocket connection id</li>
 *   <li>{@code sessionId} - classroom session the connection belongs to</li>
 *   <li>{@code classroomCode} - code carried on the upgrade request, if any</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] [connectionId] [sessionId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.livetranslate.config.logging;
