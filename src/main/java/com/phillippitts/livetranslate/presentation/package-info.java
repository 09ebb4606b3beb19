/**
 * Presentation layer: the WebSocket endpoint, REST controllers and exception handling.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - classroom WebSocket endpoint and its connection adapter</li>
 *   <li>{@code presentation.controller} - REST controllers for session and classroom lookups</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Presentation depends on service but not vice versa; the service layer sees sockets only
 * through {@link com.phillippitts.livetranslate.service.registry.ClientConnection}.
 */
package com.phillippitts.livetranslate.presentation;
