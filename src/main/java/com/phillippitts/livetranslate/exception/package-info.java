/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so the WebSocket and REST
 * boundaries can map them consistently.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.livetranslate.exception.LiveTranslateException} - Base exception</li>
 *   <li>{@link com.phillippitts.livetranslate.exception.InvalidMessageException} - Malformed
 *       inbound message, empty text or language code</li>
 *   <li>{@link com.phillippitts.livetranslate.exception.ProviderException} - Translation or
 *       synthesis provider failure (degraded, never fatal)</li>
 *   <li>{@link com.phillippitts.livetranslate.exception.DeliveryException} - Socket send failure
 *       (retried, then recorded per listener)</li>
 *   <li>{@link com.phillippitts.livetranslate.exception.PersistenceException} - Repository failure
 *       (logged only)</li>
 *   <li>{@link com.phillippitts.livetranslate.exception.InvalidSessionException} - Unknown or
 *       expired classroom code (user-visible, connection closed)</li>
 * </ul>
 *
 * @see com.phillippitts.livetranslate.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.livetranslate.exception;
