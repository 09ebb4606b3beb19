/**
 * WebSocket wire protocol.
 *
 * <p>Inbound frames are decoded by {@link com.phillippitts.livetranslate.protocol.MessageCodec}
 * into one record per {@link com.phillippitts.livetranslate.protocol.MessageType}; handlers never
 * see raw JSON. Outbound records render themselves with org.json.
 *
 * @since 1.0
 */
package com.phillippitts.livetranslate.protocol;
