/**
 * Domain models shared by the registry, lifecycle and delivery services.
 *
 * <p>Values are immutable records or enums. The only mutable type is
 * {@link com.phillippitts.livetranslate.domain.SessionUpdate}, a partial-update builder
 * applied by repositories.
 *
 * @since 1.0
 */
package com.phillippitts.livetranslate.domain;
