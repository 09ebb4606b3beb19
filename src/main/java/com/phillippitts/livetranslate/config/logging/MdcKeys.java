package com.phillippitts.livetranslate.config.logging;

/**
 * ThreadContext keys referenced by the log pattern in {@code log4j2-spring.xml}.
 */
public final class MdcKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String CONNECTION_ID = "connectionId";
    public static final String SESSION_ID = "sessionId";
    public static final String CLASSROOM_CODE = "classroomCode";

    private MdcKeys() {
    }
}
