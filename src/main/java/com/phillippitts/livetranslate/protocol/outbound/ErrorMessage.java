package com.phillippitts.livetranslate.protocol.outbound;

import com.phillippitts.livetranslate.protocol.ErrorCode;
import org.json.JSONObject;

/**
 * User-visible error. Session expiry uses its own {@code session_expired} type so clients can
 * prompt for a new link instead of showing a generic error.
 */
public record ErrorMessage(String message, ErrorCode code) implements OutboundMessage {

    public static ErrorMessage invalidClassroom() {
        return new ErrorMessage("Classroom session expired or invalid. Please ask teacher for new link.",
                ErrorCode.INVALID_CLASSROOM);
    }

    public static ErrorMessage sessionExpired() {
        return new ErrorMessage("Your classroom session has expired. Please ask the teacher for a new link.",
                ErrorCode.SESSION_EXPIRED);
    }

    public static ErrorMessage invalidMessage(String detail) {
        return new ErrorMessage(detail, ErrorCode.INVALID_MESSAGE);
    }

    @Override
    public String type() {
        return code == ErrorCode.SESSION_EXPIRED ? "session_expired" : "error";
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("type", type())
                .put("message", message)
                .put("code", code.name());
    }
}
