package com.phillippitts.livetranslate.presentation.controller;

/**
 * Success envelope used by the session endpoints: {@code {success, data}}.
 */
record ApiResponse<T>(boolean success, T data) {

    static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data);
    }
}
