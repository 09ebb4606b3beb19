package com.phillippitts.livetranslate.presentation.controller;

import com.phillippitts.livetranslate.exception.InvalidSessionException;
import com.phillippitts.livetranslate.service.classroom.ClassroomCodeEntry;
import com.phillippitts.livetranslate.service.classroom.ClassroomSessionDirectory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets a listener page check a shared link before opening the WebSocket.
 */
@RestController
@RequestMapping("/api/classrooms")
class ClassroomController {

    private final ClassroomSessionDirectory directory;

    ClassroomController(ClassroomSessionDirectory directory) {
        this.directory = directory;
    }

    @GetMapping("/{code}")
    ResponseEntity<ClassroomView> lookup(@PathVariable String code) {
        ClassroomCodeEntry entry = directory.getByCode(code)
                .orElseThrow(() -> new InvalidSessionException(code));
        return ResponseEntity.ok(new ClassroomView(entry.code(), entry.sessionId(),
                entry.expiresAt().toEpochMilli(), entry.presenterConnected()));
    }

    /** {@code expiresAt} in epoch millis, matching the classroom_code WebSocket message. */
    record ClassroomView(String code, String sessionId, long expiresAt, boolean presenterConnected) {
    }
}
