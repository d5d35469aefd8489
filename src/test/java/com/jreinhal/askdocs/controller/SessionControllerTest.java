package com.jreinhal.askdocs.controller;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class SessionControllerTest {

    @Test
    void issuesDistinctUuidPerCall() {
        SessionController controller = new SessionController();

        ResponseEntity<Map<String, String>> first = controller.session();
        ResponseEntity<Map<String, String>> second = controller.session();

        assertEquals(HttpStatus.OK, first.getStatusCode());
        String id = first.getBody().get("user_id");
        assertDoesNotThrow(() -> UUID.fromString(id));
        assertNotEquals(id, second.getBody().get("user_id"));
    }
}
