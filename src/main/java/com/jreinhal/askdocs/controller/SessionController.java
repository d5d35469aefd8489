package com.jreinhal.askdocs.controller;

import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hands out a fresh identity for clients that keep their own session id, sent back in the
 * session header.
 */
@RestController
@RequestMapping(value={"/api"})
public class SessionController {

    @GetMapping(value={"/session"})
    public ResponseEntity<Map<String, String>> session() {
        return ResponseEntity.ok(Map.of("user_id", UUID.randomUUID().toString()));
    }
}
