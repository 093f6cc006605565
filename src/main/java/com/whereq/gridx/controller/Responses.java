package com.whereq.gridx.controller;

import com.whereq.gridx.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Response builders shared by the controllers
 */
final class Responses {

    private Responses() {
    }

    static ResponseEntity<Object> ok(Object body) {
        return ResponseEntity.ok(body);
    }

    static ResponseEntity<Object> status(HttpStatus status, Object body) {
        return ResponseEntity.status(status).body(body);
    }

    static Mono<ResponseEntity<Object>> error(HttpStatus status, String message) {
        return Mono.just(ResponseEntity.status(status).<Object>body(ErrorResponse.of(message)));
    }
}
