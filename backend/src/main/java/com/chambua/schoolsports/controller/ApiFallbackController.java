package com.chambua.schoolsports.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Lowest-priority match for anything under /api that no other handler claims.
 */
@RestController
@CrossOrigin(origins = "${sports.cors.allowed-origins:*}")
public class ApiFallbackController {
    private static final Logger log = LoggerFactory.getLogger(ApiFallbackController.class);

    @RequestMapping("/api/**")
    public ResponseEntity<Map<String, String>> notFound(HttpServletRequest request) {
        String uri = request.getRequestURI();
        if (request.getQueryString() != null) uri = uri + "?" + request.getQueryString();
        log.info("404 - Route not found: {} {}", request.getMethod(), uri);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Route not found: " + request.getMethod() + " " + uri));
    }
}
