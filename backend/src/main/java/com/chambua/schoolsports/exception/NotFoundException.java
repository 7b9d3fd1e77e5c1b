package com.chambua.schoolsports.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ApiException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }

    public static NotFoundException manager() { return new NotFoundException("Manager not found"); }
    public static NotFoundException team() { return new NotFoundException("Team not found"); }
    public static NotFoundException sport() { return new NotFoundException("Sport not found"); }
    public static NotFoundException student() { return new NotFoundException("Student not found"); }
    public static NotFoundException coach() { return new NotFoundException("Coach not found"); }
}
