package com.chambua.schoolsports;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchoolSportsApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchoolSportsApplication.class, args);
    }
}
