package com.schemacrud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchemaCrudApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchemaCrudApplication.class, args);
    }
}
