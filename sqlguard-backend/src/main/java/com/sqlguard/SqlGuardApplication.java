package com.sqlguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlGuardApplication.class, args);
    }
}
