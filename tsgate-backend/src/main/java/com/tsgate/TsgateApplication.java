package com.tsgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class TsgateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TsgateApplication.class, args);
    }
}
