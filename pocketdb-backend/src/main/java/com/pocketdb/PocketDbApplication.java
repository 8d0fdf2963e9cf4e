package com.pocketdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Local gateway exposing key-value, relational and document stores through one JSON API.
 *
 * <p>Mongo auto-configuration is excluded: clients are created on demand by the connect operation.
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class PocketDbApplication {

    public static void main(String[] args) {
        SpringApplication.run(PocketDbApplication.class, args);
    }
}
