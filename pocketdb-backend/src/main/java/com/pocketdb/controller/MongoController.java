package com.pocketdb.controller;

import com.pocketdb.mongo.MongoService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/mongo")
public class MongoController {

    private final MongoService mongoService;

    public MongoController(MongoService mongoService) {
        this.mongoService = mongoService;
    }

    @GetMapping("/databases")
    public List<String> listDatabases() {
        return mongoService.listDatabaseNames();
    }

    @GetMapping("/databases/{database}/collections")
    public List<String> listCollections(@PathVariable("database") String database) {
        return mongoService.listCollections(database);
    }
}
