package com.pocketdb.controller;

import com.pocketdb.api.RedisCommandRequest;
import com.pocketdb.api.RedisValueRequest;
import com.pocketdb.api.RenameRequest;
import com.pocketdb.api.RowsAffectedResponse;
import com.pocketdb.api.TextResponse;
import com.pocketdb.redis.RedisService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/redis")
public class RedisController {

    private final RedisService redisService;

    public RedisController(RedisService redisService) {
        this.redisService = redisService;
    }

    @GetMapping("/keys")
    public List<String> listKeys(@RequestParam(value = "pattern", required = false) String pattern) {
        return redisService.listKeys(pattern);
    }

    /**
     * Read a key by its type. Composite values come back as JSON text.
     *
     * GET /v1/redis/keys/{key}
     */
    @GetMapping("/keys/{key}")
    public TextResponse getValue(@PathVariable("key") String key) {
        return new TextResponse(redisService.getValue(key));
    }

    @PutMapping("/keys/{key}")
    public ResponseEntity<Void> setString(@PathVariable("key") String key, @Valid @RequestBody RedisValueRequest request) {
        redisService.setString(key, request.getValue());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/keys/{key}")
    public RowsAffectedResponse delete(@PathVariable("key") String key) {
        return new RowsAffectedResponse(redisService.delete(key));
    }

    @GetMapping("/keys/{key}/ttl")
    public Map<String, Long> getTtl(@PathVariable("key") String key) {
        return Map.of("ttl", redisService.getTtl(key));
    }

    @PostMapping("/keys/rename")
    public ResponseEntity<Void> rename(@Valid @RequestBody RenameRequest request) {
        redisService.rename(request.getOldName(), request.getNewName());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/execute")
    public TextResponse execute(@Valid @RequestBody RedisCommandRequest request) {
        return new TextResponse(redisService.executeRaw(request.getCommand()));
    }
}
