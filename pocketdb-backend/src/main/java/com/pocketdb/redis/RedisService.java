package com.pocketdb.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.ConnectTarget;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.RedisHandle;
import com.pocketdb.service.BackendConnector;
import com.pocketdb.service.ConnectFailedException;
import com.pocketdb.tunnel.TunnelSession;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.ProtocolVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Key-value operations over the registered Lettuce connection.
 */
@Slf4j
@Service
public class RedisService implements BackendConnector {
    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    public RedisService(ConnectionRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Set<BackendKind> kinds() {
        return EnumSet.of(BackendKind.REDIS);
    }

    @Override
    public RedisHandle open(BackendKind kind, ConnectTarget target, TunnelSession tunnel) {
        Duration timeout = Duration.ofMillis(target.getConnectTimeoutMs());
        RedisClient client = RedisClient.create(buildUri(target, timeout));
        client.setOptions(ClientOptions.builder()
                .protocolVersion(ProtocolVersion.RESP2)
                .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                .build());

        StatefulRedisConnection<String, String> connection = null;
        try {
            connection = client.connect();
            String pong = connection.sync().ping();
            log.debug("Redis probe answered {}", pong);
            return new RedisHandle(client, connection, tunnel);
        } catch (RedisException e) {
            if (connection != null) {
                connection.close();
            }
            client.shutdown();
            String message = e.getCause() != null && e.getCause().getMessage() != null
                    ? e.getMessage() + ": " + e.getCause().getMessage()
                    : e.getMessage();
            throw new ConnectFailedException(kind, message, e);
        }
    }

    RedisURI buildUri(ConnectTarget target, Duration timeout) {
        RedisURI.Builder uri = RedisURI.builder()
                .withHost(target.getHost())
                .withPort(target.getPort())
                .withTimeout(timeout);
        String password = target.getPassword();
        if (password != null && !password.isEmpty()) {
            if (target.getUsername() != null) {
                uri.withAuthentication(target.getUsername(), password.toCharArray());
            } else {
                uri.withPassword(password.toCharArray());
            }
        }
        if (target.getDatabase() != null) {
            try {
                uri.withDatabase(Integer.parseInt(target.getDatabase().trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Redis database must be a numeric index: " + target.getDatabase());
            }
        }
        return uri.build();
    }

    public List<String> listKeys(String pattern) {
        String effective = pattern == null || pattern.isBlank() ? "*" : pattern;
        return commands().keys(effective);
    }

    /**
     * Read a key according to its type. Strings come back as-is, lists, sets and sorted sets as a
     * JSON array of members and hashes as a JSON object. Other types yield a placeholder text.
     *
     * @param key key to read
     * @return rendered value; null when a string key vanished between the type lookup and the read
     */
    public String getValue(String key) {
        RedisCommands<String, String> commands = commands();
        String type = commands.type(key);
        switch (type) {
            case "string":
                return commands.get(key);
            case "list":
                return toJson(commands.lrange(key, 0, -1));
            case "set":
                return toJson(commands.smembers(key));
            case "zset":
                return toJson(commands.zrange(key, 0, -1));
            case "hash":
                return toJson(commands.hgetall(key));
            default:
                return "Unsupported type: " + type;
        }
    }

    public void setString(String key, String value) {
        commands().set(key, value);
    }

    public long delete(String key) {
        return commands().del(key);
    }

    public void rename(String oldKey, String newKey) {
        commands().rename(oldKey, newKey);
        log.info("Renamed key {} to {}", oldKey, newKey);
    }

    public long getTtl(String key) {
        return commands().ttl(key);
    }

    /**
     * Run a whitespace-separated command line and render its reply. Arguments cannot contain
     * spaces; there is no quoting.
     *
     * @param commandLine command name followed by arguments
     * @return formatted reply
     */
    public String executeRaw(String commandLine) {
        String[] parts = commandLine == null ? new String[0] : commandLine.trim().split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("Command is required");
        }
        CommandArgs<String, String> args = new CommandArgs<>(StringCodec.UTF8);
        Arrays.stream(parts, 1, parts.length).forEach(args::add);

        Object reply = commands().dispatch(new RawCommandType(parts[0]), new RawReplyOutput(), args);
        return RedisReplyFormatter.format(reply);
    }

    private RedisCommands<String, String> commands() {
        return registry.get(BackendKind.REDIS, RedisHandle.class).commands();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode value as JSON", e);
        }
    }
}
