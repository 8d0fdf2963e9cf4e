package com.pocketdb.registry;

import com.pocketdb.model.BackendKind;
import com.pocketdb.tunnel.TunnelSession;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;

/**
 * One multiplexed Lettuce connection; concurrent commands interleave on it.
 */
public class RedisHandle extends BackendHandle {
    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;

    public RedisHandle(RedisClient client, StatefulRedisConnection<String, String> connection, TunnelSession tunnel) {
        super(BackendKind.REDIS, tunnel);
        this.client = client;
        this.connection = connection;
    }

    public StatefulRedisConnection<String, String> getConnection() {
        return connection;
    }

    public RedisCommands<String, String> commands() {
        return connection.sync();
    }

    @Override
    protected void closeClient() {
        try {
            connection.close();
        } finally {
            if (client != null) {
                client.shutdown();
            }
        }
    }
}
