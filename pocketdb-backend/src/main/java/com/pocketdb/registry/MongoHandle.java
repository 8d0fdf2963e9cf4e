package com.pocketdb.registry;

import com.mongodb.client.MongoClient;
import com.pocketdb.model.BackendKind;
import com.pocketdb.tunnel.TunnelSession;

/** Mongo client handle. */
public class MongoHandle extends BackendHandle {
    private final MongoClient client;

    public MongoHandle(MongoClient client, TunnelSession tunnel) {
        super(BackendKind.MONGO, tunnel);
        this.client = client;
    }

    public MongoClient getClient() {
        return client;
    }

    @Override
    protected void closeClient() {
        client.close();
    }
}
