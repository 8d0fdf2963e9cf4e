package com.pocketdb.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.MongoException;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.ConnectTarget;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.MongoHandle;
import com.pocketdb.service.BackendConnector;
import com.pocketdb.service.ConnectFailedException;
import com.pocketdb.tunnel.TunnelSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Document-store probe: connects and lists databases and collections.
 */
@Slf4j
@Service
public class MongoService implements BackendConnector {
    private static final String DEFAULT_AUTH_DATABASE = "admin";

    private final ConnectionRegistry registry;

    public MongoService(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Set<BackendKind> kinds() {
        return EnumSet.of(BackendKind.MONGO);
    }

    @Override
    public MongoHandle open(BackendKind kind, ConnectTarget target, TunnelSession tunnel) {
        MongoClient client = MongoClients.create(buildSettings(target));
        try {
            List<String> names = client.listDatabaseNames().into(new ArrayList<>());
            log.debug("Mongo probe listed {} databases", names.size());
            return new MongoHandle(client, tunnel);
        } catch (MongoException e) {
            client.close();
            throw new ConnectFailedException(kind, e.getMessage(), e);
        }
    }

    MongoClientSettings buildSettings(ConnectTarget target) {
        int timeoutMs = target.getConnectTimeoutMs();
        MongoClientSettings.Builder settings = MongoClientSettings.builder()
                .applicationName("pocketdb")
                .applyToClusterSettings(cluster -> cluster
                        .hosts(List.of(new ServerAddress(target.getHost(), target.getPort())))
                        .serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket.connectTimeout(timeoutMs, TimeUnit.MILLISECONDS));
        if (target.getUsername() != null) {
            String authDb = target.getDatabase() != null ? target.getDatabase() : DEFAULT_AUTH_DATABASE;
            char[] password = target.getPassword() != null ? target.getPassword().toCharArray() : new char[0];
            settings.credential(MongoCredential.createCredential(target.getUsername(), authDb, password));
        }
        return settings.build();
    }

    public List<String> listDatabaseNames() {
        return client().listDatabaseNames().into(new ArrayList<>());
    }

    public List<String> listCollections(String database) {
        return client().getDatabase(database).listCollectionNames().into(new ArrayList<>());
    }

    private MongoClient client() {
        return registry.get(BackendKind.MONGO, MongoHandle.class).getClient();
    }
}
