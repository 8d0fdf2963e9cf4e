package com.pocketdb.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.ServerAddress;
import com.pocketdb.model.BackendKind;
import com.pocketdb.model.ConnectTarget;
import com.pocketdb.registry.ConnectionRegistry;
import com.pocketdb.registry.NotConnectedException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MongoServiceTest {

    private final MongoService service = new MongoService(new ConnectionRegistry());

    @Test
    void buildSettings_usesAdminAsDefaultAuthDatabase() {
        ConnectTarget target = ConnectTarget.builder()
                .host("127.0.0.1")
                .port(40200)
                .username("reader")
                .password("pw")
                .connectTimeoutMs(1500)
                .build();

        MongoClientSettings settings = service.buildSettings(target);

        assertEquals(List.of(new ServerAddress("127.0.0.1", 40200)), settings.getClusterSettings().getHosts());
        assertEquals(1500, settings.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
        assertEquals(1500, settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS));
        assertEquals("reader", settings.getCredential().getUserName());
        assertEquals("admin", settings.getCredential().getSource());
    }

    @Test
    void buildSettings_databaseSelectsAuthSource() {
        ConnectTarget target = ConnectTarget.builder()
                .host("db").port(27017).username("app").password("pw").database("appdb").connectTimeoutMs(1000)
                .build();

        assertEquals("appdb", service.buildSettings(target).getCredential().getSource());
    }

    @Test
    void buildSettings_anonymousHasNoCredential() {
        ConnectTarget target = ConnectTarget.builder().host("db").port(27017).connectTimeoutMs(1000).build();

        assertNull(service.buildSettings(target).getCredential());
    }

    @Test
    void listDatabases_withoutConnectionFails() {
        NotConnectedException ex = assertThrows(NotConnectedException.class, service::listDatabaseNames);
        assertEquals(BackendKind.MONGO, ex.getKind());
    }
}
