package com.pocketdb.tunnel;

import com.pocketdb.model.SshTarget;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.forward.AcceptAllForwardingFilter;
import org.apache.sshd.server.keyprovider.SimpleGeneratorHostKeyProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(60)
class TunnelManagerTest {

    private static final String USER = "tunnel";
    private static final String PASSWORD = "secret";

    private SshServer sshd;
    private ServerSocket echo;
    private TunnelManager manager;

    @BeforeEach
    void setUp() throws IOException {
        sshd = SshServer.setUpDefaultServer();
        sshd.setHost("127.0.0.1");
        sshd.setPort(0);
        sshd.setKeyPairProvider(new SimpleGeneratorHostKeyProvider());
        sshd.setPasswordAuthenticator((username, password, session) -> USER.equals(username) && PASSWORD.equals(password));
        sshd.setForwardingFilter(AcceptAllForwardingFilter.INSTANCE);
        sshd.start();

        echo = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"));
        Thread acceptor = new Thread(this::serveEcho, "echo-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();

        manager = new TunnelManager(false, "", 5000);
    }

    @AfterEach
    void tearDown() throws IOException {
        echo.close();
        sshd.stop(true);
    }

    @Test
    void forwardedBytesMatchDirectConnection() throws IOException {
        TunnelSession tunnel = manager.openTunnel("redis", login(PASSWORD), "127.0.0.1", echo.getLocalPort(), 5000);
        try {
            assertTrue(tunnel.getLocalPort() > 0);
            assertTrue(tunnel.isConnected());

            byte[] payload = "PING pocketdb\r\n".getBytes(StandardCharsets.UTF_8);
            assertArrayEquals(payload, roundTrip(tunnel.getLocalPort(), payload));
        } finally {
            tunnel.close();
        }
    }

    @Test
    void eachLocalConnectionGetsItsOwnChannel() throws IOException {
        TunnelSession tunnel = manager.openTunnel("mysql", login(PASSWORD), "127.0.0.1", echo.getLocalPort(), 5000);
        try (Socket first = connect(tunnel.getLocalPort());
             Socket second = connect(tunnel.getLocalPort())) {
            byte[] a = "first".getBytes(StandardCharsets.UTF_8);
            byte[] b = "second-connection".getBytes(StandardCharsets.UTF_8);
            second.getOutputStream().write(b);
            first.getOutputStream().write(a);

            assertArrayEquals(a, readExactly(first, a.length));
            assertArrayEquals(b, readExactly(second, b.length));
        } finally {
            tunnel.close();
        }
    }

    @Test
    void replyStillArrivesAfterClientHalfClose() throws IOException {
        try (ServerSocket replyAfterEof = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            Thread server = new Thread(() -> answerAfterEof(replyAfterEof), "reply-after-eof");
            server.setDaemon(true);
            server.start();

            TunnelSession tunnel = manager.openTunnel("postgres", login(PASSWORD), "127.0.0.1", replyAfterEof.getLocalPort(), 5000);
            try (Socket local = connect(tunnel.getLocalPort())) {
                local.getOutputStream().write("hello".getBytes(StandardCharsets.UTF_8));
                local.getOutputStream().flush();
                local.shutdownOutput();

                String reply = new String(local.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
                assertEquals("RESPONSE:hello", reply);
            } finally {
                tunnel.close();
            }
        }
    }

    @Test
    void unreachableTargetDropsOnlyThatConnection() throws IOException {
        int deadPort;
        try (ServerSocket reserved = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            deadPort = reserved.getLocalPort();
        }
        TunnelSession tunnel = manager.openTunnel("postgres", login(PASSWORD), "127.0.0.1", deadPort, 5000);
        try {
            try (Socket local = connect(tunnel.getLocalPort())) {
                assertTrue(isClosedByPeer(local));
            }
            assertTrue(tunnel.isAccepting());
            assertTrue(tunnel.isConnected());

            try (Socket again = connect(tunnel.getLocalPort())) {
                assertTrue(isClosedByPeer(again));
            }
            assertTrue(tunnel.isAccepting());
        } finally {
            tunnel.close();
        }
    }

    @Test
    void wrongPasswordFailsWithTunnelException() {
        assertThrows(TunnelException.class,
                () -> manager.openTunnel("redis", login("wrong"), "127.0.0.1", echo.getLocalPort(), 5000));
    }

    @Test
    void missingPasswordIsRejectedBeforeConnecting() {
        SshTarget target = SshTarget.builder().host("127.0.0.1").port(1).username(USER).build();

        assertThrows(AuthUnsupportedException.class,
                () -> manager.openTunnel("redis", target, "127.0.0.1", 6379, 5000));
    }

    @Test
    void missingUsernameIsInvalid() {
        SshTarget target = SshTarget.builder().host("127.0.0.1").port(22).password(PASSWORD).build();

        assertThrows(IllegalArgumentException.class,
                () -> manager.openTunnel("redis", target, "127.0.0.1", 6379, 5000));
    }

    @Test
    void closeStopsAcceptingAndDisconnects() throws Exception {
        TunnelSession tunnel = manager.openTunnel("mongo", login(PASSWORD), "127.0.0.1", echo.getLocalPort(), 5000);

        tunnel.close();

        assertFalse(tunnel.isConnected());
        long deadline = System.currentTimeMillis() + 5000;
        while (tunnel.isAccepting() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(tunnel.isAccepting());
        assertEquals(0, tunnel.activeConnections());
    }

    private SshTarget login(String password) {
        return SshTarget.builder()
                .host("127.0.0.1")
                .port(sshd.getPort())
                .username(USER)
                .password(password)
                .build();
    }

    private static Socket connect(int port) throws IOException {
        Socket socket = new Socket("127.0.0.1", port);
        socket.setSoTimeout(10000);
        return socket;
    }

    private static byte[] roundTrip(int port, byte[] payload) throws IOException {
        try (Socket socket = connect(port)) {
            socket.getOutputStream().write(payload);
            socket.getOutputStream().flush();
            return readExactly(socket, payload.length);
        }
    }

    private static byte[] readExactly(Socket socket, int length) throws IOException {
        byte[] buffer = new byte[length];
        new DataInputStream(socket.getInputStream()).readFully(buffer);
        return buffer;
    }

    private static boolean isClosedByPeer(Socket socket) throws IOException {
        try {
            return socket.getInputStream().read() == -1;
        } catch (SocketException e) {
            return true;
        }
    }

    private static void answerAfterEof(ServerSocket server) {
        try (Socket client = server.accept()) {
            String request = new String(client.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            client.getOutputStream().write(("RESPONSE:" + request).getBytes(StandardCharsets.UTF_8));
            client.getOutputStream().flush();
        } catch (IOException e) {
            // the client side of the test reports the failure
        }
    }

    private void serveEcho() {
        while (!echo.isClosed()) {
            Socket client;
            try {
                client = echo.accept();
            } catch (IOException e) {
                return;
            }
            Thread pump = new Thread(() -> pump(client), "echo-pump");
            pump.setDaemon(true);
            pump.start();
        }
    }

    private static void pump(Socket client) {
        try (client; InputStream in = client.getInputStream(); OutputStream out = client.getOutputStream()) {
            in.transferTo(out);
        } catch (IOException e) {
            // peer went away
        }
    }
}
