package com.pocketdb.tunnel;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.pocketdb.model.SshTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.Properties;

/**
 * Opens SSH local port forwards on behalf of backend connect operations.
 */
@Slf4j
@Service
public class TunnelManager {
    private static final String LOOPBACK = "127.0.0.1";
    private static final int LISTEN_BACKLOG = 50;

    private final boolean strictHostKeyChecking;
    private final String knownHosts;
    private final int channelOpenTimeoutMs;

    public TunnelManager(
            @Value("${pocketdb.tunnel.strict-host-key-checking:false}") boolean strictHostKeyChecking,
            @Value("${pocketdb.tunnel.known-hosts:}") String knownHosts,
            @Value("${pocketdb.tunnel.channel-open-timeout-ms:5000}") int channelOpenTimeoutMs
    ) {
        this.strictHostKeyChecking = strictHostKeyChecking;
        this.knownHosts = knownHosts;
        this.channelOpenTimeoutMs = channelOpenTimeoutMs;
    }

    /**
     * Authenticate against {@code target}, bind an ephemeral loopback port and start forwarding its
     * connections to {@code remoteHost:remotePort} as seen from the SSH server.
     *
     * @param tag backend kind the tunnel feeds, used for logging and thread names
     * @param target SSH login
     * @param remoteHost host to reach from the SSH server
     * @param remotePort port to reach from the SSH server
     * @param connectTimeoutMs transport and authentication deadline
     * @return running tunnel; the caller owns it and must close it
     * @throws AuthUnsupportedException when no password is supplied
     * @throws TunnelException when the transport, authentication or local bind fails
     */
    public TunnelSession openTunnel(String tag, SshTarget target, String remoteHost, int remotePort, int connectTimeoutMs) {
        if (target == null || target.getHost() == null || target.getHost().isBlank()) {
            throw new IllegalArgumentException("SSH host is required");
        }
        if (target.getUsername() == null || target.getUsername().isBlank()) {
            throw new IllegalArgumentException("SSH username is required");
        }
        if (!target.hasPassword()) {
            throw new AuthUnsupportedException("Only password authentication is supported for SSH tunnels");
        }

        Session session = connect(target, connectTimeoutMs);
        ServerSocket listener;
        try {
            listener = new ServerSocket(0, LISTEN_BACKLOG, InetAddress.getByName(LOOPBACK));
        } catch (IOException e) {
            session.disconnect();
            throw new TunnelException("Failed to bind local tunnel port: " + e.getMessage(), e);
        }

        TunnelSession tunnel = new TunnelSession(tag, session, listener, remoteHost, remotePort, channelOpenTimeoutMs);
        tunnel.start();
        log.info("SSH tunnel [{}] established via {}@{}:{} on local port {}",
                tag, target.getUsername(), target.getHost(), target.getPort(), tunnel.getLocalPort());
        return tunnel;
    }

    private Session connect(SshTarget target, int connectTimeoutMs) {
        try {
            JSch jsch = new JSch();
            if (knownHosts != null && !knownHosts.isBlank()) {
                jsch.setKnownHosts(knownHosts);
            }
            Session session = jsch.getSession(target.getUsername(), target.getHost(), target.getPort());
            session.setPassword(target.getPassword());

            Properties config = new Properties();
            config.put("StrictHostKeyChecking", strictHostKeyChecking ? "yes" : "no");
            config.put("PreferredAuthentications", "password");
            session.setConfig(config);

            session.connect(connectTimeoutMs);
            return session;
        } catch (JSchException e) {
            log.warn("SSH connection to {}:{} failed: {}", target.getHost(), target.getPort(), e.getMessage());
            throw new TunnelException("SSH connection failed: " + e.getMessage(), e);
        }
    }
}
