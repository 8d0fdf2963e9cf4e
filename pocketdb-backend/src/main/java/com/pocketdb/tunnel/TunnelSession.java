package com.pocketdb.tunnel;

import com.jcraft.jsch.ChannelDirectTCPIP;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An authenticated SSH session plus a loopback listener whose connections are forwarded to one
 * remote host and port.
 *
 * <p>The accept loop runs on its own worker. Every accepted connection gets its own forwarding
 * task, so a slow channel open or a slow peer never stalls new accepts. The SSH session is shared
 * by all forwarded channels; it is locked only while a channel is being opened.
 */
@Slf4j
public class TunnelSession implements AutoCloseable {
    private static final int COPY_BUFFER_BYTES = 16 * 1024;

    private final String tag;
    private final Session session;
    private final ServerSocket listener;
    private final String remoteHost;
    private final int remotePort;
    private final int channelOpenTimeoutMs;

    private final Object channelLock = new Object();
    private final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ExecutorService workers;
    private volatile Future<?> acceptLoop;

    TunnelSession(String tag, Session session, ServerSocket listener, String remoteHost, int remotePort,
                  int channelOpenTimeoutMs) {
        this.tag = tag;
        this.session = session;
        this.listener = listener;
        this.remoteHost = remoteHost;
        this.remotePort = remotePort;
        this.channelOpenTimeoutMs = channelOpenTimeoutMs;
        this.workers = Executors.newCachedThreadPool(new TunnelThreadFactory(tag));
    }

    void start() {
        acceptLoop = workers.submit(this::acceptLoop);
    }

    public String getTag() {
        return tag;
    }

    /**
     * Loopback port accepting connections for this tunnel.
     *
     * @return local port assigned by the OS
     */
    public int getLocalPort() {
        return listener.getLocalPort();
    }

    public String getRemoteHost() {
        return remoteHost;
    }

    public int getRemotePort() {
        return remotePort;
    }

    public boolean isConnected() {
        return !closed.get() && session.isConnected();
    }

    /**
     * Whether the background accept loop is still running.
     *
     * @return false once the listener was closed or failed
     */
    public boolean isAccepting() {
        Future<?> loop = acceptLoop;
        return loop != null && !loop.isDone();
    }

    int activeConnections() {
        return activeSockets.size();
    }

    private void acceptLoop() {
        log.info("Tunnel [{}] listening on 127.0.0.1:{} -> {}:{}", tag, getLocalPort(), remoteHost, remotePort);
        while (!closed.get()) {
            Socket local;
            try {
                local = listener.accept();
            } catch (IOException e) {
                if (!closed.get()) {
                    log.warn("Tunnel [{}] accept loop stopped: {}", tag, e.getMessage());
                }
                break;
            }
            activeSockets.add(local);
            try {
                workers.execute(() -> forward(local));
            } catch (RuntimeException e) {
                log.warn("Tunnel [{}] rejected connection from port {}: {}", tag, local.getPort(), e.getMessage());
                closeSocket(local);
            }
        }
        log.info("Tunnel [{}] accept loop ended", tag);
    }

    private void forward(Socket local) {
        ForwardedChannel forwarded;
        try {
            forwarded = openChannel(local);
        } catch (JSchException | IOException e) {
            log.warn("Tunnel [{}] could not open channel to {}:{}: {}", tag, remoteHost, remotePort, e.getMessage());
            closeSocket(local);
            return;
        }

        AtomicBoolean done = new AtomicBoolean(false);
        Runnable closeBoth = () -> {
            if (done.compareAndSet(false, true)) {
                forwarded.channel.disconnect();
                closeSocket(local);
            }
        };

        try {
            InputStream fromLocal = local.getInputStream();
            OutputStream toLocal = local.getOutputStream();
            workers.execute(() -> {
                if (copy(fromLocal, forwarded.toRemote)) {
                    // Local half-close: send channel EOF and keep the reply direction open.
                    closeRemoteOutput(forwarded);
                } else {
                    closeBoth.run();
                }
            });
            copy(forwarded.fromRemote, toLocal);
            closeBoth.run();
        } catch (IOException | RuntimeException e) {
            log.warn("Tunnel [{}] forwarding failed: {}", tag, e.getMessage());
            closeBoth.run();
        }
    }

    private ForwardedChannel openChannel(Socket local) throws JSchException, IOException {
        synchronized (channelLock) {
            ChannelDirectTCPIP channel = (ChannelDirectTCPIP) session.openChannel("direct-tcpip");
            channel.setHost(remoteHost);
            channel.setPort(remotePort);
            channel.setOrgIPAddress(local.getInetAddress().getHostAddress());
            channel.setOrgPort(local.getPort());
            // Streams must be obtained before connect() for direct-tcpip channels.
            InputStream fromRemote = channel.getInputStream();
            OutputStream toRemote = channel.getOutputStream();
            channel.connect(channelOpenTimeoutMs);
            return new ForwardedChannel(channel, fromRemote, toRemote);
        }
    }

    /**
     * Pump {@code in} into {@code out} until end of stream.
     *
     * @return true on a clean end of stream, false when either side failed
     */
    private boolean copy(InputStream in, OutputStream out) {
        byte[] buffer = new byte[COPY_BUFFER_BYTES];
        try {
            int n;
            while ((n = in.read(buffer)) != -1) {
                out.write(buffer, 0, n);
                out.flush();
            }
            return true;
        } catch (IOException e) {
            log.debug("Tunnel [{}] stream closed: {}", tag, e.getMessage());
            return false;
        }
    }

    private void closeRemoteOutput(ForwardedChannel forwarded) {
        try {
            forwarded.toRemote.close();
        } catch (IOException e) {
            log.debug("Tunnel [{}] channel EOF failed: {}", tag, e.getMessage());
        }
    }

    private void closeSocket(Socket socket) {
        activeSockets.remove(socket);
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Tunnel [{}] socket close failed: {}", tag, e.getMessage());
        }
    }

    /**
     * Stop accepting, drop every forwarded connection and disconnect the SSH session.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            listener.close();
        } catch (IOException e) {
            log.debug("Tunnel [{}] listener close failed: {}", tag, e.getMessage());
        }
        for (Socket socket : Set.copyOf(activeSockets)) {
            closeSocket(socket);
        }
        session.disconnect();
        workers.shutdownNow();
        log.info("Tunnel [{}] closed (local port {})", tag, getLocalPort());
    }

    private static final class ForwardedChannel {
        private final ChannelDirectTCPIP channel;
        private final InputStream fromRemote;
        private final OutputStream toRemote;

        private ForwardedChannel(ChannelDirectTCPIP channel, InputStream fromRemote, OutputStream toRemote) {
            this.channel = channel;
            this.fromRemote = fromRemote;
            this.toRemote = toRemote;
        }
    }

    private static final class TunnelThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private TunnelThreadFactory(String tag) {
            this.prefix = "tunnel-" + tag + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
