/* (C)2026 */
package com.ammann.egress.ipc;

import com.ammann.egress.exception.EgressException;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.netty.NettyServerBuilder;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/**
 * gRPC server for the local IPC surface.
 *
 * <p>Listens on a Unix domain socket named {@value #SOCKET_NAME} inside the job directory, so it
 * is reachable only from the same host. Where the epoll transport is unavailable the server
 * falls back to an ephemeral port on the loopback interface.
 */
public final class IpcServer {

    private static final Logger LOG = Logger.getLogger(IpcServer.class);
    public static final String SOCKET_NAME = "service_rpc.sock";
    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final SocketAddress address;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private IpcServer(
            Server server, SocketAddress address, EventLoopGroup bossGroup, EventLoopGroup workerGroup) {
        this.server = server;
        this.address = address;
        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
    }

    /**
     * Address the IPC server of the job in {@code tmpDir} listens on.
     */
    public static SocketAddress localAddress(Path tmpDir) {
        if (Epoll.isAvailable()) {
            return new DomainSocketAddress(tmpDir.resolve(SOCKET_NAME).toString());
        }
        LOG.warnf(
                "Epoll transport unavailable (%s) - IPC server falls back to loopback TCP",
                Epoll.unavailabilityCause() == null ? "unknown" : Epoll.unavailabilityCause().getMessage());
        return new InetSocketAddress(InetAddress.getLoopbackAddress(), 0);
    }

    /**
     * Binds {@code service} on {@code address} and starts serving.
     *
     * @throws EgressException of kind FATAL if the listener cannot be created
     */
    public static IpcServer start(SocketAddress address, BindableService service) {
        NettyServerBuilder builder = NettyServerBuilder.forAddress(address).addService(service);
        EventLoopGroup bossGroup = null;
        EventLoopGroup workerGroup = null;
        if (address instanceof DomainSocketAddress socketAddress) {
            deleteSocketFile(socketAddress);
            bossGroup = new EpollEventLoopGroup(1);
            workerGroup = new EpollEventLoopGroup();
            builder.channelType(EpollServerDomainSocketChannel.class)
                    .bossEventLoopGroup(bossGroup)
                    .workerEventLoopGroup(workerGroup);
        }

        Server server;
        try {
            server = builder.build().start();
        } catch (IOException | RuntimeException e) {
            shutdownGroup(bossGroup);
            shutdownGroup(workerGroup);
            throw EgressException.fatal("failed to start IPC server on " + address, e);
        }

        SocketAddress bound = server.getListenSockets().isEmpty() ? address : server.getListenSockets().get(0);
        LOG.infof("IPC server listening on %s", bound);
        return new IpcServer(server, bound, bossGroup, workerGroup);
    }

    public SocketAddress address() {
        return address;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Stops serving immediately, cancelling in-flight calls. Later calls are no-ops.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        server.shutdownNow();
        try {
            if (!server.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("IPC server did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        shutdownGroup(bossGroup);
        shutdownGroup(workerGroup);
        if (address instanceof DomainSocketAddress socketAddress) {
            deleteSocketFile(socketAddress);
        }
        LOG.info("IPC server stopped");
    }

    private static void shutdownGroup(EventLoopGroup group) {
        if (group != null) {
            group.shutdownGracefully(0, TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
    }

    private static void deleteSocketFile(DomainSocketAddress socketAddress) {
        try {
            Files.deleteIfExists(Path.of(socketAddress.path()));
        } catch (IOException e) {
            LOG.warnf("Could not remove socket file %s: %s", socketAddress.path(), e.getMessage());
        }
    }
}
