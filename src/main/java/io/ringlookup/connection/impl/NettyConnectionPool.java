package io.ringlookup.connection.impl;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.ringlookup.config.impl.LookupConfig;
import io.ringlookup.connection.ConnectionException;
import io.ringlookup.connection.type.BrokerConnection;
import io.ringlookup.connection.type.ConnectionProvider;
import io.ringlookup.core.model.BrokerAddress;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps at most one live {@link NettyBrokerConnection} per {@link BrokerAddress}.
 * <p>
 * Connections are evicted when their channel closes or the connect attempt fails; the next request
 * for the same address opens a new one.
 */
@Slf4j
public final class NettyConnectionPool implements ConnectionProvider, AutoCloseable {

    private final URI serviceUrl;
    private final BrokerAddress baseAddress;
    private final int connectTimeoutMillis;
    private final EventLoopGroup group;

    private final ConcurrentMap<BrokerAddress, CompletableFuture<NettyBrokerConnection>> connections =
            new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NettyConnectionPool(final LookupConfig config) {
        this.serviceUrl = config.getServiceUrl();
        this.baseAddress = BrokerAddress.base(serviceUrl);
        this.connectTimeoutMillis = config.getConnectTimeoutMillis();

        final IoHandlerFactory factory = NioIoHandler.newFactory();
        this.group = new MultiThreadIoEventLoopGroup(1, factory);
    }

    @Override
    public CompletableFuture<BrokerConnection> connection(final BrokerAddress address) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new ConnectionException("connection pool is closed"));
        }

        final CompletableFuture<NettyBrokerConnection> conn = connections.compute(address, (addr, existing) -> {
            if (existing != null && !isStale(existing)) return existing;
            log.debug("Opening connection to {} for broker {}", addr.url(), addr.brokerUrl());
            final CompletableFuture<NettyBrokerConnection> opened = NettyBrokerConnection.open(group, addr, connectTimeoutMillis);
            opened.thenAccept(c -> c.onClose(() -> connections.remove(addr, opened)));
            return opened;
        });
        conn.whenComplete((c, ex) -> {
            if (ex != null) connections.remove(address, conn);
        });

        return conn.thenApply(c -> c);
    }

    private static boolean isStale(final CompletableFuture<NettyBrokerConnection> conn) {
        if (!conn.isDone()) return false;
        return conn.isCompletedExceptionally() || conn.join().isClosed();
    }

    @Override
    public BrokerAddress baseAddress() {
        return baseAddress;
    }

    @Override
    public URI serviceUrl() {
        return serviceUrl;
    }

    /** Number of connections currently open or being opened. */
    public int size() {
        return connections.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        connections.values().forEach(f -> f.thenAccept(NettyBrokerConnection::close));
        connections.clear();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();

        log.info("NettyConnectionPool for {} closed.", serviceUrl);
    }
}
