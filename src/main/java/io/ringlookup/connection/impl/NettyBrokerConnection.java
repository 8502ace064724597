package io.ringlookup.connection.impl;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.ringlookup.api.LookupApi;
import io.ringlookup.connection.ConnectionException;
import io.ringlookup.connection.DisconnectedException;
import io.ringlookup.connection.channel.LookupReplyHandler;
import io.ringlookup.connection.type.BrokerConnection;
import io.ringlookup.core.model.BrokerAddress;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One Netty channel to a broker or proxy, speaking varint32-framed {@link LookupApi.Envelope}s.
 * <p>
 * {@link #open} connects and completes the {@code CommandConnect} handshake before handing
 * the connection out. When the address is proxied, the handshake names the logical broker so
 * the proxy knows where to forward.
 */
@Slf4j
public final class NettyBrokerConnection implements BrokerConnection {

    static final String CLIENT_VERSION = "ring-lookup-0.1";

    @Getter private final BrokerAddress address;
    private final Channel channel;
    private final ConcurrentMap<Long, CompletableFuture<LookupApi.Envelope>> pending;

    private final AtomicLong corrSeq = new AtomicLong(1L);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private NettyBrokerConnection(final BrokerAddress address,
                                  final Channel channel,
                                  final ConcurrentMap<Long, CompletableFuture<LookupApi.Envelope>> pending) {
        this.address = address;
        this.channel = channel;
        this.pending = pending;
    }

    public static CompletableFuture<NettyBrokerConnection> open(final EventLoopGroup group,
                                                                final BrokerAddress address,
                                                                final int connectTimeoutMillis) {
        final ConcurrentMap<Long, CompletableFuture<LookupApi.Envelope>> pending = new ConcurrentHashMap<>();
        final CompletableFuture<NettyBrokerConnection> opened = new CompletableFuture<>();

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new ProtobufVarint32FrameDecoder())
                                .addLast(new ProtobufDecoder(LookupApi.Envelope.getDefaultInstance()))
                                .addLast(new LookupReplyHandler(pending))
                                .addLast(new ProtobufVarint32LengthFieldPrepender())
                                .addLast(new ProtobufEncoder());
                    }
                });

        final ChannelFuture connect = bootstrap.connect(address.host(), address.port());
        connect.addListener(f -> {
            if (!f.isSuccess()) {
                opened.completeExceptionally(new ConnectionException(
                        "failed to connect to " + address.url() + ": " + f.cause().getMessage(), f.cause()));
                return;
            }

            final NettyBrokerConnection conn = new NettyBrokerConnection(address, connect.channel(), pending);
            conn.handshake(connectTimeoutMillis).whenComplete((v, ex) -> {
                if (ex != null) {
                    conn.close();
                    opened.completeExceptionally(ex instanceof CompletionException ? ex.getCause() : ex);
                } else {
                    log.info("Connected to {} (broker {}, proxy={})", address.url(), address.brokerUrl(), address.proxy());
                    opened.complete(conn);
                }
            });
        });

        return opened;
    }

    private CompletableFuture<Void> handshake(final int timeoutMillis) {
        final LookupApi.CommandConnect.Builder connect = LookupApi.CommandConnect.newBuilder()
                .setClientVersion(CLIENT_VERSION);
        if (address.proxy()) {
            connect.setProxyToBrokerUrl(address.brokerUrl());
        }

        final CompletableFuture<LookupApi.Envelope> reply = request(LookupApi.Envelope.newBuilder().setConnect(connect));
        final ScheduledFuture<?> timeout = channel.eventLoop().schedule(
                () -> reply.completeExceptionally(new ConnectionException(
                        "handshake with " + address.url() + " timed out after " + timeoutMillis + "ms")),
                timeoutMillis, TimeUnit.MILLISECONDS);
        reply.whenComplete((env, ex) -> timeout.cancel(false));

        return reply.thenApply(env -> {
            if (!env.hasConnected()) {
                throw new CompletionException(new ConnectionException(
                        "unexpected handshake reply " + env.getKindCase() + " from " + address.url()));
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<LookupApi.CommandLookupTopicResponse> sendLookupTopic(final String topic,
                                                                                  final boolean authoritative) {
        final LookupApi.CommandLookupTopic lookup = LookupApi.CommandLookupTopic.newBuilder()
                .setTopic(topic)
                .setAuthoritative(authoritative)
                .build();

        return request(LookupApi.Envelope.newBuilder().setLookupTopic(lookup)).thenApply(env -> {
            if (!env.hasLookupTopicResponse()) {
                throw new CompletionException(unexpected(env));
            }
            return env.getLookupTopicResponse();
        });
    }

    @Override
    public CompletableFuture<LookupApi.CommandPartitionedTopicMetadataResponse> sendPartitionedTopicMetadata(final String topic) {
        final LookupApi.CommandPartitionedTopicMetadata metadata = LookupApi.CommandPartitionedTopicMetadata.newBuilder()
                .setTopic(topic)
                .build();

        return request(LookupApi.Envelope.newBuilder().setPartitionedMetadata(metadata)).thenApply(env -> {
            if (!env.hasPartitionedMetadataResponse()) {
                throw new CompletionException(unexpected(env));
            }
            return env.getPartitionedMetadataResponse();
        });
    }

    private CompletableFuture<LookupApi.Envelope> request(final LookupApi.Envelope.Builder envelope) {
        if (isClosed()) {
            return CompletableFuture.failedFuture(new DisconnectedException("connection to " + address.url() + " is closed"));
        }

        final long corrId = corrSeq.getAndIncrement();
        final CompletableFuture<LookupApi.Envelope> future = new CompletableFuture<>();
        pending.put(corrId, future);
        future.whenComplete((res, ex) -> pending.remove(corrId));

        channel.writeAndFlush(envelope.setCorrelationId(corrId).build()).addListener(f -> {
            if (!f.isSuccess()) {
                log.error("Failed to send {} corrId {}: {}", envelope.getKindCase(), corrId, f.cause().getMessage());
                future.completeExceptionally(channel.isActive()
                        ? new ConnectionException("write to " + address.url() + " failed", f.cause())
                        : new DisconnectedException("connection to " + address.url() + " closed"));
            }
        });

        return future;
    }

    private ConnectionException unexpected(final LookupApi.Envelope env) {
        return new ConnectionException("unexpected reply " + env.getKindCase() + " from " + address.url());
    }

    /** Runs {@code action} once the underlying channel has closed, for whatever reason. */
    void onClose(final Runnable action) {
        channel.closeFuture().addListener(f -> action.run());
    }

    @Override
    public boolean isClosed() {
        return closed.get() || !channel.isActive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        final DisconnectedException ex = new DisconnectedException("connection to " + address.url() + " closed");
        pending.forEach((id, f) -> f.completeExceptionally(ex));
        pending.clear();
        channel.close();

        log.info("Connection to {} closed.", address.url());
    }
}
