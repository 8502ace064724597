package io.ringlookup.connection.channel;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.ringlookup.api.LookupApi;
import io.ringlookup.connection.ConnectionException;
import io.ringlookup.connection.DisconnectedException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;

/**
 * Completes pending request futures keyed by correlationId.
 */
@Slf4j
public final class LookupReplyHandler extends SimpleChannelInboundHandler<LookupApi.Envelope> {

    private final ConcurrentMap<Long, CompletableFuture<LookupApi.Envelope>> pending;

    public LookupReplyHandler(final ConcurrentMap<Long, CompletableFuture<LookupApi.Envelope>> pending) {
        this.pending = pending;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final LookupApi.Envelope envelope) {
        final long corrId = envelope.getCorrelationId();
        final CompletableFuture<LookupApi.Envelope> fut = pending.remove(corrId);
        if (fut != null) {
            fut.complete(envelope);
        } else {
            log.warn("{} for unknown corrId {}", envelope.getKindCase(), corrId);
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        failAll(new DisconnectedException("connection to " + ctx.channel().remoteAddress() + " closed"));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("connection to {} failed: {}", ctx.channel().remoteAddress(), cause.getMessage());
        failAll(new ConnectionException("connection to " + ctx.channel().remoteAddress() + " failed", cause));
        ctx.close();
    }

    private void failAll(final Throwable error) {
        pending.forEach((id, f) -> f.completeExceptionally(error));
        pending.clear();
    }
}
