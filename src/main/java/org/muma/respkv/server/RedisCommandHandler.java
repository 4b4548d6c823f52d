package org.muma.respkv.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例。
 * <p>
 * Netty 保证同一个 Channel 的事件在同一个 EventLoop 上串行处理，
 * 所以每个帧都是 "解析 -> 执行 -> writeAndFlush" 之后才轮到下一个帧，响应顺序与请求顺序一致。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RedisMessage> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    private final CommandDispatcher dispatcher;
    // 所有连接共用的在线连接计数，只用于日志
    private final AtomicInteger connectedClients;

    public RedisCommandHandler(CommandDispatcher dispatcher, AtomicInteger connectedClients) {
        this.dispatcher = dispatcher;
        this.connectedClients = connectedClients;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RedisMessage msg) {
        RedisMessage response;
        try {
            response = dispatcher.dispatch(msg);
        } catch (RuntimeException e) {
            log.error("Error processing frame {}", msg, e);
            response = new ErrorMessage("ERR internal error");
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 帧格式错误：没有重新同步的办法，直接断开
            log.warn("Protocol error from {}, closing connection: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else if (cause instanceof IOException) {
            log.warn("Connection error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("Unexpected error on connection {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
