package org.muma.respkv.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.protocol.RespDecoder;
import org.muma.respkv.protocol.RespEncoder;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个新连接的 Pipeline：解码 -> 编码 -> 命令处理。
 * Decoder 有状态 (累积缓冲区)，每个连接必须新建；Dispatcher 和 Store 全局共享。
 */
public class RespKvChannelInitializer extends ChannelInitializer<Channel> {

    private final CommandDispatcher dispatcher;
    private final AtomicInteger connectedClients = new AtomicInteger();

    public RespKvChannelInitializer(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    protected void initChannel(Channel ch) {
        ch.pipeline()
                .addLast(new RespDecoder())
                .addLast(new RespEncoder())
                .addLast(new RedisCommandHandler(dispatcher, connectedClients));
    }

    public int connectedClients() {
        return connectedClients.get();
    }
}
