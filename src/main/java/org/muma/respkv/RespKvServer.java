package org.muma.respkv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.muma.respkv.command.CommandDispatcher;
import org.muma.respkv.config.RespKvConfig;
import org.muma.respkv.server.RespKvChannelInitializer;
import org.muma.respkv.store.StorageEngine;
import org.muma.respkv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

public class RespKvServer {

    private static final Logger log = LoggerFactory.getLogger(RespKvServer.class);

    private final RespKvConfig config;
    private final StorageEngine storage;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RespKvServer(RespKvConfig config) {
        this(config, new MemoryStorageEngine());
    }

    // Store 由外部创建后注入，所有连接共用同一个实例
    public RespKvServer(RespKvConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
    }

    /**
     * 绑定端口后立即返回，accept 和连接处理都在 Netty 线程上进行
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }

        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("respkv-boss"));
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads(), new DefaultThreadFactory("respkv-worker"));

        CommandDispatcher dispatcher = new CommandDispatcher(storage);

        boolean started = false;
        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.INFO))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    // 每次最多读取固定大小的数据块，追加到解码器的累积缓冲区
                    .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(config.getReadBufferSize()))
                    .childHandler(new RespKvChannelInitializer(dispatcher));

            log.info("Starting resp-kv server on {}", config.getBindAddress());
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("resp-kv started successfully, listening on {}", serverChannel.localAddress());
            started = true;
        } finally {
            // sync() 会原样抛出 BindException 等受检异常，这里统一释放 EventLoop
            if (!started) {
                log.error("Failed to start server on {}", config.getBindAddress());
                serverChannel = null;
                shutdownGroups();
            }
        }
    }

    /**
     * 实际监听的端口 (配置为 0 时由系统分配)
     */
    public int getPort() {
        if (serverChannel == null) {
            throw new IllegalStateException("Server not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public StorageEngine getStorage() {
        return storage;
    }

    public void awaitTermination() throws InterruptedException {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        log.info("Stopping resp-kv server on {}", serverChannel.localAddress());
        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
        }
        bossGroup = null;
        workerGroup = null;
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. 初始化配置并解析参数
        RespKvConfig config = RespKvConfig.load(args, System.getenv());

        RespKvServer server = new RespKvServer(config);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "respkv-shutdown"));
        server.awaitTermination();
    }
}
