package org.muma.respkv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (respkv.properties) > 默认值
 */
@Getter
@Setter
public class RespKvConfig {

    private static final Logger log = LoggerFactory.getLogger(RespKvConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "respkv.properties";
    public static final String ENV_ADDR = "RESPKV_ADDR";
    // 旧部署使用的变量名，RESPKV_ADDR 未设置时才生效
    public static final String ENV_ADDR_LEGACY = "REDIS_RS_ADDR";
    public static final String ENV_PORT = "RESPKV_PORT";

    // --- Core Settings ---
    private String host = "127.0.0.1";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default
    private int readBufferSize = 1024; // 每次 socket 读取的最大字节数

    private String configFilePath = DEFAULT_CONFIG_FILE;

    /**
     * 按优先级加载完整配置：先找 --config，再依次应用配置文件、环境变量、命令行参数
     */
    public static RespKvConfig load(String[] args, Map<String, String> env) {
        RespKvConfig config = new RespKvConfig();
        config.configFilePath = findConfigPath(args);
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(env);
        config.parseArgs(args);
        log.info("RespKvConfig initialized: {}", config);
        return config;
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return DEFAULT_CONFIG_FILE;
    }

    // --- Loading Logic ---

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                log.warn("Ignoring option without value: {}", arg);
                break;
            }
            switch (arg) {
                case "--config" -> this.configFilePath = args[++i];
                case "--bind" -> setBindAddress(args[++i]);
                case "--host" -> this.host = args[++i];
                case "--port" -> this.port = parsePort(args[++i], this.port);
                default -> log.warn("Unknown option: {}", arg);
            }
        }
        log.info("Config loaded from args: host={}, port={}", host, port);
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        String bind = props.getProperty("server.bind");
        if (bind != null) {
            setBindAddress(bind);
        }
        this.host = getString(props, "server.host", this.host);
        this.port = parsePort(props.getProperty("server.port"), this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        int readSize = getInt(props, "server.read_buffer_size", this.readBufferSize);
        if (readSize > 0) {
            this.readBufferSize = readSize;
        } else {
            log.warn("Invalid server.read_buffer_size '{}', using default {}.", readSize, this.readBufferSize);
        }
    }

    public void applyEnvOverrides(Map<String, String> env) {
        String envAddr = env.getOrDefault(ENV_ADDR, env.get(ENV_ADDR_LEGACY));
        if (envAddr != null) {
            setBindAddress(envAddr);
            log.info("Bind address overridden by ENV: {}:{}", host, port);
        }

        String envPort = env.get(ENV_PORT);
        if (envPort != null) {
            this.port = parsePort(envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    /**
     * 解析 host:port，端口非法时保留原值
     */
    public void setBindAddress(String address) {
        int idx = address.lastIndexOf(':');
        if (idx <= 0 || idx == address.length() - 1) {
            log.warn("Invalid bind address '{}', expected host:port. Keeping {}:{}.", address, host, port);
            return;
        }
        this.host = address.substring(0, idx);
        this.port = parsePort(address.substring(idx + 1), this.port);
    }

    public String getBindAddress() {
        return host + ":" + port;
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private int parsePort(String value, int defaultValue) {
        if (value == null) return defaultValue;
        try {
            int p = Integer.parseInt(value.trim());
            if (p < 0 || p > 65535) {
                log.warn("Port out of range '{}', using {}.", value, defaultValue);
                return defaultValue;
            }
            return p;
        } catch (NumberFormatException e) {
            log.warn("Invalid port '{}', using {}.", value, defaultValue);
            return defaultValue;
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    @Override
    public String toString() {
        return "Config{bind=" + getBindAddress() + ", workerThreads=" + workerThreads
                + ", readBufferSize=" + readBufferSize + "}";
    }
}
