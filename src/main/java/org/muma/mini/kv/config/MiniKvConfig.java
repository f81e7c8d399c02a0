package org.muma.mini.kv.config;

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
 * 节点配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (minikv.properties) > 默认值
 * <p>
 * 每个节点实例持有自己的配置对象，同一进程内的多个节点 (例如测试中的主从) 互不影响。
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "minikv.properties";

    // --- Core Settings ---
    private int port = 6379;
    private String bindAddress = "0.0.0.0";
    private int workerThreads = 0; // 0 = Netty default

    // --- Replication ---
    private String replicaOfHost = null;
    private int replicaOfPort = -1;
    private long replBackoffMillis = 1000;
    private long replHandshakeTimeoutMillis = 5000;
    private int replBacklogMax = 10000; // pending Slave 最多缓存的命令条数

    // --- Expire ---
    private boolean activeExpire = true;
    private long activeExpireIntervalMillis = 100;
    private int activeExpireSampleSize = 20;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    public enum Role {
        MASTER, REPLICA
    }

    public Role getRole() {
        return replicaOfHost == null ? Role.MASTER : Role.REPLICA;
    }

    /**
     * 解析 "host port" 格式的主节点地址，null 或空串表示作为 Master 运行
     */
    public void setReplicaOf(String hostPort) {
        if (hostPort == null || hostPort.isBlank()) {
            this.replicaOfHost = null;
            this.replicaOfPort = -1;
            return;
        }
        String[] parts = hostPort.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid replicaof format, expected '<host> <port>': " + hostPort);
        }
        try {
            this.replicaOfPort = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid replicaof port: " + parts[1], e);
        }
        this.replicaOfHost = parts[0];
    }

    // --- Loading Logic ---

    /**
     * 完整加载流程：配置文件 -> 环境变量 -> 命令行参数
     */
    public static MiniKvConfig fromArgs(String[] args) {
        MiniKvConfig config = new MiniKvConfig();
        // 先找 --config，决定读哪个配置文件
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config.configFilePath = args[i + 1];
            }
        }
        config.loadConfig(config.configFilePath);
        config.applyEnvOverrides(System.getenv());
        config.parseArgs(args);
        return config;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                this.configFilePath = args[++i];
            } else if ("--port".equals(arg) && i + 1 < args.length) {
                this.port = parsePort("--port", args[++i], this.port);
            } else if ("--bind".equals(arg) && i + 1 < args.length) {
                this.bindAddress = args[++i];
            } else if ("--replicaof".equals(arg) && i + 1 < args.length) {
                applyReplicaOf("--replicaof", args[++i]);
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
        log.info("Config loaded from args: port={}, role={}", port, getRole());
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.port = getInt(props, "server.port", this.port);
        this.bindAddress = getString(props, "server.bind", this.bindAddress);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Replication
        // 格式: replicaof <host> <port> (中间用空格分隔)
        String replicaof = getString(props, "replicaof", "");
        if (!replicaof.isEmpty()) {
            applyReplicaOf("replicaof", replicaof);
        }
        this.replBackoffMillis = getLong(props, "repl.backoff_ms", this.replBackoffMillis);
        this.replHandshakeTimeoutMillis = getLong(props, "repl.handshake_timeout_ms", this.replHandshakeTimeoutMillis);
        this.replBacklogMax = getInt(props, "repl.backlog_max", this.replBacklogMax);

        // 3. Expire
        this.activeExpire = "yes".equalsIgnoreCase(getString(props, "expire.active", activeExpire ? "yes" : "no"));
        this.activeExpireIntervalMillis = getLong(props, "expire.interval_ms", this.activeExpireIntervalMillis);
        this.activeExpireSampleSize = getInt(props, "expire.sample_size", this.activeExpireSampleSize);

        log.info("MiniKvConfig initialized: {}", this);
    }

    void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("MINIKV_PORT");
        if (envPort != null) {
            this.port = parsePort("MINIKV_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envReplicaOf = env.get("MINIKV_REPLICAOF");
        if (envReplicaOf != null && applyReplicaOf("MINIKV_REPLICAOF", envReplicaOf)) {
            log.info("Replicaof overridden by ENV: {}:{}", replicaOfHost, replicaOfPort);
        }
    }

    // 非法值与配置文件的处理方式一致：告警并保留原值
    private int parsePort(String source, String value, int current) {
        try {
            int p = Integer.parseInt(value.trim());
            if (p < 0 || p > 65535) {
                throw new NumberFormatException("out of range");
            }
            return p;
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', keeping {}.", source, value, current);
            return current;
        }
    }

    private boolean applyReplicaOf(String source, String value) {
        try {
            setReplicaOf(value);
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} value '{}': {}", source, value, e.getMessage());
            return false;
        }
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

    private long getLong(Properties props, String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
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
        return "Config{port=" + port + ", role=" + getRole()
                + (replicaOfHost == null ? "" : ", master=" + replicaOfHost + ":" + replicaOfPort) + "}";
    }
}
