package com.fastmqtt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.logging.LogLevel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * MQTT 客户端配置（绑定前缀：mqtt）
 *
 * YAML 示例：
 * mqtt:
 *   addr: 127.0.0.1:1883
 *   user-name: svc
 *   password: secret
 *   client-id: order-service-1
 *   clean-session: false
 *   debug: false
 *   automatic-reconnect: true
 *   connection-timeout: 30s
 *   keep-alive: 60s
 *   disconnect-grace: 250ms
 *   ignorable-exceptions:
 *     - com.example.order.DuplicateOrderException
 *   logger:
 *     client: mqtt-client
 *     pub: mqtt-pub
 *     sub: mqtt-sub
 *     pub-level: info
 *     sub-level: error
 *   dispatch:
 *     core-pool-size: 0
 *     max-pool-size: 2147483647
 *     keep-alive: 60s
 *   shutdown:
 *     await: 30s
 *   retry:
 *     base: 1s
 *     max-delay: 10s
 */
@ConfigurationProperties(prefix = "mqtt")
public class MqttAckProperties {

    /** broker 地址 host:port, 也可写完整 uri（ssl://...） */
    private String addr;

    private String userName;

    private String password;

    /** 为空时使用 spring.application.name */
    private String clientId;

    private boolean cleanSession = false;

    /** 输出原始到达消息 */
    private boolean debug = false;

    private boolean automaticReconnect = true;

    private Duration connectionTimeout = Duration.ofSeconds(30);

    private Duration keepAlive = Duration.ofSeconds(60);

    /** 断开前等待在途报文 */
    private Duration disconnectGrace = Duration.ofMillis(250);

    /** 额外按业务错误处理（ACK 且不重试）的异常类型 */
    private List<Class<? extends Throwable>> ignorableExceptions = new ArrayList<>();

    private Logger logger = new Logger();

    private Dispatch dispatch = new Dispatch();

    private Shutdown shutdown = new Shutdown();

    private Retry retry = new Retry();

    // ----------------- 嵌套配置对象 -----------------

    public static class Logger {
        /** 连接生命周期日志 */
        private String client = "mqtt-client";

        /** 发布日志 */
        private String pub = "mqtt-pub";

        /** 订阅日志 */
        private String sub = "mqtt-sub";

        /** 为空则沿用 logging.level 配置 */
        private LogLevel clientLevel;

        private LogLevel pubLevel;

        private LogLevel subLevel;

        public String getClient() { return client; }
        public void setClient(String client) { this.client = client; }
        public String getPub() { return pub; }
        public void setPub(String pub) { this.pub = pub; }
        public String getSub() { return sub; }
        public void setSub(String sub) { this.sub = sub; }
        public LogLevel getClientLevel() { return clientLevel; }
        public void setClientLevel(LogLevel clientLevel) { this.clientLevel = clientLevel; }
        public LogLevel getPubLevel() { return pubLevel; }
        public void setPubLevel(LogLevel pubLevel) { this.pubLevel = pubLevel; }
        public LogLevel getSubLevel() { return subLevel; }
        public void setSubLevel(LogLevel subLevel) { this.subLevel = subLevel; }
    }

    public static class Dispatch {
        private int corePoolSize = 0;

        /** 默认不设上限; 设上限后饱和的消息不 ACK, 等待重投 */
        private int maxPoolSize = Integer.MAX_VALUE;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    public static class Retry {
        /** 线性退避步长 */
        private Duration base = Duration.ofSeconds(1);

        /** 单次等待上限 */
        private Duration maxDelay = Duration.ofSeconds(10);

        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public String getAddr() { return addr; }
    public void setAddr(String addr) { this.addr = addr; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public boolean isCleanSession() { return cleanSession; }
    public void setCleanSession(boolean cleanSession) { this.cleanSession = cleanSession; }

    public boolean isDebug() { return debug; }
    public void setDebug(boolean debug) { this.debug = debug; }

    public boolean isAutomaticReconnect() { return automaticReconnect; }
    public void setAutomaticReconnect(boolean automaticReconnect) { this.automaticReconnect = automaticReconnect; }

    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }

    public Duration getKeepAlive() { return keepAlive; }
    public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }

    public Duration getDisconnectGrace() { return disconnectGrace; }
    public void setDisconnectGrace(Duration disconnectGrace) { this.disconnectGrace = disconnectGrace; }

    public List<Class<? extends Throwable>> getIgnorableExceptions() { return ignorableExceptions; }
    public void setIgnorableExceptions(List<Class<? extends Throwable>> ignorableExceptions) { this.ignorableExceptions = ignorableExceptions; }

    public Logger getLogger() { return logger; }
    public void setLogger(Logger logger) { this.logger = logger; }

    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
}
