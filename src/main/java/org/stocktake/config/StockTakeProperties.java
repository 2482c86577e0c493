package org.stocktake.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 盘点引擎配置（前缀 stocktake）
 */
@Data
@ConfigurationProperties(prefix = "stocktake")
public class StockTakeProperties {

    /**
     * 设备ID，同一设备同一时间只能有一个进行中的会话
     */
    private String deviceId = "default-device";

    private Remote inventory = new Remote();

    private Remote blobStore = new Remote();

    private Network network = new Network();

    private Sync sync = new Sync();

    private Redis redis = new Redis();

    @Data
    public static class Remote {
        private String baseUrl = "http://localhost:8081";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Network {
        /**
         * 启动时假定的网络状态，之后以外壳上报为准
         */
        private boolean initiallyOnline = true;
    }

    @Data
    public static class Sync {
        /**
         * 是否启用定时补偿同步
         */
        private boolean scheduledDrainEnabled = true;
        private long drainIntervalMs = 30000;
        private long drainInitialDelayMs = 5000;
        /**
         * 写入入队后是否在后台线程触发同步；关闭时在调用线程内同步执行
         */
        private boolean asyncDrain = true;
    }

    @Data
    public static class Redis {
        private boolean enabled = false;
        private String host = "localhost";
        private int port = 6379;
    }
}
