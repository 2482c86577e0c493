package org.stocktake.task;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.business.PendingUpdateQueue;
import org.stocktake.remote.NetworkMonitor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 待同步写入补偿任务
 * - 网络恢复事件之外的兜底：定期检查队列并同步
 * - 离线或队列为空时不做任何事
 */
@Slf4j
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "stocktake.sync", name = "scheduled-drain-enabled", havingValue = "true", matchIfMissing = true)
public class PendingUpdateDrainTask {

    private final PendingUpdateQueue pendingUpdateQueue;
    private final NetworkMonitor networkMonitor;

    public PendingUpdateDrainTask(PendingUpdateQueue pendingUpdateQueue, NetworkMonitor networkMonitor) {
        this.pendingUpdateQueue = pendingUpdateQueue;
        this.networkMonitor = networkMonitor;
    }

    @Scheduled(fixedDelayString = "${stocktake.sync.drain-interval-ms:30000}",
            initialDelayString = "${stocktake.sync.drain-initial-delay-ms:5000}")
    public void drainPendingUpdates() {
        try {
            if (!networkMonitor.isOnline() || pendingUpdateQueue.pendingCount() == 0) {
                log.debug("[补偿同步] 离线或无待同步写入，跳过");
                return;
            }
            log.debug("[补偿同步] 开始执行，pendingCount={}", pendingUpdateQueue.pendingCount());
            int synced = pendingUpdateQueue.drain();
            log.debug("[补偿同步] 执行完成，synced={}, pendingCount={}", synced, pendingUpdateQueue.pendingCount());
        } catch (Exception e) {
            log.error("[补偿同步异常] errorMsg={}", e.getMessage(), e);
        }
    }
}
