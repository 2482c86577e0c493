package org.stocktake.remote;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.config.StockTakeProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 由设备外壳推送网络状态的监视器
 * - 外壳通过 /api/sync/network 上报 online/offline
 * - 状态未变化时不回调监听者
 */
@Slf4j
@Component
public class ManualNetworkMonitor implements NetworkMonitor {

    private final AtomicBoolean online;
    private final List<NetworkListener> listeners = new CopyOnWriteArrayList<>();

    public ManualNetworkMonitor(StockTakeProperties properties) {
        this.online = new AtomicBoolean(properties.getNetwork().isInitiallyOnline());
    }

    @Override
    public boolean isOnline() {
        return online.get();
    }

    @Override
    public void addListener(NetworkListener listener) {
        listeners.add(listener);
    }

    /**
     * 上报网络状态
     *
     * @return 状态是否发生变化
     */
    public boolean report(boolean nowOnline) {
        boolean previous = online.getAndSet(nowOnline);
        if (previous == nowOnline) {
            log.debug("[网络状态未变化] online={}", nowOnline);
            return false;
        }
        log.info("[网络状态变化] {} -> {}", previous ? "online" : "offline", nowOnline ? "online" : "offline");
        for (NetworkListener listener : listeners) {
            try {
                listener.onConnectivityChanged(nowOnline);
            } catch (Exception e) {
                log.error("[网络监听回调异常] listener={}, errorMsg={}", listener, e.getMessage(), e);
            }
        }
        return true;
    }
}
