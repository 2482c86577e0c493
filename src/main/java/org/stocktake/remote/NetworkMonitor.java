package org.stocktake.remote;

/**
 * 网络状态端口
 */
public interface NetworkMonitor {

    boolean isOnline();

    void addListener(NetworkListener listener);

    @FunctionalInterface
    interface NetworkListener {
        /**
         * 仅在状态真正变化时回调
         */
        void onConnectivityChanged(boolean online);
    }
}
