package org.stocktake.remote;

/**
 * 本地提醒服务（发出即忘）
 */
public interface NotificationService {

    void scheduleLocalAlert(String title, String body);
}
