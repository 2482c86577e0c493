package org.stocktake.remote;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 设备本地提醒：记录日志
 * 启用 RabbitMQ 时另由 CriticalAlertPublisher 把完整提醒事件发到 Broker
 */
@Slf4j
@Component
public class LoggingNotificationService implements NotificationService {

    @Override
    public void scheduleLocalAlert(String title, String body) {
        log.warn("[本地提醒] title={}, body={}", title, body);
    }
}
