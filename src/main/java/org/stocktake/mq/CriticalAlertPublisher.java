package org.stocktake.mq;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.config.RabbitMQConfig;
import org.stocktake.event.CriticalStockAlertEvent;
import org.stocktake.util.TraceIdUtil;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 严重缺货提醒转发到 RabbitMQ
 * - 监听 CompletionAggregator 发布的 CriticalStockAlertEvent，原样发送（会话、区域、条目数）
 * - 发出即忘：发送失败只记录日志
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "spring.rabbitmq.listener.simple.enabled", havingValue = "true")
public class CriticalAlertPublisher {

    private final RabbitTemplate rabbitTemplate;

    public CriticalAlertPublisher(RabbitTemplate rabbitTemplate) {
        this.rabbitTemplate = rabbitTemplate;
    }

    @EventListener
    public void onCriticalStockAlert(CriticalStockAlertEvent event) {
        if (event.getMessageId() == null) {
            event.setMessageId(UUID.randomUUID().toString());
        }
        if (event.getTraceId() == null) {
            event.setTraceId(TraceIdUtil.getTraceId());
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(System.currentTimeMillis());
        }
        String messageId = event.getMessageId();
        try {
            rabbitTemplate.convertAndSend(
                    RabbitMQConfig.CRITICAL_ALERT_EXCHANGE,
                    RabbitMQConfig.CRITICAL_ALERT_ROUTING_KEY,
                    event,
                    message -> {
                        message.getMessageProperties().setHeader("messageId", messageId);
                        return message;
                    }
            );
            log.info("[提醒已发送] messageId={}, sessionId={}, areaId={}, criticalCount={}, traceId={}",
                    messageId, event.getSessionId(), event.getAreaId(), event.getCriticalCount(), event.getTraceId());
        } catch (AmqpException e) {
            log.error("[提醒发送失败] messageId={}, sessionId={}, errorMsg={}",
                    messageId, event.getSessionId(), e.getMessage(), e);
        }
    }
}
