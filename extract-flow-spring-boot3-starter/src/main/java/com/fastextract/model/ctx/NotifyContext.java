package com.fastextract.model.ctx;

import com.fastextract.model.enums.NotifyEventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotifyContext {

    private NotifyEventType type;
    // 下游依赖或阶段名, 如 enrichment / persistence / workflow
    private String component;
    // 分类码, 如 TIMEOUT / CIRCUIT_OPEN / HARD_LIMIT
    private String reasonCode;
    // 可被截断
    private String lastError;
    private Instant when;
    // 额外字段: 计数、阈值、nextAttemptTime 等
    private Map<String, Object> attributes;
}
