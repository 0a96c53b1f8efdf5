package model.dto.snapshot;

import common.consts.EventTypeEnum;
import lombok.Data;

/**
 * 调度日志条目 DTO
 */
@Data
public class EventLogEntryDto {
    /**
     * 条目执行时的虚拟时间（秒）
     */
    private double simTime;

    /**
     * 条目类型
     */
    private EventTypeEnum type;

    /**
     * 调度序号（同一引擎内唯一且单调递增）
     */
    private long sequence;

    /**
     * 是否为超时阶段条目
     */
    private boolean expiryPhase;

    /**
     * 相关主体（节点ID / gateway / workload 等）
     */
    private String subject;
}
