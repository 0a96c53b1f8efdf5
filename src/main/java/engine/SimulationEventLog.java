package engine;

import model.dto.snapshot.EventLogEntryDto;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 简单的内存调度日志（最近 N 条）
 * 每个引擎实例独享一份，不跨仿真共享
 */
public class SimulationEventLog {

    private final int capacity;

    private final Deque<EventLogEntryDto> buffer;

    public SimulationEventLog(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.buffer = new ArrayDeque<>(this.capacity);
    }

    public void append(EventLogEntryDto entry) {
        if (buffer.size() >= capacity) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
    }

    /**
     * 按仿真时间过滤最近的条目
     */
    public List<EventLogEntryDto> listSince(double sinceSimTime) {
        List<EventLogEntryDto> result = new ArrayList<>();
        for (EventLogEntryDto dto : buffer) {
            if (dto.getSimTime() >= sinceSimTime) {
                result.add(dto);
            }
        }
        return result;
    }

    public List<EventLogEntryDto> listAll() {
        return new ArrayList<>(buffer);
    }

    public int size() {
        return buffer.size();
    }
}
