package common.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("引擎配置测试")
class EngineConfigTest {

    @Test
    @DisplayName("死循环阈值随节点数放大")
    void testMaxEventsPerTimestampScalesWithNodes() {
        EngineConfig config = new EngineConfig();

        assertEquals(10_000 + 4 * 16 * 16 * 16, config.maxEventsPerTimestampFor(16));
        assertEquals(10_000 + 4 * 300 * 300 * 300, config.maxEventsPerTimestampFor(300));
        assertEquals(Integer.MAX_VALUE, config.maxEventsPerTimestampFor(20_000), "超出 int 范围时取上限");
    }

    @Test
    @DisplayName("基数可配置")
    void testBaseConfigurable() {
        EngineConfig config = new EngineConfig();
        config.setMaxEventsPerTimestamp(100);

        assertEquals(100 + 4, config.maxEventsPerTimestampFor(1));
        assertEquals(100 + 4, config.maxEventsPerTimestampFor(0));
    }
}
