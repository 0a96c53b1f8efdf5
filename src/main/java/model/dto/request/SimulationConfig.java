package model.dto.request;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * 单次仿真的全部参数（不可变）
 * 缺省值即标准双环围界场景；使用前必须经过 SimulationConfigValidator 校验。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SimulationConfig {

    //  运行元数据
    @Builder.Default
    String runId = UUID.randomUUID().toString().substring(0, 8);
    @Builder.Default
    long randomSeed = 42L;

    //  仿真规模
    @Builder.Default
    int eventCount = 1000;
    @Builder.Default
    double intruderProbability = 0.30;
    @Builder.Default
    double eventIntervalMean = 8.0;        // 事件平均间隔 (秒)

    //  拓扑
    @Builder.Default
    int outerRingNodes = 8;
    @Builder.Default
    int innerRingNodes = 8;
    @Builder.Default
    double outerRingRadius = 23.0;         // 米
    @Builder.Default
    double innerRingRadius = 14.0;         // 米
    @Builder.Default
    double innerRingOffsetDeg = 22.5;      // 内环相对外环的角度偏移
    @Builder.Default
    double sensorRange = 15.0;             // 传感覆盖半径
    @Builder.Default
    double p2pRange = 30.0;                // P2P 通信半径

    //  决策阈值
    @Builder.Default
    double confirmThreshold = 0.80;
    @Builder.Default
    double verifyThreshold = 0.70;
    @Builder.Default
    double verificationTimeout = 3.0;      // 秒

    //  图像置信度模型
    @Builder.Default
    double trueConfidenceMean = 0.85;
    @Builder.Default
    double trueConfidenceStd = 0.08;
    @Builder.Default
    double falseConfidenceMean = 0.35;
    @Builder.Default
    double falseConfidenceStd = 0.15;

    //  通信模型（抽象，无射频物理）
    @Builder.Default
    double lossBase = 0.0;
    @Builder.Default
    double lossPerMeter = 0.0025;
    @Builder.Default
    double delayBase = 0.1;
    @Builder.Default
    double delayPerMeter = 0.0001;
    @Builder.Default
    double delayJitter = 0.05;

    //  报文大小 (字节)
    @Builder.Default
    int msgSizeVerifyReq = 64;
    @Builder.Default
    int msgSizeVerifyResp = 32;
    @Builder.Default
    int msgSizeUplink = 51;

    //  网关可用性
    @Builder.Default
    double gatewayUpDurationMean = 1800.0;
    @Builder.Default
    double gatewayDownDurationMean = 300.0;

    /**
     * 全部缺省值的配置
     */
    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }

    public int totalNodes() {
        return outerRingNodes + innerRingNodes;
    }
}
