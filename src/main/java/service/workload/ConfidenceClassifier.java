package service.workload;

import common.consts.EventKindEnum;
import common.util.RandomUtil;
import model.dto.request.SimulationConfig;

import java.util.Random;

/**
 * 图像识别模块的抽象：按经验分布生成分类置信度
 * 入侵事件取 N(true_mean, true_std)，噪声取 N(false_mean, false_std)，截断到 [0, 1]
 */
public class ConfidenceClassifier {

    private final double trueMean;
    private final double trueStd;
    private final double falseMean;
    private final double falseStd;
    private final Random random;

    public ConfidenceClassifier(SimulationConfig config, Random random) {
        this.trueMean = config.getTrueConfidenceMean();
        this.trueStd = config.getTrueConfidenceStd();
        this.falseMean = config.getFalseConfidenceMean();
        this.falseStd = config.getFalseConfidenceStd();
        this.random = random;
    }

    /**
     * 每次调用独立抽样一次
     */
    public double analyze(EventKindEnum kind) {
        double confidence = kind == EventKindEnum.INTRUDER
                ? RandomUtil.gaussian(random, trueMean, trueStd)
                : RandomUtil.gaussian(random, falseMean, falseStd);
        return RandomUtil.clampUnit(confidence);
    }
}
