package com.yhy.nesting.cut.config;

import com.yhy.nesting.cut.vo.OptimizationGoal;
import com.yhy.nesting.cut.vo.RotationOption;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "nesting")
public class NestingProperties {
    private SheetConfig sheet = new SheetConfig();
    private LinearConfig linear = new LinearConfig();
    private PlanningConfig planning = new PlanningConfig();
    // 未知牌号的兜底密度 kg/m³
    private double defaultDensity = 7850;
    private Map<String, Double> densities = new LinkedHashMap<>(Map.of(
            "MS", 7850.0,
            "SS", 8000.0,
            "AL", 2700.0,
            "GI", 7850.0));

    @Data
    public static class SheetConfig {
        private double partClearance = 0;
        private double edgeClearance = 0;
        private RotationOption rotation = RotationOption.NINETY;
    }

    @Data
    public static class LinearConfig {
        private OptimizationGoal goal = OptimizationGoal.PRIORITIZE_SPEED;
        private int shuffleIterations = 50;
        private double kerf = 0;
        // 为空时每次排料使用新的随机种子
        private Long randomSeed;
    }

    /**
     * 自动排样：大批量或超规格零件单独定制板长，其余零件走标准板。
     * 重量单位为吨，尺寸单位 mm。
     */
    @Data
    public static class PlanningConfig {
        // 数量和总重同时超过阈值才按批量定制
        private int minQuantity = 25;
        private double minWeight = 3;
        // 定制板末端追加的长度
        private double lengthExtension = 20;
        private double minCustomLength = 1230;
        private double maxLength = 4000;
        private double narrowWidth = 1250;
        private double wideWidth = 1500;
        private double minWeightForWideWidth = 5;
        private List<Double> thicknessesForWideWidth = new ArrayList<>(List.of(8.0, 10.0, 12.0, 16.0));
        // 标准板规格
        private double standardShortLength = 2500;
        private double standardLength = 3000;
        // 不小于该厚度时标准板追加宽板规格
        private double thickPlateThickness = 8;
    }
}
