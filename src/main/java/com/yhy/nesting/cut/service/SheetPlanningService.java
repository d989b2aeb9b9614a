package com.yhy.nesting.cut.service;

import com.yhy.nesting.cut.config.NestingProperties;
import com.yhy.nesting.cut.vo.Part;
import com.yhy.nesting.cut.vo.SheetCapacity;
import com.yhy.nesting.cut.vo.SheetFillResult;
import com.yhy.nesting.cut.vo.SheetLayout;
import com.yhy.nesting.cut.vo.SheetNestingOptions;
import com.yhy.nesting.cut.vo.SheetNestingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 自动选板排样。
 * <p>
 * 大批量零件或标准板放不下的零件各自定制一种板长单独排样，其余零件先塞进定制板的空隙，
 * 剩下的再按 (牌号, 厚度) 分组排到标准板上，最后合并并重新编号。
 */
@Service
public class SheetPlanningService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SheetPlanningService.class);

    private final SheetPacker sheetPacker;
    private final SheetFillService sheetFillService;
    private final NestingProperties.PlanningConfig config;

    public SheetPlanningService(SheetPacker sheetPacker, SheetFillService sheetFillService, NestingProperties properties) {
        this.sheetPacker = sheetPacker;
        this.sheetFillService = sheetFillService;
        this.config = properties.getPlanning();
    }

    public SheetNestingResult plan(List<Part> parts, SheetNestingOptions options, DensityLookup densityLookup) {
        NestingAssert.checkParts(parts);
        NestingAssert.checkOptions(options);
        DensityLookup lookup = densityLookup != null ? densityLookup : DensityLookup.none();

        List<Part> customParts = new ArrayList<>();
        List<Part> standardParts = new ArrayList<>();
        for (Part p : parts) {
            double density = lookup.densityOf(p.getGrade()).orElse(options.getFallbackDensity());
            if (p.getQuantity() > 0 && needsCustomSheet(p, options, density)) {
                customParts.add(p);
            } else {
                standardParts.add(p);
            }
        }
        LOGGER.info("自动排样开始: 定制板零件 {} 行, 标准板零件 {} 行", customParts.size(), standardParts.size());

        List<SheetNestingResult> results = new ArrayList<>();
        List<Part> tooWide = new ArrayList<>();
        List<SheetLayout> customLayouts = new ArrayList<>();
        for (Part p : customParts) {
            double density = lookup.densityOf(p.getGrade()).orElse(options.getFallbackDensity());
            SheetCapacity customSheet = customSheetFor(p, options, density);
            if (customSheet == null) {
                LOGGER.warn("零件 {} 宽度 {} 超出定制板最大宽度, 无法排样", p.getId(), Math.min(p.getLength(), p.getWidth()));
                tooWide.add(p);
                continue;
            }
            LOGGER.debug("零件 {} 使用定制板 {} ({}x{})", p.getId(), customSheet.getId(), customSheet.getLength(), customSheet.getWidth());
            SheetNestingResult result = sheetPacker.pack(List.of(customSheet), List.of(p), options, lookup);
            customLayouts.addAll(result.getLayouts());
            results.add(result);
        }
        if (!tooWide.isEmpty()) {
            results.add(SheetNestingResult.builder().unplacedParts(NestingResults.consolidateParts(tooWide)).build());
        }

        List<Part> remainingStandard = standardParts;
        if (!customLayouts.isEmpty() && !standardParts.isEmpty()) {
            SheetFillResult fillResult = sheetFillService.fill(customLayouts, standardParts, options, lookup);
            remainingStandard = fillResult.getRemainingFillers();
        }

        Map<String, List<Part>> groups = remainingStandard.stream()
                .filter(p -> p.getQuantity() > 0)
                .collect(Collectors.groupingBy(p -> p.getGrade() + "|" + p.getThickness(), LinkedHashMap::new, Collectors.toList()));
        for (List<Part> partsInGroup : groups.values()) {
            Part first = partsInGroup.get(0);
            List<SheetCapacity> catalog = standardSheetsFor(first.getGrade(), first.getThickness(), partsInGroup, options);
            results.add(sheetPacker.pack(catalog, partsInGroup, options, lookup));
        }

        SheetNestingResult merged = NestingResults.mergeSheetResults(results);
        LOGGER.info("自动排样完成: 用板 {} 张, 总废料率 {}%, 未排零件 {} 种",
                merged.getLayouts().size(), merged.getTotalWastePercentage(), merged.getUnplacedParts().size());
        return merged;
    }

    /**
     * 大批量（数量与总吨位同时超过阈值）或标准板放不下的零件需要定制板。
     */
    public boolean needsCustomSheet(Part part, SheetNestingOptions options, double density) {
        boolean batch = part.getQuantity() > config.getMinQuantity() && totalTons(part, density) > config.getMinWeight();
        return batch || !fitsStandardSheet(part, options);
    }

    public boolean fitsStandardSheet(Part part, SheetNestingOptions options) {
        double longSide = config.getStandardLength();
        double wide = config.getWideWidth();
        boolean straight = part.getLength() <= longSide && part.getWidth() <= wide;
        boolean turned = options.getRotation().allowsRotation() && part.getWidth() <= longSide && part.getLength() <= wide;
        return straight || turned;
    }

    /**
     * 按零件长边沿板长方向排满一列来定制板长，板宽取窄板或宽板。
     *
     * @return 定制板（不限量）；零件短边加两侧边距仍超过可选宽度时返回 null
     */
    public SheetCapacity customSheetFor(Part part, SheetNestingOptions options, double density) {
        double startMargin = options.getEdgeClearance();
        double endMargin = config.getLengthExtension();
        double gap = options.getPartClearance();
        double dim = Math.max(part.getLength(), part.getWidth());
        double other = Math.min(part.getLength(), part.getWidth());

        int count = (int) Math.floor((config.getMaxLength() - startMargin - endMargin + gap) / (dim + gap));
        count = Math.max(1, count);
        double length = startMargin + count * dim + (count - 1) * gap + endMargin;
        length = Math.ceil(length / 10) * 10;
        length = Math.max(config.getMinCustomLength(), Math.min(config.getMaxLength(), length));

        boolean wide = totalTons(part, density) > config.getMinWeightForWideWidth()
                || isWideThickness(part.getThickness())
                || other + 2 * startMargin > config.getNarrowWidth();
        double width = wide ? config.getWideWidth() : config.getNarrowWidth();
        if (other + 2 * startMargin > width) {
            return null;
        }

        return SheetCapacity.builder()
                .id("custom-" + part.getGrade() + "-" + NestingResults.formatNumber(part.getThickness()) + "-" + part.getOriginalId())
                .length(length)
                .width(width)
                .thickness(part.getThickness())
                .grade(part.getGrade())
                .quantity(null)
                .build();
    }

    /**
     * 标准板规格，均不限量，按尝试顺序排列。
     */
    public List<SheetCapacity> standardSheetsFor(String grade, double thickness, List<Part> parts, SheetNestingOptions options) {
        String thk = NestingResults.formatNumber(thickness);
        SheetCapacity shortNarrow = standardSheet("s1-" + grade + "-" + thk, config.getStandardShortLength(), config.getNarrowWidth(), grade, thickness);
        SheetCapacity longNarrow = standardSheet("s2-" + grade + "-" + thk, config.getStandardLength(), config.getNarrowWidth(), grade, thickness);
        SheetCapacity longWide = standardSheet("s3-" + grade + "-" + thk, config.getStandardLength(), config.getWideWidth(), grade, thickness);

        if (isWideThickness(thickness)) {
            return List.of(longWide);
        }
        List<SheetCapacity> sheets = new ArrayList<>(List.of(shortNarrow, longNarrow));
        if (thickness >= config.getThickPlateThickness() || parts.stream().anyMatch(p -> needsWideSheet(p, options))) {
            sheets.add(longWide);
        }
        return sheets;
    }

    private boolean needsWideSheet(Part p, SheetNestingOptions options) {
        double narrow = config.getNarrowWidth();
        double wide = config.getWideWidth();
        double longSide = config.getStandardLength();
        boolean straight = p.getWidth() > narrow && p.getWidth() <= wide && p.getLength() <= longSide;
        boolean turned = options.getRotation().allowsRotation()
                && p.getLength() > narrow && p.getLength() <= wide && p.getWidth() <= longSide;
        return straight || turned;
    }

    private boolean isWideThickness(double thickness) {
        return config.getThicknessesForWideWidth().stream().anyMatch(t -> t != null && Double.compare(t, thickness) == 0);
    }

    private static SheetCapacity standardSheet(String id, double length, double width, String grade, double thickness) {
        return SheetCapacity.builder().id(id).length(length).width(width).thickness(thickness).grade(grade).quantity(null).build();
    }

    // 该行零件总重，吨
    private static double totalTons(Part part, double density) {
        return SheetLayout.weightOf(part.area(), part.getThickness(), density) * part.getQuantity() / 1000;
    }
}
