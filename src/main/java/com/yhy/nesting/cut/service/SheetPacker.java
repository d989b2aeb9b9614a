package com.yhy.nesting.cut.service;

import com.yhy.nesting.cut.vo.InstanceId;
import com.yhy.nesting.cut.vo.Part;
import com.yhy.nesting.cut.vo.PlacedPart;
import com.yhy.nesting.cut.vo.Placement;
import com.yhy.nesting.cut.vo.SheetCapacity;
import com.yhy.nesting.cut.vo.SheetLayout;
import com.yhy.nesting.cut.vo.SheetNestingOptions;
import com.yhy.nesting.cut.vo.SheetNestingResult;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 板材排样（二维矩形）
 * - 按 (牌号, 厚度) 分组，没有对应板材的组整组未排
 * - 零件按数量展开为单件，按面积降序
 * - 按调用方给出的顺序逐种板材开新板，每张板用左下优先落点逐件尝试
 * - 一张新板一件都放不下时放弃该规格，换下一种
 */
@Service
public class SheetPacker {

    private static final Logger LOGGER = LoggerFactory.getLogger(SheetPacker.class);

    private static final Comparator<PartInstance> BY_AREA_DESC =
            Comparator.comparingDouble((PartInstance i) -> i.getUnit().area()).reversed();

    private final BottomLeftPositionFinder positionFinder;

    public SheetPacker(BottomLeftPositionFinder positionFinder) {
        this.positionFinder = positionFinder;
    }

    public SheetNestingResult pack(List<SheetCapacity> sheets,
                                   List<Part> parts,
                                   SheetNestingOptions options,
                                   DensityLookup densityLookup) {
        NestingAssert.checkSheets(sheets);
        NestingAssert.checkParts(parts);
        NestingAssert.checkOptions(options);
        DensityLookup lookup = densityLookup != null ? densityLookup : DensityLookup.none();

        LOGGER.info("板材排样开始: 零件 {} 行, 板材规格 {} 种, 零件间距 {}, 边距 {}, 旋转 {}",
                parts.size(), sheets.size(), options.getPartClearance(), options.getEdgeClearance(), options.getRotation());

        List<SheetLayout> layouts = new ArrayList<>();
        List<Part> unplaced = new ArrayList<>();
        Map<String, Integer> totalSheetsUsed = new LinkedHashMap<>();

        Map<GroupKey, List<Part>> groups = parts.stream()
                .collect(Collectors.groupingBy(p -> new GroupKey(p.getGrade(), p.getThickness()),
                        LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<GroupKey, List<Part>> entry : groups.entrySet()) {
            GroupKey key = entry.getKey();
            List<Part> partsInGroup = entry.getValue();

            List<SheetCapacity> sheetDefs = sheets.stream()
                    .filter(s -> s.accepts(key.getGrade(), key.getThickness()))
                    .collect(Collectors.toList());
            if (sheetDefs.isEmpty()) {
                LOGGER.warn("牌号 {} 厚度 {} 没有可用板材, {} 行零件未排", key.getGrade(), key.getThickness(), partsInGroup.size());
                partsInGroup.stream().filter(p -> p.getQuantity() > 0).forEach(unplaced::add);
                continue;
            }

            List<PartInstance> partsToPlace = expand(partsInGroup);
            partsToPlace.sort(BY_AREA_DESC);

            for (SheetCapacity sheetDef : sheetDefs) {
                if (partsToPlace.isEmpty()) break;

                int sheetsUsedForThisDef = 0;
                while (!partsToPlace.isEmpty()
                        && (sheetDef.isUnbounded() || sheetsUsedForThisDef < sheetDef.getQuantity())) {
                    SheetLayout layout = SheetLayout.builder()
                            .sheet(sheetDef)
                            .sheetIndex(layouts.size() + 1)
                            .build();

                    List<PartInstance> remaining = new ArrayList<>();
                    for (PartInstance instance : partsToPlace) {
                        Placement position = positionFinder.findBestPosition(instance.getUnit(), sheetDef,
                                layout.getPlacedParts(), options.getPartClearance(), options.getEdgeClearance(),
                                options.getRotation());
                        if (position != null) {
                            layout.getPlacedParts().add(PlacedPart.of(instance.getUnit(), instance.getId(), position));
                        } else {
                            remaining.add(instance);
                        }
                    }

                    if (layout.getPlacedParts().isEmpty()) {
                        // 这种板材一件都放不下，换下一种
                        break;
                    }

                    partsToPlace = remaining;
                    partsToPlace.sort(BY_AREA_DESC);
                    sheetsUsedForThisDef++;

                    layout.recalculate(lookup.densityOf(sheetDef.getGrade()).orElse(options.getFallbackDensity()));
                    layouts.add(layout);
                    totalSheetsUsed.merge(NestingResults.sheetKey(sheetDef), 1, Integer::sum);

                    LOGGER.debug("第 {} 张板 {}: 放置 {} 件, 废料率 {}%", layout.getSheetIndex(),
                            NestingResults.sheetKey(sheetDef), layout.getPlacedParts().size(), layout.getWastePercentage());
                }
            }

            if (!partsToPlace.isEmpty()) {
                LOGGER.warn("牌号 {} 厚度 {} 有 {} 件无法排入", key.getGrade(), key.getThickness(), partsToPlace.size());
                partsToPlace.forEach(i -> unplaced.add(i.getUnit()));
            }
        }

        SheetNestingResult result = NestingResults.summarize(layouts, NestingResults.consolidateParts(unplaced), totalSheetsUsed);
        LOGGER.info("板材排样完成: 用板 {} 张, 总废料率 {}%, 未排零件 {} 种",
                layouts.size(), result.getTotalWastePercentage(), result.getUnplacedParts().size());
        return result;
    }

    // 单件编号按 originalId 连续递增，同一零件的多行不会撞号
    private List<PartInstance> expand(List<Part> partsInGroup) {
        Map<Long, Integer> nextIndex = new HashMap<>();
        List<PartInstance> instances = new ArrayList<>();
        for (Part p : partsInGroup) {
            for (int i = 0; i < p.getQuantity(); i++) {
                int index = nextIndex.merge(p.getOriginalId(), 1, Integer::sum) - 1;
                // 每个单件持有自己的 Part 副本
                instances.add(new PartInstance(p.toBuilder().quantity(1).build(), new InstanceId(p.getOriginalId(), index)));
            }
        }
        return instances;
    }

    @Value
    private static class GroupKey {
        String grade;
        double thickness;
    }

    @Value
    private static class PartInstance {
        Part unit;
        InstanceId id;
    }
}
