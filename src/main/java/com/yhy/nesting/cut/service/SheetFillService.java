package com.yhy.nesting.cut.service;

import cn.hutool.core.lang.Assert;
import com.yhy.nesting.cut.vo.InstanceId;
import com.yhy.nesting.cut.vo.Part;
import com.yhy.nesting.cut.vo.PlacedPart;
import com.yhy.nesting.cut.vo.Placement;
import com.yhy.nesting.cut.vo.SheetFillResult;
import com.yhy.nesting.cut.vo.SheetLayout;
import com.yhy.nesting.cut.vo.SheetNestingOptions;
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
 * 在已排好的板材空位里塞入填充件。
 * 每轮按面积降序找第一件能放下的填充件放一件，直到一整轮都放不下为止。
 * 传入的 layouts 会被原地修改，并重新计算面积与重量。
 */
@Service
public class SheetFillService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SheetFillService.class);

    private final BottomLeftPositionFinder positionFinder;

    public SheetFillService(BottomLeftPositionFinder positionFinder) {
        this.positionFinder = positionFinder;
    }

    public SheetFillResult fill(List<SheetLayout> layouts,
                                List<Part> fillers,
                                SheetNestingOptions options,
                                DensityLookup densityLookup) {
        Assert.notNull(layouts, "板材排样结果不能为空");
        NestingAssert.checkParts(fillers);
        NestingAssert.checkOptions(options);
        DensityLookup lookup = densityLookup != null ? densityLookup : DensityLookup.none();

        Map<Long, Part> fillerByOriginal = new LinkedHashMap<>();
        Map<Long, Integer> remainingQty = new LinkedHashMap<>();
        for (Part p : fillers) {
            fillerByOriginal.putIfAbsent(p.getOriginalId(), p.toBuilder().quantity(1).build());
            remainingQty.merge(p.getOriginalId(), p.getQuantity(), Integer::sum);
        }
        Map<Long, Integer> nextIndex = nextInstanceIndex(layouts);

        int placedCount = 0;
        for (SheetLayout layout : layouts) {
            List<Part> compatible = fillerByOriginal.values().stream()
                    .filter(p -> layout.getSheet().accepts(p.getGrade(), p.getThickness()))
                    .sorted(Comparator.comparingDouble(Part::area).reversed())
                    .collect(Collectors.toList());
            if (compatible.isEmpty()) continue;

            int placedOnLayout = 0;
            boolean placedSomethingInPass = true;
            while (placedSomethingInPass) {
                placedSomethingInPass = false;
                for (Part filler : compatible) {
                    if (remainingQty.get(filler.getOriginalId()) <= 0) continue;
                    Placement position = positionFinder.findBestPosition(filler, layout.getSheet(),
                            layout.getPlacedParts(), options.getPartClearance(), options.getEdgeClearance(),
                            options.getRotation());
                    if (position != null) {
                        int index = nextIndex.merge(filler.getOriginalId(), 1, Integer::sum) - 1;
                        layout.getPlacedParts().add(PlacedPart.of(filler.toBuilder().build(), new InstanceId(filler.getOriginalId(), index), position));
                        remainingQty.merge(filler.getOriginalId(), -1, Integer::sum);
                        placedOnLayout++;
                        placedSomethingInPass = true;
                        break;
                    }
                }
            }

            if (placedOnLayout > 0) {
                layout.recalculate(lookup.densityOf(layout.getSheet().getGrade()).orElse(options.getFallbackDensity()));
                placedCount += placedOnLayout;
                LOGGER.debug("第 {} 张板补入填充件 {} 件, 废料率 {}%", layout.getSheetIndex(), placedOnLayout, layout.getWastePercentage());
            }
        }

        List<Part> remainingFillers = new ArrayList<>();
        remainingQty.forEach((originalId, qty) -> {
            if (qty > 0) {
                remainingFillers.add(fillerByOriginal.get(originalId).toBuilder().quantity(qty).build());
            }
        });
        LOGGER.info("填充完成: 补入 {} 件, 剩余填充件 {} 种", placedCount, remainingFillers.size());

        return SheetFillResult.builder()
                .layouts(layouts)
                .remainingFillers(remainingFillers)
                .placedCount(placedCount)
                .build();
    }

    // 新单件从已有最大序号之后编号，避免与板上同一零件撞号
    private Map<Long, Integer> nextInstanceIndex(List<SheetLayout> layouts) {
        Map<Long, Integer> next = new HashMap<>();
        for (SheetLayout layout : layouts) {
            for (PlacedPart p : layout.getPlacedParts()) {
                InstanceId id = p.getInstanceId();
                if (id != null) {
                    next.merge(id.getPartId(), id.getIndex() + 1, Math::max);
                }
            }
        }
        return next;
    }
}
