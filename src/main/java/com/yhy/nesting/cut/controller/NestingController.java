package com.yhy.nesting.cut.controller;

import com.yhy.nesting.cut.config.NestingProperties;
import com.yhy.nesting.cut.service.DensityLookup;
import com.yhy.nesting.cut.service.LinearPacker;
import com.yhy.nesting.cut.service.MaterialDensityTable;
import com.yhy.nesting.cut.service.SheetFillService;
import com.yhy.nesting.cut.service.SheetPacker;
import com.yhy.nesting.cut.service.SheetPlanningService;
import com.yhy.nesting.cut.vo.*;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;


@RestController()
@RequestMapping(value = "api/nest")
public class NestingController {

    private static final Logger LOGGER = LoggerFactory.getLogger(NestingController.class);

    private final SheetPacker sheetPacker;
    private final LinearPacker linearPacker;
    private final SheetFillService sheetFillService;
    private final SheetPlanningService sheetPlanningService;
    private final MaterialDensityTable densityTable;
    private final NestingProperties properties;

    public NestingController(SheetPacker sheetPacker,
                             LinearPacker linearPacker,
                             SheetFillService sheetFillService,
                             SheetPlanningService sheetPlanningService,
                             MaterialDensityTable densityTable,
                             NestingProperties properties) {
        this.sheetPacker = sheetPacker;
        this.linearPacker = linearPacker;
        this.sheetFillService = sheetFillService;
        this.sheetPlanningService = sheetPlanningService;
        this.densityTable = densityTable;
        this.properties = properties;
    }

    @PostMapping(value = "sheet")
    public R<SheetNestingResult> sheet(@Valid @RequestBody SheetNestingRequest request) {
        try {
            SheetNestingOptions options = sheetOptions(request.getPartClearance(), request.getEdgeClearance(), request.getRotation());
            return R.ok(sheetPacker.pack(request.getSheets(), request.getParts(), options, densityFor(request.getDensity())));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("板材排样参数错误: {}", e.getMessage());
            return R.badRequest(e.getMessage());
        }
    }

    @PostMapping(value = "sheet/fill")
    public R<SheetFillResult> fill(@Valid @RequestBody SheetFillRequest request) {
        try {
            SheetNestingOptions options = sheetOptions(request.getPartClearance(), request.getEdgeClearance(), request.getRotation());
            return R.ok(sheetFillService.fill(request.getLayouts(), request.getFillers(), options, densityFor(request.getDensity())));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("填充参数错误: {}", e.getMessage());
            return R.badRequest(e.getMessage());
        }
    }

    @PostMapping(value = "sheet/plan")
    public R<SheetNestingResult> plan(@Valid @RequestBody SheetPlanningRequest request) {
        try {
            SheetNestingOptions options = sheetOptions(request.getPartClearance(), request.getEdgeClearance(), request.getRotation());
            return R.ok(sheetPlanningService.plan(request.getParts(), options, densityFor(request.getDensity())));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("自动排样参数错误: {}", e.getMessage());
            return R.badRequest(e.getMessage());
        }
    }

    @PostMapping(value = "linear")
    public R<LinearNestingResult> linear(@Valid @RequestBody LinearNestingRequest request) {
        NestingProperties.LinearConfig defaults = properties.getLinear();
        double kerf = request.getKerf() != null ? request.getKerf().doubleValue() : defaults.getKerf();
        try {
            List<LinearPart> parts = request.getItems().stream()
                    .map(p -> LinearPart.withKerf(p.getId(), p.getRawMaterial(), p.getLength(), p.getQuantity(), kerf))
                    .collect(Collectors.toList());
            LinearNestingOptions options = LinearNestingOptions.builder()
                    .stockLength(request.getStockLength().doubleValue())
                    .leftAllowance(orZero(request.getLeftAllowance()))
                    .rightAllowance(orZero(request.getRightAllowance()))
                    .goal(request.getGoal() != null ? request.getGoal() : defaults.getGoal())
                    .shuffleIterations(request.getShuffleIterations() != null
                            ? request.getShuffleIterations() : defaults.getShuffleIterations())
                    .build();
            return R.ok(linearPacker.pack(parts, options));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("型材下料参数错误: {}", e.getMessage());
            return R.badRequest(e.getMessage());
        }
    }

    private SheetNestingOptions sheetOptions(Double partClearance, Double edgeClearance, RotationOption rotation) {
        NestingProperties.SheetConfig defaults = properties.getSheet();
        return SheetNestingOptions.builder()
                .partClearance(partClearance != null ? partClearance : defaults.getPartClearance())
                .edgeClearance(edgeClearance != null ? edgeClearance : defaults.getEdgeClearance())
                .rotation(rotation != null ? rotation : defaults.getRotation())
                .fallbackDensity(densityTable.getDefaultDensity())
                .build();
    }

    private DensityLookup densityFor(Double density) {
        return density != null && density > 0 ? DensityLookup.fixed(density) : densityTable;
    }

    private static double orZero(BigDecimal value) {
        return value != null ? value.doubleValue() : 0;
    }
}
