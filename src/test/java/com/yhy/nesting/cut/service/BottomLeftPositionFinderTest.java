package com.yhy.nesting.cut.service;

import com.yhy.nesting.cut.vo.InstanceId;
import com.yhy.nesting.cut.vo.Part;
import com.yhy.nesting.cut.vo.PlacedPart;
import com.yhy.nesting.cut.vo.Placement;
import com.yhy.nesting.cut.vo.RotationOption;
import com.yhy.nesting.cut.vo.SheetCapacity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BottomLeftPositionFinderTest {

    private final BottomLeftPositionFinder finder = new BottomLeftPositionFinder();

    private static SheetCapacity sheet(double length, double width) {
        return SheetCapacity.builder().id("s").length(length).width(width).thickness(2).grade("MS").build();
    }

    private static Part part(double length, double width) {
        return Part.builder().id(1).originalId(1).length(length).width(width).thickness(2).grade("MS").quantity(1).build();
    }

    @Test
    // 空板应落在 (边距, 边距)
    void emptySheetUsesEdgeClearanceOrigin() {
        Placement p = finder.findBestPosition(part(200, 100), sheet(1000, 500), List.of(), 5, 10, RotationOption.NONE);

        assertNotNull(p);
        assertEquals(10, p.getX());
        assertEquals(10, p.getY());
        assertFalse(p.isRotated());
    }

    @Test
    // 第二件应落在第一件右侧，间隔为零件间距
    void secondPartGoesRightOfFirst() {
        Part part = part(400, 300);
        List<PlacedPart> placed = new ArrayList<>();
        placed.add(PlacedPart.of(part, new InstanceId(1, 0), new Placement(0, 0, false)));

        Placement p = finder.findBestPosition(part, sheet(1000, 500), placed, 5, 0, RotationOption.NONE);

        assertNotNull(p);
        assertEquals(305, p.getX());
        assertEquals(0, p.getY());
    }

    @Test
    // 只有旋转后才能放下
    void rotationOnlyFit() {
        SheetCapacity sheet = sheet(500, 300);
        Part part = part(450, 100);

        Placement rotated = finder.findBestPosition(part, sheet, List.of(), 0, 0, RotationOption.NINETY);
        assertNotNull(rotated);
        assertTrue(rotated.isRotated());

        assertNull(finder.findBestPosition(part, sheet, List.of(), 0, 0, RotationOption.NONE));
    }

    @Test
    // 得分相同时保留不旋转
    void tieKeepsUnrotatedOrientation() {
        Placement p = finder.findBestPosition(part(200, 100), sheet(1000, 500), List.of(), 0, 0, RotationOption.FREE);

        assertNotNull(p);
        assertFalse(p.isRotated());
        assertEquals(0, p.getX());
        assertEquals(0, p.getY());
    }

    @Test
    // 零件超出板材时返回 null
    void tooLargeReturnsNull() {
        assertNull(finder.findBestPosition(part(600, 600), sheet(1000, 500), List.of(), 0, 0, RotationOption.NINETY));
    }

    @Test
    // 边距会缩小可用区域
    void edgeClearanceShrinksUsableArea() {
        assertNotNull(finder.findBestPosition(part(500, 1000), sheet(1000, 500), List.of(), 0, 0, RotationOption.NONE));
        assertNull(finder.findBestPosition(part(500, 1000), sheet(1000, 500), List.of(), 0, 1, RotationOption.NONE));
    }

    @Test
    // 带间距的包围盒不能相交
    void canPlaceHonoursPartClearance() {
        SheetCapacity sheet = sheet(1000, 500);
        List<PlacedPart> placed = List.of(PlacedPart.of(part(100, 100), new InstanceId(1, 0), new Placement(0, 0, false)));

        assertFalse(finder.canPlace(50, 50, 105, 0, sheet, placed, 10, 0));
        assertTrue(finder.canPlace(50, 50, 110, 0, sheet, placed, 10, 0));
        assertTrue(finder.canPlace(50, 50, 0, 110, sheet, placed, 10, 0));
    }

    @Test
    // 已旋转的零件按互换后的尺寸参与碰撞
    void rotatedNeighbourUsesSwappedExtents() {
        Part neighbour = part(300, 100);
        List<PlacedPart> placed = List.of(PlacedPart.of(neighbour, new InstanceId(1, 0), new Placement(0, 0, true)));

        Placement p = finder.findBestPosition(part(100, 100), sheet(1000, 500), placed, 0, 0, RotationOption.NONE);

        assertNotNull(p);
        assertEquals(300, p.getX());
        assertEquals(0, p.getY());
    }
}
