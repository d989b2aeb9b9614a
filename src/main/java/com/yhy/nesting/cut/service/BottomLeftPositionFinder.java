package com.yhy.nesting.cut.service;

import com.yhy.nesting.cut.vo.Part;
import com.yhy.nesting.cut.vo.PlacedPart;
import com.yhy.nesting.cut.vo.Placement;
import com.yhy.nesting.cut.vo.RotationOption;
import com.yhy.nesting.cut.vo.SheetCapacity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 左下优先（Bottom-Left）落点查找
 * - 候选点：板材原点 (边距, 边距) + 每个已放零件的右侧点与下方点
 * - 可行：零件在边距范围内，且带间距的包围盒不与任何已放零件相交
 * - 取 y 最小的可行点，y 相同取 x 最小
 * - 允许旋转时先评估不旋转，再评估旋转；得分相同保留不旋转
 */
@Component
public class BottomLeftPositionFinder {

    public Placement findBestPosition(Part part,
                                      SheetCapacity sheet,
                                      List<PlacedPart> placedParts,
                                      double partClearance,
                                      double edgeClearance,
                                      RotationOption rotation) {
        List<double[]> candidates = candidatePoints(placedParts, partClearance, edgeClearance);

        Placement best = tryPlacing(part.getWidth(), part.getLength(), false,
                candidates, sheet, placedParts, partClearance, edgeClearance, null);
        if (rotation != null && rotation.allowsRotation()) {
            best = tryPlacing(part.getLength(), part.getWidth(), true,
                    candidates, sheet, placedParts, partClearance, edgeClearance, best);
        }
        return best;
    }

    /**
     * 判断尺寸为 w x h 的零件能否以 (x, y) 为左上角放入板材。
     */
    public boolean canPlace(double w, double h, double x, double y,
                            SheetCapacity sheet,
                            List<PlacedPart> placedParts,
                            double partClearance,
                            double edgeClearance) {
        if (x < edgeClearance || y < edgeClearance) return false;
        if (x + w > sheet.getLength() - edgeClearance) return false;
        if (y + h > sheet.getWidth() - edgeClearance) return false;

        for (PlacedPart other : placedParts) {
            boolean overlaps = x < other.getX() + other.getExtentH() + partClearance
                    && other.getX() < x + w + partClearance
                    && y < other.getY() + other.getExtentV() + partClearance
                    && other.getY() < y + h + partClearance;
            if (overlaps) {
                return false;
            }
        }
        return true;
    }

    private Placement tryPlacing(double w, double h, boolean rotated,
                                 List<double[]> candidates,
                                 SheetCapacity sheet,
                                 List<PlacedPart> placedParts,
                                 double partClearance,
                                 double edgeClearance,
                                 Placement best) {
        for (double[] point : candidates) {
            double x = point[0];
            double y = point[1];
            if (!canPlace(w, h, x, y, sheet, placedParts, partClearance, edgeClearance)) {
                continue;
            }
            // 严格小于：同分时先找到的胜出
            if (best == null || y < best.getY() || (y == best.getY() && x < best.getX())) {
                best = new Placement(x, y, rotated);
            }
        }
        return best;
    }

    private List<double[]> candidatePoints(List<PlacedPart> placedParts, double partClearance, double edgeClearance) {
        List<double[]> points = new ArrayList<>(1 + placedParts.size() * 2);
        points.add(new double[]{edgeClearance, edgeClearance});
        for (PlacedPart p : placedParts) {
            points.add(new double[]{p.getX() + p.getExtentH() + partClearance, p.getY()});
            points.add(new double[]{p.getX(), p.getY() + p.getExtentV() + partClearance});
        }
        return points;
    }
}
