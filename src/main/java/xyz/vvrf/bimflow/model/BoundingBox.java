package xyz.vvrf.bimflow.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 轴对齐包围盒。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {

    private Vector3 min;
    private Vector3 max;

    public static BoundingBox of(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {
        return new BoundingBox(new Vector3(minX, minY, minZ), new Vector3(maxX, maxY, maxZ));
    }

    /**
     * 两个包围盒的最短距离；相交或接触时为 0。
     */
    public double distanceTo(BoundingBox other) {
        double dx = axisGap(min.getX(), max.getX(), other.min.getX(), other.max.getX());
        double dy = axisGap(min.getY(), max.getY(), other.min.getY(), other.max.getY());
        double dz = axisGap(min.getZ(), max.getZ(), other.min.getZ(), other.max.getZ());
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * 内部有重叠 (严格相交，仅共面不算)。
     */
    public boolean intersects(BoundingBox other) {
        return overlap(min.getX(), max.getX(), other.min.getX(), other.max.getX()) > 0
                && overlap(min.getY(), max.getY(), other.min.getY(), other.max.getY()) > 0
                && overlap(min.getZ(), max.getZ(), other.min.getZ(), other.max.getZ()) > 0;
    }

    /**
     * 在容差内接触但内部不重叠。
     */
    public boolean touches(BoundingBox other, double tolerance) {
        return !intersects(other) && distanceTo(other) <= tolerance;
    }

    public boolean contains(BoundingBox other) {
        return min.getX() <= other.min.getX() && min.getY() <= other.min.getY() && min.getZ() <= other.min.getZ()
                && max.getX() >= other.max.getX() && max.getY() >= other.max.getY() && max.getZ() >= other.max.getZ();
    }

    private static double axisGap(double aMin, double aMax, double bMin, double bMax) {
        if (aMax < bMin) {
            return bMin - aMax;
        }
        if (bMax < aMin) {
            return aMin - bMax;
        }
        return 0;
    }

    private static double overlap(double aMin, double aMax, double bMin, double bMax) {
        return Math.min(aMax, bMax) - Math.max(aMin, bMin);
    }
}
