package common.util;

import model.entity.Point;

public class GisUtil {

    /**
     * 计算两点间的距离
     */
    public static double getDistance(Point p1, Point p2) {
        return Math.hypot(p1.getX() - p2.getX(), p1.getY() - p2.getY());
    }

    /**
     * 以原点为圆心、半径 radius 的圆周上 angleDeg 度处的点
     */
    public static Point pointOnCircle(double radius, double angleDeg) {
        double angleRad = Math.toRadians(angleDeg);
        return new Point(radius * Math.cos(angleRad), radius * Math.sin(angleRad));
    }

    /**
     * 极坐标转直角坐标（弧度）
     */
    public static Point fromPolar(double radius, double angleRad) {
        return new Point(radius * Math.cos(angleRad), radius * Math.sin(angleRad));
    }
}
