package model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 平面坐标点 (米)，原点为围界中心
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Point {
    private double x;
    private double y;
}
