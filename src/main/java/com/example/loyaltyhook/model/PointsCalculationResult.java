package com.example.loyaltyhook.model;

import lombok.Value;

/**
 * 积分计算结果。points 恒为非负整数，reason 为可审计的说明。
 */
@Value
public class PointsCalculationResult {

    long points;

    String reason;

    public PointsCalculationResult(long points, String reason) {
        if (points < 0) {
            throw new IllegalArgumentException("points must not be negative: " + points);
        }
        this.points = points;
        this.reason = reason;
    }

    public static PointsCalculationResult none(String reason) {
        return new PointsCalculationResult(0, reason);
    }
}
