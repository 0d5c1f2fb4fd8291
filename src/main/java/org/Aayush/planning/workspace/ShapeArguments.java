package org.Aayush.planning.workspace;

import lombok.experimental.UtilityClass;

/**
 * Shared argument checks for shape transformations.
 */
@UtilityClass
class ShapeArguments {

    void requirePositiveFactor(double factor) {
        if (!Double.isFinite(factor) || factor <= 0.0d) {
            throw new GeometryException(
                    GeometryException.REASON_DEGENERATE_REGION,
                    "scale factor must be finite and > 0, got " + factor
            );
        }
    }

    void requireClearance(double radius) {
        if (!Double.isFinite(radius) || radius < 0.0d) {
            throw new GeometryException(
                    GeometryException.REASON_NON_FINITE_COORDINATE,
                    "inflation radius must be finite and >= 0, got " + radius
            );
        }
    }
}
