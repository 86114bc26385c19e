package github.sarthakdev143.scene_compiler.linking;

import github.sarthakdev143.scene_compiler.model.LimitDirection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

@Component
public class GraphMath {

    public static final double DEFAULT_DERIVATIVE_STEP = 0.001;
    private static final double LIMIT_AGREEMENT_TOLERANCE = 0.01;

    private final FormulaEvaluator evaluator;

    public GraphMath(FormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public double valueAt(String formula, double x) {
        return evaluator.evaluate(formula, x);
    }

    /**
     * Symmetric difference {@code (f(x0 + h) - f(x0 - h)) / 2h}.
     */
    public double slopeAt(String formula, double x0, double step) {
        double h = step > 0 && Double.isFinite(step) ? step : DEFAULT_DERIVATIVE_STEP;
        return evaluator.compile(formula)
                .map(function -> (function.applyAsDouble(x0 + h) - function.applyAsDouble(x0 - h)) / (2.0 * h))
                .orElse(Double.NaN);
    }

    /**
     * Samples {@code f(x0 - |d|)} and/or {@code f(x0 + |d|)} for each offset, skipping undefined points.
     */
    public List<PlanePoint> limitPoints(String formula, double x0, LimitDirection direction, List<Double> deltas) {
        List<PlanePoint> points = new ArrayList<>();
        DoubleUnaryOperator function = evaluator.compile(formula).orElse(null);
        if (function == null) {
            return points;
        }
        for (Double delta : deltas) {
            double offset = Math.abs(delta);
            if (direction.includesLeft()) {
                addIfFinite(points, x0 - offset, function.applyAsDouble(x0 - offset));
            }
            if (direction.includesRight()) {
                addIfFinite(points, x0 + offset, function.applyAsDouble(x0 + offset));
            }
        }
        return points;
    }

    public LimitEstimate estimateLimit(String formula, double x0, LimitDirection direction, List<Double> deltas) {
        double smallest = deltas.stream().mapToDouble(Math::abs).filter(d -> d > 0).min().orElse(0.0001);
        double left = direction.includesLeft() ? evaluator.evaluate(formula, x0 - smallest) : Double.NaN;
        double right = direction.includesRight() ? evaluator.evaluate(formula, x0 + smallest) : Double.NaN;

        if (direction == LimitDirection.LEFT) {
            return new LimitEstimate(left, right, left, Double.isFinite(left));
        }
        if (direction == LimitDirection.RIGHT) {
            return new LimitEstimate(left, right, right, Double.isFinite(right));
        }
        boolean exists = Double.isFinite(left) && Double.isFinite(right)
                && Math.abs(left - right) < LIMIT_AGREEMENT_TOLERANCE;
        return new LimitEstimate(left, right, exists ? (left + right) / 2.0 : Double.NaN, exists);
    }

    private static void addIfFinite(List<PlanePoint> points, double x, double y) {
        if (Double.isFinite(y)) {
            points.add(new PlanePoint(x, y));
        }
    }
}
