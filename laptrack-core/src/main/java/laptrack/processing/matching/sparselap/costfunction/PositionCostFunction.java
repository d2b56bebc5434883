package laptrack.processing.matching.sparselap.costfunction;

/**
 * Cost equal to the sum of the transformed displacement along each coordinate. With {@link DistanceFunction#SQUARE} this is the square distance, suited to Brownian motion.
 * Adapted from TrackMate's SquareDistCostFunction: https://github.com/fiji/TrackMate
 */
public class PositionCostFunction implements CostFunction<double[], double[]> {
	private final DistanceFunction distanceFunction;

	public PositionCostFunction(DistanceFunction distanceFunction) {
		this.distanceFunction = distanceFunction;
	}

	public DistanceFunction getDistanceFunction() {
		return distanceFunction;
	}

	@Override
	public double linkingCost(final double[] source, final double[] target) {
		final double d = distanceFunction.cost(source, target);
		return ( d == 0 ) ? Double.MIN_NORMAL : d;
	}
}
