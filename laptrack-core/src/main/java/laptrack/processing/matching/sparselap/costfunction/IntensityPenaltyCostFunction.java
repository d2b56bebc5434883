package laptrack.processing.matching.sparselap.costfunction;

/**
 * Multiplies a positional cost by a penalty that increases with the relative difference of intensity:
 * {@code cost * (1 + w * 1.5 * |Ia - Ib| / ((Ia + Ib) / 2))^2}
 * Adapted from TrackMate's FeaturePenaltyCostFunction: https://github.com/fiji/TrackMate
 */
public class IntensityPenaltyCostFunction {
	private final double weight;

	/**
	 * @param weight penalty weight; 0 disables the penalty
	 */
	public IntensityPenaltyCostFunction(double weight) {
		if (weight<0) throw new IllegalArgumentException("Penalty weight should be >=0");
		this.weight = weight;
	}

	public double penalty(final double sourceIntensity, final double targetIntensity) {
		if (weight == 0) return 1;
		final double ndiff = diff(sourceIntensity, targetIntensity);
		if ( Double.isNaN( ndiff ) ) return 1;
		final double factor = 1 + weight * 1.5 * ndiff;
		return factor * factor;
	}

	public double linkingCost(final double positionCost, final double sourceIntensity, final double targetIntensity) {
		return positionCost * penalty(sourceIntensity, targetIntensity);
	}

	private static double diff(final double a, final double b) {
		if (a == b) return 0;
		return Math.abs( a - b ) / ( ( a + b ) / 2 );
	}
}
