package laptrack.processing.matching.sparselap.costfunction;

/**
 * Interface representing a function that can compute the cost to link a
 * source object to a target object.
 * Adapted from TrackMate's CostFunction: https://github.com/fiji/TrackMate
 *
 * @param <S> type of sources
 * @param <T> type of targets
 */
public interface CostFunction<S, T> {
	/**
	 * @return the cost to link source to target. Never 0 for an admissible link.
	 */
	double linkingCost(S source, T target);
}
