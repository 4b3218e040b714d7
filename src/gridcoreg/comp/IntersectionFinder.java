/*
 * Copyright 2017 Synesis-Partners.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package gridcoreg.comp;

import gridcoreg.store.GridAxis;
import gridcoreg.system.MathUtil;

/**
 * Finds the 1D intersection of two pixel-registered axes such that the
 * intersection bounds fall on pixel boundaries of the grids.
 * <p>
 * Both grids share the origin of the global bounds, so a whole number of the
 * smaller pixels fits into one larger pixel and the bounds are moved inwards
 * in steps of the smaller pixel size. A bound is accepted as soon as it is a
 * boundary of either grid.
 * </p>
 */
public abstract class IntersectionFinder
{
	/**
	 * Maximum number of steps taken to move a bound onto a pixel boundary
	 */
	public static final int SAFETY = 100;


	/**
	 * Position of the minimum in returned bounds
	 */
	public static final int MIN = 0;


	/**
	 * Position of the maximum in returned bounds
	 */
	public static final int MAX = 1;


	private IntersectionFinder()
	{
	}


	/**
	 * Finds the intersection of the given axes with exact comparisons.
	 * @see #findIntersection(java.lang.String, double[], double[], double, double, double)
	 */
	public static double[] findIntersection(String sAxis, double[] dFirst, double[] dSecond, double dLowBound, double dHighBound)
	{
		return findIntersection(sAxis, dFirst, dSecond, dLowBound, dHighBound, 0.0);
	}


	/**
	 * Finds the intersection of the two given axes inside the global bounds.
	 * @param sAxis axis name used in error messages
	 * @param dFirst first pixel-registered, equidistant axis
	 * @param dSecond second pixel-registered, equidistant axis
	 * @param dLowBound lower global bound, the shared origin of the grids
	 * @param dHighBound upper global bound
	 * @param dTolerance tolerance of the pixel boundary test, 0 for exact
	 * @return [min, max] of the intersection
	 * @throws NoIntersectionException if the axes overlap by less than the
	 * larger pixel, the bounds cannot be moved onto a pixel boundary within
	 * {@link #SAFETY} steps, or the moved bounds collapse
	 */
	public static double[] findIntersection(String sAxis, double[] dFirst, double[] dSecond, double dLowBound, double dHighBound, double dTolerance)
	{
		double dFirstPx = Math.abs(dFirst[1] - dFirst[0]);
		double dSecondPx = Math.abs(dSecond[1] - dSecond[0]);

		double dMin = Math.max(dFirst[0] - dFirstPx / 2, dSecond[0] - dSecondPx / 2);
		double dMax = Math.min(dFirst[dFirst.length - 1] + dFirstPx / 2, dSecond[dSecond.length - 1] + dSecondPx / 2);

		if (dMax - dMin < Math.max(dFirstPx, dSecondPx))
			throw new NoIntersectionException("grids overlap by less than one pixel", sAxis, dMin, dMax, dFirstPx, dSecondPx);

		double dFiner = Math.min(dFirstPx, dSecondPx);
		int nStep = 0;
		while (!MathUtil.isMultiple(dMin - dLowBound, dFirstPx, dTolerance)
			&& !MathUtil.isMultiple(dMin - dLowBound, dSecondPx, dTolerance))
		{
			if (nStep == SAFETY)
				throw new NoIntersectionException("minimum does not fall on a pixel boundary", sAxis, dMin, dMax, dFirstPx, dSecondPx);
			dMin += dFiner;
			++nStep;
		}

		nStep = 0;
		while (!MathUtil.isMultiple(dHighBound - dMax, dFirstPx, dTolerance)
			&& !MathUtil.isMultiple(dHighBound - dMax, dSecondPx, dTolerance))
		{
			if (nStep == SAFETY)
				throw new NoIntersectionException("maximum does not fall on a pixel boundary", sAxis, dMin, dMax, dFirstPx, dSecondPx);
			dMax -= dFiner;
			++nStep;
		}

		if (dMax <= dMin) // possible with misaligned grids
			throw new NoIntersectionException("bounds collapsed", sAxis, dMin, dMax, dFirstPx, dSecondPx);

		return new double[]{dMin, dMax};
	}


	/**
	 * Finds the intersection of two axes of the same dimension, using the
	 * first axis' origin as the lower global bound and its absolute value as
	 * the upper bound.
	 * @param oFirst first axis
	 * @param oSecond second axis
	 * @param dTolerance tolerance of the pixel boundary test, 0 for exact
	 * @return [min, max] of the intersection
	 */
	public static double[] findIntersection(GridAxis oFirst, GridAxis oSecond, double dTolerance)
	{
		double dOrigin = oFirst.getOrigin();
		return findIntersection(oFirst.getName(), oFirst.getValues(), oSecond.getValues(), dOrigin, Math.abs(dOrigin), dTolerance);
	}
}
