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

import gridcoreg.store.Dataset;
import gridcoreg.store.GridAxis;
import gridcoreg.store.RasterVariable;
import gridcoreg.system.MathUtil;

/**
 * Checks that coordinate axes and variables can be coregistered. Grids must be
 * equidistant, pixel-registered relative to their origin and inside the
 * global bounds, which are symmetric around zero. Comparisons are exact unless
 * a positive tolerance is given.
 * @author aaron.cherney
 */
public abstract class GridValidator
{
	private GridValidator()
	{
	}


	/**
	 * Determines if the distance between all consecutive values is equal to
	 * the distance between the first two.
	 * @param dAxis coordinate values
	 * @param dTolerance allowed difference between steps, 0 for exact
	 * @return true if the axis is equidistant, false if it is not or has less
	 * than two values
	 */
	public static boolean isEquidistant(double[] dAxis, double dTolerance)
	{
		if (dAxis.length < 2)
			return false;

		double dStep = Math.abs(dAxis[1] - dAxis[0]);
		for (int nIndex = 0; nIndex < dAxis.length - 1; nIndex++)
		{
			if (!MathUtil.equals(Math.abs(dAxis[nIndex + 1] - dAxis[nIndex]), dStep, dTolerance))
				return false;
		}
		return true;
	}


	public static boolean isEquidistant(double[] dAxis)
	{
		return isEquidistant(dAxis, 0.0);
	}


	/**
	 * Determines if the values denote the middle of pixels, meaning the
	 * distance from the origin to the first pixel's edge is a whole number of
	 * pixels.
	 * @param dAxis coordinate values, at least two
	 * @param dOrigin origin of the axis, -90 for latitude and -180 for longitude
	 * @param dTolerance allowed deviation, 0 for exact
	 * @return true if the axis is pixel-registered
	 */
	public static boolean isPixelRegistered(double[] dAxis, double dOrigin, double dTolerance)
	{
		if (dAxis.length < 2)
			return false;

		double dStep = Math.abs(dAxis[1] - dAxis[0]);
		return MathUtil.isMultiple((dAxis[0] - dStep / 2) - dOrigin, dStep, dTolerance);
	}


	public static boolean isPixelRegistered(double[] dAxis, double dOrigin)
	{
		return isPixelRegistered(dAxis, dOrigin, 0.0);
	}


	/**
	 * Determines if the axis falls into the bounds [dLowBound, |dLowBound|].
	 * @param dAxis coordinate values
	 * @param dLowBound lower bound, the upper bound is its absolute value
	 * @return true if the first value is at least the lower bound and the last
	 * is at most the upper bound
	 */
	public static boolean isWithinBounds(double[] dAxis, double dLowBound)
	{
		if (dAxis.length == 0)
			return false;

		return dAxis[0] >= dLowBound && dAxis[dAxis.length - 1] <= Math.abs(dLowBound);
	}


	/**
	 * Determines if the variable has exactly the time, lat and lon dimensions,
	 * in any order.
	 * @param oVar variable to check
	 * @return true if the variable can be resampled
	 */
	public static boolean isValidVariableShape(RasterVariable oVar)
	{
		return oVar.getDims().length == 3
			&& oVar.indexOfDim(GridAxis.TIME) >= 0
			&& oVar.indexOfDim(GridAxis.LAT) >= 0
			&& oVar.indexOfDim(GridAxis.LON) >= 0;
	}


	/**
	 * Runs the bounds, equidistance and pixel-registration checks on one axis,
	 * in that order.
	 * @param sRole "master" or "slave"
	 * @param sDataset dataset name
	 * @param oAxis axis to check, its origin is the lower global bound
	 * @param dTolerance comparison tolerance, 0 for exact
	 * @throws GridBoundsException
	 * @throws GridNotEquidistantException
	 * @throws GridNotPixelRegisteredException
	 */
	public static void checkAxis(String sRole, String sDataset, GridAxis oAxis, double dTolerance)
	{
		double[] dValues = oAxis.getValues();
		double dOrigin = oAxis.getOrigin();
		if (!isWithinBounds(dValues, dOrigin))
			throw new GridBoundsException(sRole, sDataset, oAxis.getName(), dOrigin, oAxis.first(), oAxis.last());

		if (!isEquidistant(dValues, dTolerance))
			throw new GridNotEquidistantException(sRole, sDataset, oAxis.getName(), dOrigin, oAxis.first(), oAxis.last());

		if (!isPixelRegistered(dValues, dOrigin, dTolerance))
			throw new GridNotPixelRegisteredException(sRole, sDataset, oAxis.getName(), dOrigin, oAxis.first(), oAxis.last());
	}


	/**
	 * Validates the master and slave datasets before any resampling is done:
	 * the slave axes, then the master axes, then the dimensions of every slave
	 * variable.
	 * @param oMaster dataset providing the target grid
	 * @param oSlave dataset to resample
	 * @param dTolerance comparison tolerance, 0 for exact
	 * @throws InvalidGridException if an axis fails a check
	 * @throws InvalidVariableShapeException if a slave variable is not (time, lat, lon)
	 */
	public static void validate(Dataset oMaster, Dataset oSlave, double dTolerance)
	{
		checkAxis("slave", oSlave.getName(), oSlave.getLat(), dTolerance);
		checkAxis("slave", oSlave.getName(), oSlave.getLon(), dTolerance);
		checkAxis("master", oMaster.getName(), oMaster.getLat(), dTolerance);
		checkAxis("master", oMaster.getName(), oMaster.getLon(), dTolerance);

		for (RasterVariable oVar : oSlave.getVariables().values())
		{
			if (!isValidVariableShape(oVar))
				throw new InvalidVariableShapeException(oVar.getName(), oVar.getDims());
		}
	}
}
