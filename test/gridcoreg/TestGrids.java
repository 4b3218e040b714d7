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
package gridcoreg;

import gridcoreg.store.Dataset;
import gridcoreg.store.GridAxis;
import gridcoreg.store.RasterVariable;
import gridcoreg.store.TimeAxis;
import java.util.Arrays;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

/**
 * Builds axes, variables and datasets for tests.
 */
public final class TestGrids
{
	public static final String[] TLL = new String[]{GridAxis.TIME, GridAxis.LAT, GridAxis.LON};
	public static final long DAY = 86400000L;


	private TestGrids()
	{
	}


	/**
	 * Pixel-registered axis covering the whole globe with the given step.
	 */
	public static GridAxis global(String sName, double dStep)
	{
		double dOrigin = GridAxis.LAT.equals(sName) ? GridAxis.LAT_ORIGIN : GridAxis.LON_ORIGIN;
		int nCount = (int)Math.round(-2.0 * dOrigin / dStep);
		return GridAxis.fromStep(sName, dOrigin + dStep / 2, dStep, nCount);
	}


	/**
	 * Pixel-registered axis from dFrom to dTo (pixel edges) with the given step.
	 */
	public static GridAxis range(String sName, double dFrom, double dTo, double dStep)
	{
		int nCount = (int)Math.round((dTo - dFrom) / dStep);
		return GridAxis.fromStep(sName, dFrom + dStep / 2, dStep, nCount);
	}


	public static TimeAxis days(int nTimes)
	{
		long[] lTimes = new long[nTimes];
		for (int nIndex = 0; nIndex < nTimes; nIndex++)
			lTimes[nIndex] = nIndex * DAY;

		return new TimeAxis(lTimes);
	}


	public static RasterVariable constant(String sName, int nTimes, int nLat, int nLon, double dValue)
	{
		double[] dData = new double[nTimes * nLat * nLon];
		Arrays.fill(dData, dValue);
		return new RasterVariable(sName, TLL, new int[]{nTimes, nLat, nLon}, dData, Map.of("units", "K"));
	}


	/**
	 * (time, lat, lon) variable whose values are computed from the flat index.
	 */
	public static RasterVariable generated(String sName, int nTimes, int nLat, int nLon, IntToDoubleFunction oValue)
	{
		double[] dData = new double[nTimes * nLat * nLon];
		for (int nIndex = 0; nIndex < dData.length; nIndex++)
			dData[nIndex] = oValue.applyAsDouble(nIndex);

		return new RasterVariable(sName, TLL, new int[]{nTimes, nLat, nLon}, dData, Map.of("long_name", sName));
	}


	public static Dataset dataset(String sName, GridAxis oLat, GridAxis oLon, int nTimes, RasterVariable... oVars)
	{
		Dataset oDataset = new Dataset(sName, oLat, oLon, days(nTimes));
		for (RasterVariable oVar : oVars)
			oDataset.addVariable(oVar);

		return oDataset;
	}


	/**
	 * Dataset with one constant variable "sst" on the given grid.
	 */
	public static Dataset constantDataset(String sName, GridAxis oLat, GridAxis oLon, int nTimes, double dValue)
	{
		return dataset(sName, oLat, oLon, nTimes, constant("sst", nTimes, oLat.size(), oLon.size(), dValue));
	}
}
