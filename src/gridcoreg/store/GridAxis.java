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
package gridcoreg.store;

import java.util.Arrays;

/**
 * An ordered, read-only sequence of coordinate values along one spatial
 * dimension. Values denote pixel centers in decimal degrees.
 * @author Federal Highway Administration
 */
public class GridAxis
{
	/**
	 * Name of the latitude dimension
	 */
	public static final String LAT = "lat";


	/**
	 * Name of the longitude dimension
	 */
	public static final String LON = "lon";


	/**
	 * Name of the time dimension
	 */
	public static final String TIME = "time";


	/**
	 * Origin of latitude grids
	 */
	public static final double LAT_ORIGIN = -90.0;


	/**
	 * Origin of longitude grids
	 */
	public static final double LON_ORIGIN = -180.0;


	/**
	 * Dimension name
	 */
	private final String m_sName;


	/**
	 * Coordinate values, never exposed directly
	 */
	private final double[] m_dValues;


	/**
	 * Constructs a new axis with a copy of the given values.
	 * @param sName dimension name, usually {@link #LAT} or {@link #LON}
	 * @param dValues pixel center coordinates
	 */
	public GridAxis(String sName, double... dValues)
	{
		m_sName = sName;
		m_dValues = dValues.clone();
	}


	/**
	 * Creates an axis of pixel centers starting at the given value.
	 * @param sName dimension name
	 * @param dStart first pixel center
	 * @param dStep pixel size
	 * @param nCount number of pixels
	 * @return the new axis
	 */
	public static GridAxis fromStep(String sName, double dStart, double dStep, int nCount)
	{
		double[] dValues = new double[nCount];
		for (int nIndex = 0; nIndex < nCount; nIndex++)
			dValues[nIndex] = dStart + nIndex * dStep;

		return new GridAxis(sName, dValues);
	}


	public String getName()
	{
		return m_sName;
	}


	/**
	 * Gets the origin used for pixel-registration of this axis based on its
	 * name. Latitude is -90, everything else -180.
	 * @return origin of the axis
	 */
	public double getOrigin()
	{
		return LAT.equals(m_sName) ? LAT_ORIGIN : LON_ORIGIN;
	}


	public int size()
	{
		return m_dValues.length;
	}


	public double get(int nIndex)
	{
		return m_dValues[nIndex];
	}


	public double first()
	{
		return m_dValues.length == 0 ? Double.NaN : m_dValues[0];
	}


	public double last()
	{
		return m_dValues.length == 0 ? Double.NaN : m_dValues[m_dValues.length - 1];
	}


	/**
	 * Gets the distance between the first two values.
	 * @return the pixel size, NaN if the axis has less than two values
	 */
	public double getPixelSize()
	{
		if (m_dValues.length < 2)
			return Double.NaN;

		return Math.abs(m_dValues[1] - m_dValues[0]);
	}


	/**
	 * @return a copy of the coordinate values
	 */
	public double[] getValues()
	{
		return m_dValues.clone();
	}


	/**
	 * Selects the values that fall in the inclusive range [dMin, dMax],
	 * keeping their order. The selection is a plain range and never wraps
	 * around the antimeridian.
	 * @param dMin lower bound, inclusive
	 * @param dMax upper bound, inclusive
	 * @return a new axis with the same name holding the selected values
	 */
	public GridAxis subset(double dMin, double dMax)
	{
		double[] dSelected = new double[m_dValues.length];
		int nCount = 0;
		for (double dVal : m_dValues)
		{
			if (dVal >= dMin && dVal <= dMax)
				dSelected[nCount++] = dVal;
		}
		return new GridAxis(m_sName, Arrays.copyOf(dSelected, nCount));
	}


	@Override
	public boolean equals(Object oObj)
	{
		if (this == oObj)
			return true;
		if (!(oObj instanceof GridAxis))
			return false;
		GridAxis oOther = (GridAxis)oObj;
		return m_sName.equals(oOther.m_sName) && Arrays.equals(m_dValues, oOther.m_dValues);
	}


	@Override
	public int hashCode()
	{
		return 31 * m_sName.hashCode() + Arrays.hashCode(m_dValues);
	}


	@Override
	public String toString()
	{
		return String.format("%s[%d](%s, %s)", m_sName, size(), first(), last());
	}
}
