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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named n-dimensional array of values with attribute metadata. Values are
 * stored in a flat row-major array ordered by the dimension names. Missing
 * values are NaN.
 * @author Federal Highway Administration
 */
public class RasterVariable
{
	/**
	 * Variable name
	 */
	private final String m_sName;


	/**
	 * Dimension names, in storage order
	 */
	private final String[] m_sDims;


	/**
	 * Length of each dimension
	 */
	private final int[] m_nShape;


	/**
	 * Row-major values
	 */
	private final double[] m_dData;


	/**
	 * Attribute metadata such as units and long_name
	 */
	private final Map<String, Object> m_oAttrs;


	/**
	 * Preferred storage chunk length per dimension, same length as the shape
	 */
	private final int[] m_nChunks;


	/**
	 * Constructs a new variable holding a copy of the given values. The chunk
	 * shape defaults to the full shape.
	 * @param sName variable name
	 * @param sDims dimension names
	 * @param nShape dimension lengths
	 * @param dData row-major values, its length must be the product of the shape
	 * @param oAttrs attributes, copied, may be null
	 */
	public RasterVariable(String sName, String[] sDims, int[] nShape, double[] dData, Map<String, Object> oAttrs)
	{
		this(sName, sDims, nShape, dData.clone(), oAttrs, nShape.clone());
	}


	private RasterVariable(String sName, String[] sDims, int[] nShape, double[] dData, Map<String, Object> oAttrs, int[] nChunks)
	{
		if (sDims.length != nShape.length)
			throw new IllegalArgumentException(String.format("%s has %d dimension names for %d dimensions", sName, sDims.length, nShape.length));
		long lSize = 1;
		for (int nLen : nShape)
			lSize *= nLen;
		if (lSize != dData.length)
			throw new IllegalArgumentException(String.format("%s shape %s needs %d values, got %d", sName, Arrays.toString(nShape), lSize, dData.length));

		m_sName = sName;
		m_sDims = sDims.clone();
		m_nShape = nShape.clone();
		m_dData = dData;
		m_oAttrs = oAttrs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(oAttrs);
		m_nChunks = nChunks;
	}


	/**
	 * Assembles a (time, lat, lon) variable from resampled time slices. The
	 * values are written in the order of the given dimension names, which may
	 * list lat and lon in either order. Each time step becomes its own chunk.
	 * @param sName variable name
	 * @param sDims dimension names containing time, lat and lon
	 * @param dSlices one row-major (lat, lon) slice per time step
	 * @param nHeight number of latitudes in every slice
	 * @param nWidth number of longitudes in every slice
	 * @param oAttrs attributes, copied
	 * @return the new variable
	 */
	public static RasterVariable fromSlices(String sName, String[] sDims, double[][] dSlices, int nHeight, int nWidth, Map<String, Object> oAttrs)
	{
		int nTimes = dSlices.length;
		int[] nShape = new int[sDims.length];
		int[] nChunks = new int[sDims.length];
		for (int nIndex = 0; nIndex < sDims.length; nIndex++)
		{
			switch (sDims[nIndex])
			{
				case GridAxis.TIME:
					nShape[nIndex] = nTimes;
					nChunks[nIndex] = 1;
					break;
				case GridAxis.LAT:
					nShape[nIndex] = nHeight;
					nChunks[nIndex] = nHeight;
					break;
				case GridAxis.LON:
					nShape[nIndex] = nWidth;
					nChunks[nIndex] = nWidth;
					break;
				default:
					throw new IllegalArgumentException(String.format("%s has unexpected dimension %s", sName, sDims[nIndex]));
			}
		}

		int[] nStrides = strides(nShape);
		int nTimeStride = nStrides[indexOf(sDims, GridAxis.TIME)];
		int nLatStride = nStrides[indexOf(sDims, GridAxis.LAT)];
		int nLonStride = nStrides[indexOf(sDims, GridAxis.LON)];
		double[] dData = new double[nTimes * nHeight * nWidth];
		for (int nT = 0; nT < nTimes; nT++)
		{
			double[] dSlice = dSlices[nT];
			if (dSlice.length != nHeight * nWidth)
				throw new IllegalArgumentException(String.format("%s slice %d has %d values, expected %d", sName, nT, dSlice.length, nHeight * nWidth));
			for (int nY = 0; nY < nHeight; nY++)
			{
				for (int nX = 0; nX < nWidth; nX++)
					dData[nT * nTimeStride + nY * nLatStride + nX * nLonStride] = dSlice[nY * nWidth + nX];
			}
		}
		return new RasterVariable(sName, sDims, nShape, dData, oAttrs, nChunks);
	}


	public String getName()
	{
		return m_sName;
	}


	public String[] getDims()
	{
		return m_sDims.clone();
	}


	public int[] getShape()
	{
		return m_nShape.clone();
	}


	public int[] getChunks()
	{
		return m_nChunks.clone();
	}


	/**
	 * @return an unmodifiable view of the attributes
	 */
	public Map<String, Object> getAttrs()
	{
		return Collections.unmodifiableMap(m_oAttrs);
	}


	/**
	 * @return a copy of the row-major values
	 */
	public double[] getData()
	{
		return m_dData.clone();
	}


	/**
	 * Gets the position of the given dimension.
	 * @param sDim dimension name
	 * @return index into the shape, -1 if the variable does not have the dimension
	 */
	public int indexOfDim(String sDim)
	{
		return indexOf(m_sDims, sDim);
	}


	/**
	 * Gets the length of the given dimension.
	 * @param sDim dimension name
	 * @return length of the dimension
	 * @throws IllegalArgumentException if the dimension does not exist
	 */
	public int getDimSize(String sDim)
	{
		int nIndex = indexOfDim(sDim);
		if (nIndex < 0)
			throw new IllegalArgumentException(String.format("%s has no %s dimension", m_sName, sDim));

		return m_nShape[nIndex];
	}


	/**
	 * Gets the value at the given indices, one per dimension in storage order.
	 * @param nIndices one index per dimension
	 * @return the stored value
	 */
	public double get(int... nIndices)
	{
		int[] nStrides = strides(m_nShape);
		int nOffset = 0;
		for (int nIndex = 0; nIndex < nIndices.length; nIndex++)
			nOffset += nIndices[nIndex] * nStrides[nIndex];

		return m_dData[nOffset];
	}


	/**
	 * Extracts the (lat, lon) slice of the given time step as a new row-major
	 * array, whatever the storage order of the dimensions.
	 * @param nTime time index
	 * @return height * width values, latitude major
	 */
	public double[] getSlice(int nTime)
	{
		int nHeight = getDimSize(GridAxis.LAT);
		int nWidth = getDimSize(GridAxis.LON);
		int[] nStrides = strides(m_nShape);
		int nBase = nTime * nStrides[indexOfDim(GridAxis.TIME)];
		int nLatStride = nStrides[indexOfDim(GridAxis.LAT)];
		int nLonStride = nStrides[indexOfDim(GridAxis.LON)];

		double[] dSlice = new double[nHeight * nWidth];
		for (int nY = 0; nY < nHeight; nY++)
		{
			for (int nX = 0; nX < nWidth; nX++)
				dSlice[nY * nWidth + nX] = m_dData[nBase + nY * nLatStride + nX * nLonStride];
		}
		return dSlice;
	}


	private static int[] strides(int[] nShape)
	{
		int[] nStrides = new int[nShape.length];
		int nStride = 1;
		for (int nIndex = nShape.length - 1; nIndex >= 0; nIndex--)
		{
			nStrides[nIndex] = nStride;
			nStride *= nShape[nIndex];
		}
		return nStrides;
	}


	private static int indexOf(String[] sDims, String sDim)
	{
		for (int nIndex = 0; nIndex < sDims.length; nIndex++)
		{
			if (sDims[nIndex].equals(sDim))
				return nIndex;
		}
		return -1;
	}


	@Override
	public String toString()
	{
		return String.format("%s%s%s", m_sName, Arrays.toString(m_sDims), Arrays.toString(m_nShape));
	}
}
