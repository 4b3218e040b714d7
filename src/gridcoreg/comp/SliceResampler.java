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

import gridcoreg.system.Monitor;

/**
 * Resamples a single time slice of a variable.
 */
public abstract class SliceResampler
{
	/**
	 * Label of the progress span of one slice
	 */
	public static final String LABEL = "resample time slice";


	private SliceResampler()
	{
	}


	/**
	 * Masks the invalid values of the slice and resamples it with
	 * {@link Resample2d}. Reports exactly one unit of work to the parent
	 * monitor, whatever the size of the slice.
	 * @param dSlice row-major (lat, lon) values
	 * @param nSrcW number of longitudes of the slice
	 * @param nSrcH number of latitudes of the slice
	 * @param nW desired width, amount of longitudes
	 * @param nH desired height, amount of latitudes
	 * @param nDsMethod downsampling code, see {@link ResampleMethods}
	 * @param nUsMethod upsampling code, see {@link ResampleMethods}
	 * @param oParent parent progress monitor
	 * @return resampled slice of nW * nH values
	 */
	public static double[] resampleSlice(double[] dSlice, int nSrcW, int nSrcH, int nW, int nH, int nDsMethod, int nUsMethod, Monitor oParent)
	{
		Monitor oMonitor = oParent.child(1);
		try (Monitor.Scope oScope = oMonitor.observing(LABEL))
		{
			return Resample2d.resample(maskInvalid(dSlice), nSrcW, nSrcH, nW, nH, nDsMethod, nUsMethod);
		}
	}


	/**
	 * @return a copy of the values with infinities replaced by NaN
	 */
	static double[] maskInvalid(double[] dSlice)
	{
		double[] dMasked = new double[dSlice.length];
		for (int nIndex = 0; nIndex < dSlice.length; nIndex++)
		{
			double dVal = dSlice[nIndex];
			dMasked[nIndex] = Double.isInfinite(dVal) ? Double.NaN : dVal;
		}
		return dMasked;
	}
}
