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

/**
 * Resamples a 2D grid of values, stored row-major with NaN marking missing
 * values, to a new width and height. Every axis that grows is upsampled first
 * by interpolation, then the grid is downsampled by aggregating the source
 * pixels each target pixel covers, weighted by the covered fraction of each
 * source pixel. Missing values never contribute to an aggregate.
 * @author aaron.cherney
 */
public abstract class Resample2d
{
	private Resample2d()
	{
	}


	/**
	 * Resamples the given grid. Which of the two methods is applied is decided
	 * per axis from the source and target sizes.
	 * @param dSrc row-major source values, nSrcW * nSrcH long
	 * @param nSrcW source width
	 * @param nSrcH source height
	 * @param nW target width
	 * @param nH target height
	 * @param nDsMethod downsampling code, see {@link ResampleMethods}
	 * @param nUsMethod upsampling code, see {@link ResampleMethods}
	 * @return new row-major array of nW * nH values
	 * @throws IllegalArgumentException for unknown codes or inconsistent sizes
	 */
	public static double[] resample(double[] dSrc, int nSrcW, int nSrcH, int nW, int nH, int nDsMethod, int nUsMethod)
	{
		if (!ResampleMethods.isDownsampleCode(nDsMethod))
			throw new IllegalArgumentException(String.format("Unknown downsampling method code %d", nDsMethod));
		if (!ResampleMethods.isUpsampleCode(nUsMethod))
			throw new IllegalArgumentException(String.format("Unknown upsampling method code %d", nUsMethod));
		if (nSrcW < 1 || nSrcH < 1 || nW < 1 || nH < 1)
			throw new IllegalArgumentException(String.format("Invalid grid sizes %dx%d to %dx%d", nSrcW, nSrcH, nW, nH));
		if (dSrc.length != nSrcW * nSrcH)
			throw new IllegalArgumentException(String.format("Expected %d values for %dx%d grid, got %d", nSrcW * nSrcH, nSrcW, nSrcH, dSrc.length));

		if (nW == nSrcW && nH == nSrcH)
			return dSrc.clone();

		double[] dCur = dSrc;
		int nCurW = nSrcW;
		int nCurH = nSrcH;
		if (nW > nCurW)
		{
			dCur = upsampleX(dCur, nCurW, nCurH, nW, nUsMethod);
			nCurW = nW;
		}
		if (nH > nCurH)
		{
			dCur = upsampleY(dCur, nCurW, nCurH, nH, nUsMethod);
			nCurH = nH;
		}
		if (nW < nCurW || nH < nCurH)
			dCur = downsample(dCur, nCurW, nCurH, nW, nH, nDsMethod);

		return dCur;
	}


	private static double[] upsampleX(double[] dSrc, int nSrcW, int nH, int nW, int nMethod)
	{
		int[] nLow = new int[nW];
		int[] nHigh = new int[nW];
		double[] dFrac = new double[nW];
		interpolationIndices(nSrcW, nW, nMethod, nLow, nHigh, dFrac);

		double[] dDst = new double[nW * nH];
		for (int nY = 0; nY < nH; nY++)
		{
			int nRow = nY * nSrcW;
			for (int nX = 0; nX < nW; nX++)
				dDst[nY * nW + nX] = blend(dSrc[nRow + nLow[nX]], dSrc[nRow + nHigh[nX]], dFrac[nX]);
		}
		return dDst;
	}


	private static double[] upsampleY(double[] dSrc, int nW, int nSrcH, int nH, int nMethod)
	{
		int[] nLow = new int[nH];
		int[] nHigh = new int[nH];
		double[] dFrac = new double[nH];
		interpolationIndices(nSrcH, nH, nMethod, nLow, nHigh, dFrac);

		double[] dDst = new double[nW * nH];
		for (int nY = 0; nY < nH; nY++)
		{
			int nLowRow = nLow[nY] * nW;
			int nHighRow = nHigh[nY] * nW;
			for (int nX = 0; nX < nW; nX++)
				dDst[nY * nW + nX] = blend(dSrc[nLowRow + nX], dSrc[nHighRow + nX], dFrac[nY]);
		}
		return dDst;
	}


	/**
	 * Fills, for each target pixel, the two source pixels it is interpolated
	 * from and the weight of the second one. Target pixel centers are mapped
	 * onto source pixel centers.
	 */
	private static void interpolationIndices(int nSrc, int nDst, int nMethod, int[] nLow, int[] nHigh, double[] dFrac)
	{
		for (int nIndex = 0; nIndex < nDst; nIndex++)
		{
			if (nMethod == ResampleMethods.US_NEAREST)
			{
				int nNearest = Math.min(nSrc - 1, (int)Math.floor((nIndex + 0.5) * nSrc / nDst));
				nLow[nIndex] = nNearest;
				nHigh[nIndex] = nNearest;
				dFrac[nIndex] = 0.0;
			}
			else
			{
				double dPos = (nIndex + 0.5) * nSrc / nDst - 0.5;
				dPos = Math.max(0.0, Math.min(nSrc - 1, dPos)); // clamp at the outer pixel centers
				int nFloor = (int)Math.floor(dPos);
				nLow[nIndex] = nFloor;
				nHigh[nIndex] = Math.min(nSrc - 1, nFloor + 1);
				dFrac[nIndex] = dPos - nFloor;
			}
		}
	}


	/**
	 * Linear blend of two values. If one of them is missing the other is used,
	 * unless the target sits exactly on the missing one.
	 */
	private static double blend(double dLow, double dHigh, double dFrac)
	{
		if (dFrac == 0.0)
			return dLow;

		boolean bLow = !Double.isNaN(dLow);
		boolean bHigh = !Double.isNaN(dHigh);
		if (bLow && bHigh)
			return dLow * (1.0 - dFrac) + dHigh * dFrac;
		if (bLow)
			return dLow;
		if (bHigh)
			return dHigh;
		return Double.NaN;
	}


	/**
	 * Source pixels covered by each target pixel along one axis
	 */
	private static class Windows
	{
		final int[] m_nStart;
		final double[][] m_dWeights;


		Windows(int nSrc, int nDst)
		{
			m_nStart = new int[nDst];
			m_dWeights = new double[nDst][];
			for (int nIndex = 0; nIndex < nDst; nIndex++)
			{
				double dLow = (double)nIndex * nSrc / nDst;
				double dHigh = (double)(nIndex + 1) * nSrc / nDst;
				int nStart = (int)Math.floor(dLow);
				int nEnd = Math.min(nSrc, (int)Math.ceil(dHigh));
				double[] dWeights = new double[Math.max(0, nEnd - nStart)];
				for (int nCell = nStart; nCell < nEnd; nCell++)
					dWeights[nCell - nStart] = Math.max(0.0, Math.min(nCell + 1, dHigh) - Math.max(nCell, dLow));

				m_nStart[nIndex] = nStart;
				m_dWeights[nIndex] = dWeights;
			}
		}
	}


	private static double[] downsample(double[] dSrc, int nSrcW, int nSrcH, int nW, int nH, int nMethod)
	{
		Windows oCols = new Windows(nSrcW, nW);
		Windows oRows = new Windows(nSrcH, nH);
		double[] dDst = new double[nW * nH];
		double[] dModeVals = new double[16];
		double[] dModeWeights = new double[16];
		for (int nY = 0; nY < nH; nY++)
		{
			int nRowStart = oRows.m_nStart[nY];
			double[] dRowWeights = oRows.m_dWeights[nY];
			for (int nX = 0; nX < nW; nX++)
			{
				int nColStart = oCols.m_nStart[nX];
				double[] dColWeights = oCols.m_dWeights[nX];
				int nCells = dRowWeights.length * dColWeights.length;
				if (dModeVals.length < nCells)
				{
					dModeVals = new double[nCells];
					dModeWeights = new double[nCells];
				}
				dDst[nY * nW + nX] = aggregate(dSrc, nSrcW, nRowStart, dRowWeights, nColStart, dColWeights, nMethod, dModeVals, dModeWeights);
			}
		}
		return dDst;
	}


	private static double aggregate(double[] dSrc, int nSrcW, int nRowStart, double[] dRowWeights, int nColStart, double[] dColWeights,
		int nMethod, double[] dModeVals, double[] dModeWeights)
	{
		double dFirst = Double.NaN;
		double dLast = Double.NaN;
		double dSumW = 0.0;
		double dSumWV = 0.0;
		int nModeCount = 0;
		for (int nR = 0; nR < dRowWeights.length; nR++)
		{
			int nRow = (nRowStart + nR) * nSrcW;
			for (int nC = 0; nC < dColWeights.length; nC++)
			{
				double dW = dRowWeights[nR] * dColWeights[nC];
				double dVal = dSrc[nRow + nColStart + nC];
				if (dW <= 0.0 || Double.isNaN(dVal))
					continue;

				if (Double.isNaN(dFirst))
					dFirst = dVal;
				dLast = dVal;
				dSumW += dW;
				dSumWV += dW * dVal;
				if (nMethod == ResampleMethods.DS_MODE)
				{
					int nFound = 0;
					while (nFound < nModeCount && dModeVals[nFound] != dVal)
						++nFound;
					if (nFound == nModeCount)
					{
						dModeVals[nModeCount] = dVal;
						dModeWeights[nModeCount++] = 0.0;
					}
					dModeWeights[nFound] += dW;
				}
			}
		}

		if (dSumW == 0.0) // no valid pixels
			return Double.NaN;

		switch (nMethod)
		{
			case ResampleMethods.DS_FIRST:
				return dFirst;
			case ResampleMethods.DS_LAST:
				return dLast;
			case ResampleMethods.DS_MEAN:
				return dSumWV / dSumW;
			case ResampleMethods.DS_MODE:
			{
				int nBest = 0;
				for (int nIndex = 1; nIndex < nModeCount; nIndex++)
				{
					if (dModeWeights[nIndex] > dModeWeights[nBest]) // ties keep the first value seen
						nBest = nIndex;
				}
				return dModeVals[nBest];
			}
			case ResampleMethods.DS_VAR:
				return variance(dSrc, nSrcW, nRowStart, dRowWeights, nColStart, dColWeights, dSumWV / dSumW, dSumW);
			case ResampleMethods.DS_STD:
				return Math.sqrt(variance(dSrc, nSrcW, nRowStart, dRowWeights, nColStart, dColWeights, dSumWV / dSumW, dSumW));
			default:
				throw new IllegalArgumentException(String.format("Unknown downsampling method code %d", nMethod));
		}
	}


	/**
	 * Weighted population variance of the valid pixels in a window
	 */
	private static double variance(double[] dSrc, int nSrcW, int nRowStart, double[] dRowWeights, int nColStart, double[] dColWeights, double dMean, double dSumW)
	{
		double dSum = 0.0;
		for (int nR = 0; nR < dRowWeights.length; nR++)
		{
			int nRow = (nRowStart + nR) * nSrcW;
			for (int nC = 0; nC < dColWeights.length; nC++)
			{
				double dW = dRowWeights[nR] * dColWeights[nC];
				double dVal = dSrc[nRow + nColStart + nC];
				if (dW <= 0.0 || Double.isNaN(dVal))
					continue;

				double dDiff = dVal - dMean;
				dSum += dW * dDiff * dDiff;
			}
		}
		return dSum / dSumW;
	}
}
