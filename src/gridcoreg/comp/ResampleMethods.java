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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Maps resampling method names to the codes understood by {@link Resample2d}.
 * The codes are part of the kernel's contract and must not change.
 */
public abstract class ResampleMethods
{
	public static final int US_NEAREST = 10;
	public static final int US_LINEAR = 11;

	public static final int DS_FIRST = 50;
	public static final int DS_LAST = 51;
	public static final int DS_MEAN = 54;
	public static final int DS_MODE = 56;
	public static final int DS_VAR = 57;
	public static final int DS_STD = 58;


	/**
	 * Upsampling method names, parallel to {@link #US_CODES}
	 */
	private static final String[] US_NAMES = new String[]
	{
		"nearest", "linear"
	};
	private static final int[] US_CODES = new int[]
	{
		US_NEAREST, US_LINEAR
	};


	/**
	 * Downsampling method names, parallel to {@link #DS_CODES}
	 */
	private static final String[] DS_NAMES = new String[]
	{
		"first", "last", "mean", "mode", "var", "std"
	};
	private static final int[] DS_CODES = new int[]
	{
		DS_FIRST, DS_LAST, DS_MEAN, DS_MODE, DS_VAR, DS_STD
	};


	private ResampleMethods()
	{
	}


	/**
	 * @return unmodifiable list of the upsampling method names
	 */
	public static List<String> getUpsampleNames()
	{
		return Collections.unmodifiableList(Arrays.asList(US_NAMES.clone()));
	}


	/**
	 * @return unmodifiable list of the downsampling method names
	 */
	public static List<String> getDownsampleNames()
	{
		return Collections.unmodifiableList(Arrays.asList(DS_NAMES.clone()));
	}


	/**
	 * @param sMethod upsampling method name
	 * @return the code of the method
	 * @throws IllegalArgumentException if the name is not one of {@link #getUpsampleNames()}
	 */
	public static int getUpsampleCode(String sMethod)
	{
		return lookup(sMethod, US_NAMES, US_CODES, "upsampling");
	}


	/**
	 * @param sMethod downsampling method name
	 * @return the code of the method
	 * @throws IllegalArgumentException if the name is not one of {@link #getDownsampleNames()}
	 */
	public static int getDownsampleCode(String sMethod)
	{
		return lookup(sMethod, DS_NAMES, DS_CODES, "downsampling");
	}


	public static boolean isUpsampleCode(int nCode)
	{
		return indexOf(US_CODES, nCode) >= 0;
	}


	public static boolean isDownsampleCode(int nCode)
	{
		return indexOf(DS_CODES, nCode) >= 0;
	}


	private static int lookup(String sMethod, String[] sNames, int[] nCodes, String sKind)
	{
		for (int nIndex = 0; nIndex < sNames.length; nIndex++)
		{
			if (sNames[nIndex].equals(sMethod))
				return nCodes[nIndex];
		}
		throw new IllegalArgumentException(String.format("Unknown %s method %s, expected one of %s", sKind, sMethod, Arrays.toString(sNames)));
	}


	private static int indexOf(int[] nCodes, int nCode)
	{
		for (int nIndex = 0; nIndex < nCodes.length; nIndex++)
		{
			if (nCodes[nIndex] == nCode)
				return nIndex;
		}
		return -1;
	}
}
