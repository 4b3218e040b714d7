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
package gridcoreg.system;

/**
 * This class contains static floating point comparison methods used by the
 * grid checks. A tolerance of zero means exact comparison.
 */
public abstract class MathUtil
{
	private MathUtil()
	{
	}


	/**
	 * Compares two values.
	 * @param d1 first value
	 * @param d2 second value
	 * @param dTolerance maximum absolute difference, 0 for exact equality
	 * @return true if the values are equal within the tolerance
	 */
	public static boolean equals(double d1, double d2, double dTolerance)
	{
		if (dTolerance == 0.0)
			return d1 == d2;

		return Math.abs(d1 - d2) <= dTolerance;
	}


	/**
	 * Determines if the given value is a whole multiple of the given step.
	 * With a tolerance of zero the remainder must be exactly zero, otherwise
	 * the remainder may be within the tolerance of zero or of the step.
	 * @param dVal value to test
	 * @param dStep step, must be positive
	 * @param dTolerance allowed deviation, 0 for exact comparison
	 * @return true if dVal is a multiple of dStep
	 */
	public static boolean isMultiple(double dVal, double dStep, double dTolerance)
	{
		double dRemainder = Math.abs(dVal % dStep);
		if (dTolerance == 0.0)
			return dRemainder == 0.0;

		return dRemainder <= dTolerance || dStep - dRemainder <= dTolerance;
	}
}
