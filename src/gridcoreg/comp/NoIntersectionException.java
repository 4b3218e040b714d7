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
 * The master and slave grids do not overlap by at least one of the larger
 * pixels, the bounds could not be moved onto a shared pixel boundary, or the
 * adjusted bounds collapsed.
 */
public class NoIntersectionException extends CoregistrationException
{
	public final String m_sAxis;
	public final double m_dMin;
	public final double m_dMax;
	public final double m_dFirstPixel;
	public final double m_dSecondPixel;


	public NoIntersectionException(String sReason, String sAxis, double dMin, double dMax, double dFirstPixel, double dSecondPixel)
	{
		super(String.format("Could not find a valid intersection to perform coregistration on: %s. Axis %s, bounds (%s, %s), pixel sizes %s and %s",
			sReason, sAxis, dMin, dMax, dFirstPixel, dSecondPixel));
		m_sAxis = sAxis;
		m_dMin = dMin;
		m_dMax = dMax;
		m_dFirstPixel = dFirstPixel;
		m_dSecondPixel = dSecondPixel;
	}
}
