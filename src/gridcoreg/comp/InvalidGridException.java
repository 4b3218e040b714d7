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
 * Raised when a coordinate axis of the master or slave dataset fails one of
 * the grid checks done before any resampling starts. Carries enough context
 * to identify the offending dataset and axis.
 *
 * @author aaron.cherney
 */
public abstract class InvalidGridException extends CoregistrationException
{
	/**
	 * "master" or "slave"
	 */
	public final String m_sRole;


	/**
	 * Name of the dataset the axis belongs to
	 */
	public final String m_sDataset;


	/**
	 * Name of the axis, lat or lon
	 */
	public final String m_sAxis;


	/**
	 * Lower global bound the axis is checked against, the upper bound is its
	 * absolute value
	 */
	public final double m_dLowBound;


	/**
	 * First value of the axis, NaN if the axis is empty
	 */
	public final double m_dFirst;


	/**
	 * Last value of the axis, NaN if the axis is empty
	 */
	public final double m_dLast;


	protected InvalidGridException(String sMessage, String sRole, String sDataset, String sAxis, double dLowBound, double dFirst, double dLast)
	{
		super(sMessage);
		m_sRole = sRole;
		m_sDataset = sDataset;
		m_sAxis = sAxis;
		m_dLowBound = dLowBound;
		m_dFirst = dFirst;
		m_dLast = dLast;
	}
}
