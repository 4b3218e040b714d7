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
 * Time coordinate of a dataset, in milliseconds since Epoch.
 */
public class TimeAxis
{
	private final long[] m_lTimes;


	public TimeAxis(long... lTimes)
	{
		m_lTimes = lTimes.clone();
	}


	public int size()
	{
		return m_lTimes.length;
	}


	/**
	 * @param nIndex time index
	 * @return time in milliseconds since Epoch
	 */
	public long get(int nIndex)
	{
		return m_lTimes[nIndex];
	}


	public long[] getTimes()
	{
		return m_lTimes.clone();
	}


	@Override
	public boolean equals(Object oObj)
	{
		return oObj instanceof TimeAxis && Arrays.equals(m_lTimes, ((TimeAxis)oObj).m_lTimes);
	}


	@Override
	public int hashCode()
	{
		return Arrays.hashCode(m_lTimes);
	}
}
