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
package gridcoreg.ops;

import java.util.Arrays;

/**
 * Describes one named input of an {@link Operation}: its default value and,
 * optionally, the set of values it accepts.
 */
public class OperationInput
{
	private final String m_sName;
	private final Object m_oDefault;
	private final String[] m_sValueSet;


	/**
	 * @param sName input name
	 * @param oDefault value used when the caller gives none, null makes the
	 * input required
	 * @param sValueSet accepted values, null to accept any value
	 */
	public OperationInput(String sName, Object oDefault, String... sValueSet)
	{
		m_sName = sName;
		m_oDefault = oDefault;
		m_sValueSet = sValueSet == null || sValueSet.length == 0 ? null : sValueSet.clone();
	}


	public String getName()
	{
		return m_sName;
	}


	public Object getDefault()
	{
		return m_oDefault;
	}


	public boolean isRequired()
	{
		return m_oDefault == null;
	}


	/**
	 * @return accepted values, null if any value is accepted
	 */
	public String[] getValueSet()
	{
		return m_sValueSet == null ? null : m_sValueSet.clone();
	}


	/**
	 * Determines if the given value is acceptable for this input.
	 * @param oValue value to test
	 * @return true if there is no value set or the value is part of it
	 */
	public boolean accepts(Object oValue)
	{
		if (m_sValueSet == null)
			return true;

		for (String sValue : m_sValueSet)
		{
			if (sValue.equals(oValue))
				return true;
		}
		return false;
	}


	@Override
	public String toString()
	{
		return m_sValueSet == null ? m_sName : String.format("%s%s", m_sName, Arrays.toString(m_sValueSet));
	}
}
