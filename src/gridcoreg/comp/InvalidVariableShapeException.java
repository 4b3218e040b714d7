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

/**
 * A variable of the slave dataset does not have exactly the time, lat and lon
 * dimensions.
 */
public class InvalidVariableShapeException extends CoregistrationException
{
	public final String m_sVariable;
	public final String[] m_sDims;


	public InvalidVariableShapeException(String sVariable, String[] sDims)
	{
		super(String.format("%s data array of slave dataset is not valid for coregistration. Expected coordinates are (lat, lon, time), received coordinates are %s, consider running select_var and/or normalize operations first.",
			sVariable, Arrays.toString(sDims)));
		m_sVariable = sVariable;
		m_sDims = sDims.clone();
	}
}
