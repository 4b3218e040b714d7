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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named collection of raster variables sharing the same lat, lon and time
 * coordinates, plus dataset level attributes. Variables keep their insertion
 * order.
 * @author Federal Highway Administration
 */
public class Dataset
{
	private final String m_sName;
	private final GridAxis m_oLat;
	private final GridAxis m_oLon;
	private final TimeAxis m_oTime;
	private final LinkedHashMap<String, RasterVariable> m_oVariables = new LinkedHashMap<>();
	private final LinkedHashMap<String, Object> m_oAttrs = new LinkedHashMap<>();


	/**
	 * Constructs a new empty dataset on the given coordinates.
	 * @param sName identifies the dataset in log and error messages
	 * @param oLat latitude axis
	 * @param oLon longitude axis
	 * @param oTime time axis
	 */
	public Dataset(String sName, GridAxis oLat, GridAxis oLon, TimeAxis oTime)
	{
		m_sName = sName;
		m_oLat = oLat;
		m_oLon = oLon;
		m_oTime = oTime;
	}


	/**
	 * Adds or replaces the variable with the same name. Each lat, lon or time
	 * dimension the variable has must have the length of the matching axis.
	 * @param oVar the variable to add
	 * @return this dataset
	 * @throws IllegalArgumentException if a dimension length differs from its
	 * axis size
	 */
	public Dataset addVariable(RasterVariable oVar)
	{
		checkDim(oVar, GridAxis.LAT, m_oLat.size());
		checkDim(oVar, GridAxis.LON, m_oLon.size());
		checkDim(oVar, GridAxis.TIME, m_oTime.size());
		m_oVariables.put(oVar.getName(), oVar);
		return this;
	}


	private void checkDim(RasterVariable oVar, String sDim, int nAxisSize)
	{
		if (oVar.indexOfDim(sDim) < 0)
			return;

		int nDimSize = oVar.getDimSize(sDim);
		if (nDimSize != nAxisSize)
			throw new IllegalArgumentException(String.format("Variable %s has %s length %d but dataset %s has %d %s values",
				oVar.getName(), sDim, nDimSize, m_sName, nAxisSize, sDim));
	}


	public Dataset putAttr(String sKey, Object oValue)
	{
		m_oAttrs.put(sKey, oValue);
		return this;
	}


	public String getName()
	{
		return m_sName;
	}


	public GridAxis getLat()
	{
		return m_oLat;
	}


	public GridAxis getLon()
	{
		return m_oLon;
	}


	public TimeAxis getTime()
	{
		return m_oTime;
	}


	/**
	 * @param sName variable name
	 * @return the variable or null if it does not exist
	 */
	public RasterVariable getVariable(String sName)
	{
		return m_oVariables.get(sName);
	}


	/**
	 * @return unmodifiable view of the variables in insertion order
	 */
	public Map<String, RasterVariable> getVariables()
	{
		return Collections.unmodifiableMap(m_oVariables);
	}


	/**
	 * @return unmodifiable view of the dataset attributes
	 */
	public Map<String, Object> getAttrs()
	{
		return Collections.unmodifiableMap(m_oAttrs);
	}


	@Override
	public String toString()
	{
		return String.format("%s %s %s %s", m_sName, m_oLat, m_oLon, m_oVariables.values());
	}
}
