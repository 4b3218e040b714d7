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

import gridcoreg.comp.DatasetCoregistrator;
import gridcoreg.comp.ResampleMethods;
import gridcoreg.store.Dataset;
import gridcoreg.system.CoregConfig;
import gridcoreg.system.Monitor;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Exposes {@link DatasetCoregistrator#coregister} as the "coregister"
 * operation. The default methods come from the configuration.
 */
public class CoregisterOp implements Operation
{
	public static final String NAME = "coregister";
	public static final String MASTER = "ds_master";
	public static final String SLAVE = "ds_slave";
	public static final String METHOD_US = "method_us";
	public static final String METHOD_DS = "method_ds";


	private final CoregConfig m_oConfig;
	private final List<OperationInput> m_oInputs;


	public CoregisterOp(CoregConfig oConfig)
	{
		m_oConfig = oConfig;
		m_oInputs = Collections.unmodifiableList(Arrays.asList(
			new OperationInput(MASTER, null),
			new OperationInput(SLAVE, null),
			new OperationInput(METHOD_US, oConfig.getUpsampleMethod(), ResampleMethods.getUpsampleNames().toArray(new String[0])),
			new OperationInput(METHOD_DS, oConfig.getDownsampleMethod(), ResampleMethods.getDownsampleNames().toArray(new String[0]))));
	}


	@Override
	public String getName()
	{
		return NAME;
	}


	@Override
	public List<OperationInput> getInputs()
	{
		return m_oInputs;
	}


	@Override
	public Object invoke(Map<String, Object> oInputs, Monitor oMonitor)
	{
		Object oMaster = oInputs.get(MASTER);
		Object oSlave = oInputs.get(SLAVE);
		if (!(oMaster instanceof Dataset) || !(oSlave instanceof Dataset))
			throw new IllegalArgumentException(String.format("Inputs %s and %s of operation %s must be datasets", MASTER, SLAVE, NAME));

		return new DatasetCoregistrator(m_oConfig).coregister((Dataset)oMaster, (Dataset)oSlave,
			(String)oInputs.get(METHOD_US), (String)oInputs.get(METHOD_DS), oMonitor);
	}
}
