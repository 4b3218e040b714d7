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

import gridcoreg.system.CoregConfig;
import gridcoreg.system.Monitor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Table of the operations available to a command surface, built once at
 * start up and passed to whatever exposes the operations. Inputs are checked
 * against the operation's declaration before it is invoked.
 * @author aaron.cherney
 */
public class OperationRegistry
{
	private final TreeMap<String, Operation> m_oOperations = new TreeMap<>();


	/**
	 * Creates the registry holding every operation of this library.
	 * @param oConfig configuration providing operation defaults
	 * @return the new registry
	 */
	public static OperationRegistry createDefault(CoregConfig oConfig)
	{
		OperationRegistry oRegistry = new OperationRegistry();
		oRegistry.register(new CoregisterOp(oConfig));
		return oRegistry;
	}


	/**
	 * Adds an operation.
	 * @param oOperation operation to add
	 * @throws IllegalArgumentException if an operation with the same name is
	 * already registered
	 */
	public synchronized void register(Operation oOperation)
	{
		if (m_oOperations.containsKey(oOperation.getName()))
			throw new IllegalArgumentException(String.format("Operation %s is already registered", oOperation.getName()));

		m_oOperations.put(oOperation.getName(), oOperation);
	}


	/**
	 * @param sName operation name
	 * @return the operation or null if there is none with that name
	 */
	public synchronized Operation get(String sName)
	{
		return m_oOperations.get(sName);
	}


	/**
	 * @return registered operation names in alphabetical order
	 */
	public synchronized List<String> getNames()
	{
		return new ArrayList<>(m_oOperations.keySet());
	}


	/**
	 * Validates the given inputs, fills in defaults and invokes the named
	 * operation.
	 * @param sName operation name
	 * @param oInputs input values by name
	 * @param oMonitor progress monitor
	 * @return the result of the operation
	 * @throws IllegalArgumentException if the operation does not exist, a
	 * required input is missing, an input is not declared or a value is not
	 * part of its input's value set
	 */
	public Object invoke(String sName, Map<String, Object> oInputs, Monitor oMonitor)
	{
		Operation oOperation = get(sName);
		if (oOperation == null)
			throw new IllegalArgumentException(String.format("Unknown operation %s, available operations are %s", sName, getNames()));

		HashMap<String, Object> oValues = new HashMap<>();
		for (OperationInput oInput : oOperation.getInputs())
		{
			Object oValue = oInputs.get(oInput.getName());
			if (oValue == null)
				oValue = oInput.getDefault();
			if (oValue == null)
				throw new IllegalArgumentException(String.format("Input %s of operation %s is required", oInput.getName(), sName));
			if (!oInput.accepts(oValue))
				throw new IllegalArgumentException(String.format("Input %s of operation %s must be one of %s, got %s",
					oInput.getName(), sName, Arrays.toString(oInput.getValueSet()), oValue));
			oValues.put(oInput.getName(), oValue);
		}

		for (String sKey : oInputs.keySet())
		{
			if (!oValues.containsKey(sKey))
				throw new IllegalArgumentException(String.format("Operation %s has no input %s", sName, sKey));
		}
		return oOperation.invoke(oValues, oMonitor);
	}
}
