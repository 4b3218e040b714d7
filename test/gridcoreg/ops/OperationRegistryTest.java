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

import gridcoreg.TestGrids;
import gridcoreg.store.Dataset;
import gridcoreg.store.GridAxis;
import gridcoreg.system.CoregConfig;
import gridcoreg.system.Monitor;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OperationRegistryTest
{
	private OperationRegistry m_oRegistry;
	private HashMap<String, Object> m_oInputs;


	@BeforeEach
	void setUp()
	{
		m_oRegistry = OperationRegistry.createDefault(CoregConfig.of(new JSONObject().put("upsample", "nearest").put("downsample", "first")));
		Dataset oMaster = TestGrids.constantDataset("master", TestGrids.global(GridAxis.LAT, 10.0), TestGrids.global(GridAxis.LON, 10.0), 1, 0.0);
		Dataset oSlave = TestGrids.constantDataset("slave", TestGrids.global(GridAxis.LAT, 5.0), TestGrids.global(GridAxis.LON, 5.0), 1, 2.0);
		m_oInputs = new HashMap<>();
		m_oInputs.put(CoregisterOp.MASTER, oMaster);
		m_oInputs.put(CoregisterOp.SLAVE, oSlave);
	}


	@Test
	void defaultRegistryDeclaresCoregister()
	{
		assertEquals(List.of(CoregisterOp.NAME), m_oRegistry.getNames());
		Operation oOp = m_oRegistry.get(CoregisterOp.NAME);
		assertNull(m_oRegistry.get("normalize"));

		Map<String, OperationInput> oInputs = new HashMap<>();
		for (OperationInput oInput : oOp.getInputs())
			oInputs.put(oInput.getName(), oInput);
		assertTrue(oInputs.get(CoregisterOp.MASTER).isRequired());
		assertTrue(oInputs.get(CoregisterOp.SLAVE).isRequired());
		assertEquals("nearest", oInputs.get(CoregisterOp.METHOD_US).getDefault());
		assertEquals("first", oInputs.get(CoregisterOp.METHOD_DS).getDefault());
		assertEquals(Arrays.asList("nearest", "linear"), Arrays.asList(oInputs.get(CoregisterOp.METHOD_US).getValueSet()));
		assertEquals(6, oInputs.get(CoregisterOp.METHOD_DS).getValueSet().length);
	}


	@Test
	void invokesWithDefaults()
	{
		Dataset oResult = (Dataset)m_oRegistry.invoke(CoregisterOp.NAME, m_oInputs, Monitor.NONE);
		assertEquals("slave", oResult.getName());
		assertArrayEquals(new int[]{1, 18, 36}, oResult.getVariable("sst").getShape());
		for (double dVal : oResult.getVariable("sst").getData())
			assertEquals(2.0, dVal);
	}


	@Test
	void rejectsValueOutsideValueSet()
	{
		m_oInputs.put(CoregisterOp.METHOD_DS, "median");
		IllegalArgumentException oEx = assertThrows(IllegalArgumentException.class, () -> m_oRegistry.invoke(CoregisterOp.NAME, m_oInputs, Monitor.NONE));
		assertTrue(oEx.getMessage().contains("median"));
	}


	@Test
	void rejectsMissingRequiredInput()
	{
		m_oInputs.remove(CoregisterOp.SLAVE);
		assertThrows(IllegalArgumentException.class, () -> m_oRegistry.invoke(CoregisterOp.NAME, m_oInputs, Monitor.NONE));
	}


	@Test
	void rejectsUndeclaredInput()
	{
		m_oInputs.put("method", "mean");
		assertThrows(IllegalArgumentException.class, () -> m_oRegistry.invoke(CoregisterOp.NAME, m_oInputs, Monitor.NONE));
	}


	@Test
	void rejectsNonDatasetInput()
	{
		m_oInputs.put(CoregisterOp.MASTER, "master.json");
		assertThrows(IllegalArgumentException.class, () -> m_oRegistry.invoke(CoregisterOp.NAME, m_oInputs, Monitor.NONE));
	}


	@Test
	void rejectsUnknownOperation()
	{
		assertThrows(IllegalArgumentException.class, () -> m_oRegistry.invoke("normalize", m_oInputs, Monitor.NONE));
	}


	@Test
	void rejectsDuplicateRegistration()
	{
		assertThrows(IllegalArgumentException.class, () -> m_oRegistry.register(new CoregisterOp(CoregConfig.load(null))));
	}
}
