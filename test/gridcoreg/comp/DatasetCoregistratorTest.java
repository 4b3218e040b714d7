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

import gridcoreg.TestGrids;
import gridcoreg.store.Dataset;
import gridcoreg.store.GridAxis;
import gridcoreg.store.RasterVariable;
import gridcoreg.system.CoregConfig;
import gridcoreg.system.Monitor;
import gridcoreg.system.RecordingMonitor;
import java.util.Map;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DatasetCoregistratorTest
{
	private final DatasetCoregistrator m_oCoreg = new DatasetCoregistrator();


	@Test
	void downsamplesHalfDegreeOntoOneDegree()
	{
		Dataset oMaster = TestGrids.constantDataset("master", TestGrids.global(GridAxis.LAT, 1.0), TestGrids.global(GridAxis.LON, 1.0), 1, 0.0);
		Dataset oSlave = TestGrids.constantDataset("slave", TestGrids.global(GridAxis.LAT, 0.5), TestGrids.global(GridAxis.LON, 0.5), 2, 1.0);

		Dataset oResult = m_oCoreg.coregister(oMaster, oSlave, "linear", "mean", Monitor.NONE);
		assertEquals(oMaster.getLat(), oResult.getLat());
		assertEquals(oMaster.getLon(), oResult.getLon());
		assertEquals(oSlave.getTime(), oResult.getTime());

		RasterVariable oSst = oResult.getVariable("sst");
		assertArrayEquals(new int[]{2, 180, 360}, oSst.getShape());
		assertArrayEquals(new int[]{1, 180, 360}, oSst.getChunks());
		for (double dVal : oSst.getData())
			assertEquals(1.0, dVal);
	}


	@Test
	void upsamplesOneDegreeOntoHalfDegree()
	{
		Dataset oMaster = TestGrids.constantDataset("master", TestGrids.global(GridAxis.LAT, 0.5), TestGrids.global(GridAxis.LON, 0.5), 1, 0.0);
		Dataset oSlave = TestGrids.constantDataset("slave", TestGrids.global(GridAxis.LAT, 1.0), TestGrids.global(GridAxis.LON, 1.0), 1, 1.0);

		for (String sMethod : ResampleMethods.getUpsampleNames())
		{
			RasterVariable oSst = m_oCoreg.coregister(oMaster, oSlave, sMethod, "mean", Monitor.NONE).getVariable("sst");
			assertArrayEquals(new int[]{1, 360, 720}, oSst.getShape());
			for (double dVal : oSst.getData())
				assertEquals(1.0, dVal, 1e-12);
		}
	}


	@Test
	void coregisteringOntoItselfKeepsValues()
	{
		GridAxis oLat = TestGrids.global(GridAxis.LAT, 5.0);
		GridAxis oLon = TestGrids.global(GridAxis.LON, 5.0);
		RasterVariable oVar = TestGrids.generated("sst", 2, oLat.size(), oLon.size(), nIndex -> nIndex % 7 == 0 ? Double.NaN : nIndex * 0.5);
		Dataset oSelf = TestGrids.dataset("self", oLat, oLon, 2, oVar);

		for (String sMethod : ResampleMethods.getDownsampleNames())
		{
			Dataset oResult = m_oCoreg.coregister(oSelf, oSelf, "nearest", sMethod, Monitor.NONE);
			assertArrayEquals(oVar.getData(), oResult.getVariable("sst").getData());
		}
	}


	@Test
	void resultCoversTheIntersection()
	{
		Dataset oMaster = TestGrids.constantDataset("master", TestGrids.global(GridAxis.LAT, 1.0), TestGrids.global(GridAxis.LON, 1.0), 1, 0.0);
		Dataset oSlave = TestGrids.constantDataset("sst_cci", TestGrids.range(GridAxis.LAT, -30.0, 30.0, 0.5), TestGrids.range(GridAxis.LON, 0.0, 90.0, 0.5), 1, 1.0);
		oSlave.putAttr("title", "sea surface temperature");

		Dataset oResult = m_oCoreg.coregister(oMaster, oSlave, "linear", "mean", Monitor.NONE);
		assertEquals("sst_cci", oResult.getName());
		assertEquals(60, oResult.getLat().size());
		assertEquals(90, oResult.getLon().size());
		assertEquals(-29.5, oResult.getLat().first());
		assertEquals(89.5, oResult.getLon().last());

		Map<String, Object> oAttrs = oResult.getAttrs();
		assertFalse(oAttrs.containsKey("title"));
		assertEquals(-30.0, oAttrs.get("geospatial_lat_min"));
		assertEquals(30.0, oAttrs.get("geospatial_lat_max"));
		assertEquals(0.0, oAttrs.get("geospatial_lon_min"));
		assertEquals(90.0, oAttrs.get("geospatial_lon_max"));
		assertEquals(1.0, oAttrs.get("geospatial_lat_resolution"));
		assertEquals("degrees_north", oAttrs.get("geospatial_lat_units"));
		assertEquals("degrees_east", oAttrs.get("geospatial_lon_units"));
		assertEquals("EPSG:4326", oAttrs.get(SpatialAttrs.BOUNDS_CRS));
		assertEquals("POLYGON((0.0 -30.0, 0.0 30.0, 90.0 30.0, 90.0 -30.0, 0.0 -30.0))", oAttrs.get(SpatialAttrs.BOUNDS));

		RasterVariable oSst = oResult.getVariable("sst");
		assertEquals("K", oSst.getAttrs().get("units"));
		assertArrayEquals(new int[]{1, 60, 90}, oSst.getShape());
	}


	@Test
	void rejectsVariableWithoutTimeBeforeResampling()
	{
		GridAxis oLat = TestGrids.global(GridAxis.LAT, 10.0);
		GridAxis oLon = TestGrids.global(GridAxis.LON, 10.0);
		Dataset oMaster = TestGrids.constantDataset("master", oLat, oLon, 1, 0.0);
		Dataset oSlave = TestGrids.constantDataset("slave", oLat, oLon, 1, 1.0);
		oSlave.addVariable(new RasterVariable("mask", new String[]{"lat", "lon"}, new int[]{oLat.size(), oLon.size()}, new double[oLat.size() * oLon.size()], null));

		RecordingMonitor oMonitor = new RecordingMonitor();
		assertThrows(InvalidVariableShapeException.class, () -> m_oCoreg.coregister(oMaster, oSlave, "linear", "mean", oMonitor));
		assertTrue(oMonitor.m_oStarted.isEmpty());
		assertEquals(0, oMonitor.m_nProgressCount);
	}


	@Test
	void rejectsDisjointGrids()
	{
		GridAxis oLat = TestGrids.global(GridAxis.LAT, 1.0);
		Dataset oMaster = TestGrids.constantDataset("master", oLat, TestGrids.range(GridAxis.LON, 0.0, 10.0, 1.0), 1, 0.0);
		Dataset oSlave = TestGrids.constantDataset("slave", oLat, TestGrids.range(GridAxis.LON, 100.0, 110.0, 1.0), 1, 1.0);

		NoIntersectionException oEx = assertThrows(NoIntersectionException.class, () -> m_oCoreg.coregister(oMaster, oSlave, "linear", "mean", Monitor.NONE));
		assertEquals("lon", oEx.m_sAxis);
	}


	@Test
	void rejectsInvalidGrids()
	{
		GridAxis oLat = TestGrids.global(GridAxis.LAT, 1.0);
		GridAxis oLon = TestGrids.global(GridAxis.LON, 1.0);
		Dataset oGood = TestGrids.constantDataset("good", oLat, oLon, 1, 1.0);

		Dataset oShifted = TestGrids.constantDataset("shifted", oLat, GridAxis.fromStep(GridAxis.LON, 0.5, 1.0, 360), 1, 1.0);
		GridBoundsException oBounds = assertThrows(GridBoundsException.class, () -> m_oCoreg.coregister(oGood, oShifted, "linear", "mean", Monitor.NONE));
		assertEquals("slave", oBounds.m_sRole);
		assertEquals("shifted", oBounds.m_sDataset);
		assertEquals("lon", oBounds.m_sAxis);

		double[] dLat = oLat.getValues();
		dLat[42] += 0.25;
		Dataset oUneven = TestGrids.constantDataset("uneven", new GridAxis(GridAxis.LAT, dLat), oLon, 1, 1.0);
		GridNotEquidistantException oEquidistant = assertThrows(GridNotEquidistantException.class, () -> m_oCoreg.coregister(oUneven, oGood, "linear", "mean", Monitor.NONE));
		assertEquals("master", oEquidistant.m_sRole);
		assertEquals("lat", oEquidistant.m_sAxis);

		Dataset oOffset = TestGrids.constantDataset("offset", GridAxis.fromStep(GridAxis.LAT, -89.0, 1.0, 179), oLon, 1, 1.0);
		GridNotPixelRegisteredException oRegistered = assertThrows(GridNotPixelRegisteredException.class, () -> m_oCoreg.coregister(oGood, oOffset, "linear", "mean", Monitor.NONE));
		assertEquals("slave", oRegistered.m_sRole);
		assertEquals("lat", oRegistered.m_sAxis);
	}


	@Test
	void rejectsUnknownMethods()
	{
		Dataset oSelf = TestGrids.constantDataset("self", TestGrids.global(GridAxis.LAT, 10.0), TestGrids.global(GridAxis.LON, 10.0), 1, 1.0);
		assertThrows(IllegalArgumentException.class, () -> m_oCoreg.coregister(oSelf, oSelf, "cubic", "mean", Monitor.NONE));
		assertThrows(IllegalArgumentException.class, () -> m_oCoreg.coregister(oSelf, oSelf, "linear", "median", Monitor.NONE));
	}


	@Test
	void reportsOneUnitPerVariable()
	{
		GridAxis oLat = TestGrids.global(GridAxis.LAT, 10.0);
		GridAxis oLon = TestGrids.global(GridAxis.LON, 10.0);
		Dataset oMaster = TestGrids.constantDataset("master", oLat, oLon, 1, 0.0);
		Dataset oSlave = TestGrids.dataset("slave", TestGrids.global(GridAxis.LAT, 5.0), TestGrids.global(GridAxis.LON, 5.0), 3,
			TestGrids.constant("sst", 3, 36, 72, 1.0), TestGrids.constant("ice", 3, 36, 72, 0.0));

		RecordingMonitor oMonitor = new RecordingMonitor();
		m_oCoreg.coregister(oMaster, oSlave, "linear", "mean", oMonitor);
		assertEquals(DatasetCoregistrator.LABEL, oMonitor.m_oStarted.get(0));
		assertEquals(2.0, oMonitor.getTotalWork());
		assertEquals(2.0, oMonitor.getWorked(), 1e-9);
		assertTrue(oMonitor.isDone());
		assertEquals(1, oMonitor.m_nDoneCount);
	}


	@Test
	void cancelled()
	{
		Dataset oSelf = TestGrids.constantDataset("self", TestGrids.global(GridAxis.LAT, 10.0), TestGrids.global(GridAxis.LON, 10.0), 4, 1.0);
		RecordingMonitor oMonitor = new RecordingMonitor();
		oMonitor.cancel();
		assertThrows(CancelledException.class, () -> m_oCoreg.coregister(oSelf, oSelf, "linear", "mean", oMonitor));
		assertTrue(oMonitor.isDone());

		RecordingMonitor oLater = new RecordingMonitor().cancelAfter(2);
		assertThrows(CancelledException.class, () -> m_oCoreg.coregister(oSelf, oSelf, "linear", "mean", oLater));
	}


	@Test
	void threadPoolGivesSameResult()
	{
		GridAxis oLat = TestGrids.global(GridAxis.LAT, 4.0);
		GridAxis oLon = TestGrids.global(GridAxis.LON, 4.0);
		Dataset oMaster = TestGrids.constantDataset("master", oLat, oLon, 1, 0.0);
		Dataset oSlave = TestGrids.dataset("slave", TestGrids.global(GridAxis.LAT, 1.0), TestGrids.global(GridAxis.LON, 1.0), 4,
			TestGrids.generated("sst", 4, 180, 360, nIndex -> Math.cos(nIndex * 0.01)));

		Dataset oSequential = m_oCoreg.coregister(oMaster, oSlave, "linear", "var", Monitor.NONE);
		DatasetCoregistrator oPooled = new DatasetCoregistrator(CoregConfig.of(new JSONObject().put("threads", 3)));
		RecordingMonitor oMonitor = new RecordingMonitor();
		Dataset oConcurrent = oPooled.coregister(oMaster, oSlave, "linear", "var", oMonitor);
		assertArrayEquals(oSequential.getVariable("sst").getData(), oConcurrent.getVariable("sst").getData());
		assertEquals(1.0, oMonitor.getWorked(), 1e-9);
	}


	@Test
	void toleranceAcceptsRoundingNoise()
	{
		double[] dLat = TestGrids.global(GridAxis.LAT, 1.0).getValues();
		dLat[10] += 1e-10;
		GridAxis oLon = TestGrids.global(GridAxis.LON, 1.0);
		Dataset oMaster = TestGrids.constantDataset("master", TestGrids.global(GridAxis.LAT, 2.0), TestGrids.global(GridAxis.LON, 2.0), 1, 0.0);
		Dataset oSlave = TestGrids.constantDataset("noisy", new GridAxis(GridAxis.LAT, dLat), oLon, 1, 1.0);

		assertThrows(GridNotEquidistantException.class, () -> m_oCoreg.coregister(oMaster, oSlave, "linear", "mean", Monitor.NONE));
		Dataset oResult = new DatasetCoregistrator(1e-9, 1).coregister(oMaster, oSlave, "linear", "mean", Monitor.NONE);
		assertArrayEquals(new int[]{1, 90, 180}, oResult.getVariable("sst").getShape());
	}
}
