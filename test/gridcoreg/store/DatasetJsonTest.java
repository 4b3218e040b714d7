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

import gridcoreg.TestGrids;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

final class DatasetJsonTest
{
	@TempDir
	Path m_oDir;


	private static Dataset sample()
	{
		GridAxis oLat = TestGrids.range(GridAxis.LAT, 10.0, 12.0, 1.0);
		GridAxis oLon = TestGrids.range(GridAxis.LON, -5.0, -2.0, 1.0);
		RasterVariable oVar = TestGrids.generated("sst", 2, 2, 3, nIndex -> nIndex == 4 ? Double.NaN : nIndex);
		return TestGrids.dataset("sample", oLat, oLon, 2, oVar).putAttr("title", "sample");
	}


	@Test
	void missingValuesAreWrittenAsNull()
	{
		JSONObject oDoc = DatasetJson.toJson(sample());
		JSONArray oData = oDoc.getJSONObject("variables").getJSONObject("sst").getJSONArray("data");
		assertEquals(12, oData.length());
		assertTrue(oData.isNull(4));
		assertEquals(5.0, oData.getDouble(5));
		assertEquals("1970-01-02T00:00:00.000Z", oDoc.getJSONArray("time").getString(1));
		assertEquals("sample", oDoc.getJSONObject("attrs").getString("title"));
	}


	@Test
	void fileIsReadBack() throws IOException
	{
		Dataset oDataset = sample();
		Path oFile = m_oDir.resolve("sample.json");
		DatasetJson.write(oDataset, oFile);

		Dataset oRead = DatasetJson.read(oFile);
		assertEquals("sample", oRead.getName());
		assertEquals(oDataset.getLat(), oRead.getLat());
		assertEquals(oDataset.getLon(), oRead.getLon());
		assertEquals(oDataset.getTime(), oRead.getTime());
		assertEquals("sample", oRead.getAttrs().get("title"));

		RasterVariable oVar = oRead.getVariable("sst");
		assertArrayEquals(TestGrids.TLL, oVar.getDims());
		assertArrayEquals(new int[]{2, 2, 3}, oVar.getShape());
		assertArrayEquals(oDataset.getVariable("sst").getData(), oVar.getData());
		assertEquals("sst", oVar.getAttrs().get("long_name"));
	}


	@Test
	void invalidDocumentsAreRejected() throws IOException
	{
		Path oTruncated = m_oDir.resolve("truncated.json");
		Files.write(oTruncated, "{\"name\": \"x\", \"lat\": [".getBytes(StandardCharsets.UTF_8));
		assertThrows(IOException.class, () -> DatasetJson.read(oTruncated));

		Path oBadTime = m_oDir.resolve("time.json");
		Files.write(oBadTime, "{\"name\": \"x\", \"time\": [\"yesterday\"]}".getBytes(StandardCharsets.UTF_8));
		assertThrows(IOException.class, () -> DatasetJson.read(oBadTime));

		Path oBadShape = m_oDir.resolve("shape.json");
		Files.write(oBadShape, ("{\"name\": \"x\", \"variables\": {\"v\": {\"dims\": [\"time\", \"lat\", \"lon\"],"
			+ " \"shape\": [1, 2, 2], \"data\": [1, 2, 3]}}}").getBytes(StandardCharsets.UTF_8));
		assertThrows(IOException.class, () -> DatasetJson.read(oBadShape));
	}


	@Test
	void variableMustFitAxes() throws IOException
	{
		JSONObject oDoc = DatasetJson.toJson(sample());
		oDoc.put(GridAxis.LAT, new JSONArray().put(10.5));
		assertThrows(IOException.class, () -> DatasetJson.fromJson(oDoc));

		Path oFile = m_oDir.resolve("mismatch.json");
		Files.write(oFile, oDoc.toString().getBytes(StandardCharsets.UTF_8));
		assertThrows(IOException.class, () -> DatasetJson.read(oFile));
	}


	@Test
	void fractionalSecondsAreKept() throws IOException
	{
		JSONObject oDoc = DatasetJson.toJson(sample());
		oDoc.put(GridAxis.TIME, new JSONArray().put("1970-01-01T00:00:00Z").put("1970-01-02T00:00:01.25Z"));
		Dataset oDataset = DatasetJson.fromJson(oDoc);
		assertArrayEquals(new long[]{0L, TestGrids.DAY + 1250L}, oDataset.getTime().getTimes());

		oDoc.put(GridAxis.TIME, new JSONArray().put("1970-01-01T00:00:00.000Z").put("1970-01-02T00:00:00.1239Z"));
		oDataset = DatasetJson.fromJson(oDoc);
		assertArrayEquals(new long[]{0L, TestGrids.DAY + 123L}, oDataset.getTime().getTimes());
		assertEquals("1970-01-02T00:00:00.123Z", DatasetJson.toJson(oDataset).getJSONArray(GridAxis.TIME).getString(1));

		oDoc.put(GridAxis.TIME, new JSONArray().put("1970-01-01T00:00:00.Z").put("1970-01-02T00:00:00.5x"));
		assertThrows(IOException.class, () -> DatasetJson.fromJson(oDoc));
	}
}
