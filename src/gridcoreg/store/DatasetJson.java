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

import gridcoreg.system.JSONUtil;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.text.ParsePosition;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Map;
import java.util.TimeZone;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Reads and writes {@link Dataset}s as JSON documents. The document has the
 * keys name, lat, lon, time (ISO-8601 UTC strings), attrs and variables. Each
 * variable has dims, shape, attrs and a flat row-major data array where
 * missing values are null. Times are written with milliseconds and read with
 * or without fractional seconds, digits past milliseconds are truncated.
 * @author aaron.cherney
 */
public abstract class DatasetJson
{
	private static final String TIME_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";


	/**
	 * Accepted on read for time stamps without fractional seconds
	 */
	private static final String TIME_FORMAT_SECONDS = "yyyy-MM-dd'T'HH:mm:ss'Z'";


	private DatasetJson()
	{
	}


	/**
	 * Parses the JSON document in the given file.
	 * @param oFile file to read
	 * @return the dataset described by the file
	 * @throws IOException if the file cannot be read or is not a valid dataset
	 * document
	 */
	public static Dataset read(Path oFile)
		throws IOException
	{
		try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
		{
			return fromJson(new JSONObject(new JSONTokener(oIn)));
		}
		catch (JSONException | IllegalArgumentException oEx)
		{
			throw new IOException(String.format("Invalid dataset document %s", oFile), oEx);
		}
	}


	/**
	 * Writes the given dataset as a JSON document.
	 * @param oDataset dataset to write
	 * @param oFile destination, overwritten if it exists
	 * @throws IOException
	 */
	public static void write(Dataset oDataset, Path oFile)
		throws IOException
	{
		try (BufferedWriter oOut = Files.newBufferedWriter(oFile, StandardCharsets.UTF_8))
		{
			toJson(oDataset).write(oOut);
		}
	}


	/**
	 * Builds a dataset from a parsed document.
	 * @param oDoc dataset document
	 * @return the dataset
	 * @throws IOException if a time stamp cannot be parsed or a variable does
	 * not fit the dataset axes
	 */
	public static Dataset fromJson(JSONObject oDoc)
		throws IOException
	{
		String sName = oDoc.optString("name", "dataset");
		GridAxis oLat = new GridAxis(GridAxis.LAT, JSONUtil.getDoubleArray(oDoc, GridAxis.LAT));
		GridAxis oLon = new GridAxis(GridAxis.LON, JSONUtil.getDoubleArray(oDoc, GridAxis.LON));

		String[] sTimes = JSONUtil.getStringArray(oDoc, GridAxis.TIME);
		long[] lTimes = new long[sTimes.length];
		SimpleDateFormat oSdf = newFormat(TIME_FORMAT);
		SimpleDateFormat oSecondsSdf = newFormat(TIME_FORMAT_SECONDS);
		for (int nIndex = 0; nIndex < sTimes.length; nIndex++)
		{
			try
			{
				lTimes[nIndex] = parseTime(sTimes[nIndex], oSdf, oSecondsSdf);
			}
			catch (ParseException oEx)
			{
				throw new IOException(String.format("Invalid time stamp %s in dataset %s", sTimes[nIndex], sName), oEx);
			}
		}

		Dataset oDataset = new Dataset(sName, oLat, oLon, new TimeAxis(lTimes));
		JSONObject oAttrs = oDoc.optJSONObject("attrs");
		if (oAttrs != null)
		{
			for (Map.Entry<String, Object> oAttr : oAttrs.toMap().entrySet())
				oDataset.putAttr(oAttr.getKey(), oAttr.getValue());
		}

		JSONObject oVars = oDoc.optJSONObject("variables");
		if (oVars != null)
		{
			for (String sVar : oVars.keySet())
			{
				JSONObject oVar = oVars.getJSONObject(sVar);
				JSONObject oVarAttrs = oVar.optJSONObject("attrs");
				try
				{
					oDataset.addVariable(new RasterVariable(sVar, JSONUtil.getStringArray(oVar, "dims"), JSONUtil.getIntArray(oVar, "shape"),
						JSONUtil.getDoubleArray(oVar, "data"), oVarAttrs == null ? null : oVarAttrs.toMap()));
				}
				catch (IllegalArgumentException oEx)
				{
					throw new IOException(String.format("Invalid variable %s in dataset %s", sVar, sName), oEx);
				}
			}
		}
		return oDataset;
	}


	/**
	 * Creates the JSON document for the given dataset.
	 * @param oDataset dataset to convert
	 * @return the dataset document
	 */
	public static JSONObject toJson(Dataset oDataset)
	{
		JSONObject oDoc = new JSONObject();
		oDoc.put("name", oDataset.getName());
		oDoc.put(GridAxis.LAT, JSONUtil.toJSONArray(oDataset.getLat().getValues()));
		oDoc.put(GridAxis.LON, JSONUtil.toJSONArray(oDataset.getLon().getValues()));

		JSONArray oTimes = new JSONArray();
		SimpleDateFormat oSdf = newFormat(TIME_FORMAT);
		for (long lTime : oDataset.getTime().getTimes())
			oTimes.put(oSdf.format(lTime));
		oDoc.put(GridAxis.TIME, oTimes);
		oDoc.put("attrs", new JSONObject(oDataset.getAttrs()));

		JSONObject oVars = new JSONObject();
		for (RasterVariable oVar : oDataset.getVariables().values())
		{
			JSONObject oJsonVar = new JSONObject();
			oJsonVar.put("dims", new JSONArray(oVar.getDims()));
			oJsonVar.put("shape", new JSONArray(oVar.getShape()));
			oJsonVar.put("attrs", new JSONObject(oVar.getAttrs()));
			oJsonVar.put("data", JSONUtil.toJSONArray(oVar.getData()));
			oVars.put(oVar.getName(), oJsonVar);
		}
		oDoc.put("variables", oVars);
		return oDoc;
	}


	/**
	 * Parses an ISO-8601 UTC time stamp. A fractional part of any length is
	 * padded or truncated to milliseconds before parsing.
	 * @param sTime time stamp
	 * @param oSdf millisecond format
	 * @param oSecondsSdf whole second format
	 * @return milliseconds since the epoch
	 * @throws ParseException if the time stamp does not match either format
	 */
	private static long parseTime(String sTime, SimpleDateFormat oSdf, SimpleDateFormat oSecondsSdf)
		throws ParseException
	{
		int nDot = sTime.indexOf('.');
		if (nDot < 0)
			return strictParse(sTime, oSecondsSdf);

		int nEnd = sTime.length() - 1;
		if (nEnd <= nDot + 1 || sTime.charAt(nEnd) != 'Z')
			throw new ParseException(String.format("Unparseable date: \"%s\"", sTime), nDot);

		StringBuilder sBuf = new StringBuilder(sTime.substring(nDot + 1, nEnd));
		for (int nIndex = 0; nIndex < sBuf.length(); nIndex++)
		{
			if (!Character.isDigit(sBuf.charAt(nIndex)))
				throw new ParseException(String.format("Unparseable date: \"%s\"", sTime), nDot + 1 + nIndex);
		}
		while (sBuf.length() < 3)
			sBuf.append('0');
		sBuf.setLength(3);

		return strictParse(sTime.substring(0, nDot + 1) + sBuf + 'Z', oSdf);
	}


	private static long strictParse(String sTime, SimpleDateFormat oSdf)
		throws ParseException
	{
		ParsePosition oPos = new ParsePosition(0);
		Date oDate = oSdf.parse(sTime, oPos);
		if (oDate == null || oPos.getIndex() != sTime.length())
			throw new ParseException(String.format("Unparseable date: \"%s\"", sTime), Math.max(oPos.getErrorIndex(), 0));

		return oDate.getTime();
	}


	private static SimpleDateFormat newFormat(String sPattern)
	{
		SimpleDateFormat oSdf = new SimpleDateFormat(sPattern);
		oSdf.setTimeZone(TimeZone.getTimeZone("UTC"));
		oSdf.setLenient(false);
		return oSdf;
	}
}
