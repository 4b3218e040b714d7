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
package gridcoreg.system;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Conversions between JSON arrays and primitive arrays. Missing keys read as
 * empty arrays.
 * @author aaron.cherney
 */
public abstract class JSONUtil
{
	private JSONUtil()
	{
	}


	public static JSONArray optJSONArray(JSONObject oObj, String sKey)
	{
		JSONArray oRet = oObj.optJSONArray(sKey);
		if (oRet == null)
			oRet = new JSONArray();

		return oRet;
	}


	public static String[] getStringArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		String[] sRet = new String[oArr.length()];
		for (int nIndex = 0; nIndex < sRet.length; nIndex++)
			sRet[nIndex] = oArr.getString(nIndex);

		return sRet;
	}


	public static int[] getIntArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		int[] nRet = new int[oArr.length()];
		for (int nIndex = 0; nIndex < nRet.length; nIndex++)
			nRet[nIndex] = oArr.getInt(nIndex);

		return nRet;
	}


	/**
	 * Reads the numbers of the array with the given key. Null entries become NaN.
	 * @param oObj object containing the array
	 * @param sKey key of the array
	 * @return the values of the array, empty if the key does not exist
	 */
	public static double[] getDoubleArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		double[] dRet = new double[oArr.length()];
		for (int nIndex = 0; nIndex < dRet.length; nIndex++)
			dRet[nIndex] = oArr.isNull(nIndex) ? Double.NaN : oArr.getDouble(nIndex);

		return dRet;
	}


	/**
	 * Creates a JSON array from the given values. NaN and infinite values are
	 * not valid JSON numbers and are written as null.
	 * @param dVals values to convert
	 * @return new JSON array
	 */
	public static JSONArray toJSONArray(double[] dVals)
	{
		JSONArray oArr = new JSONArray();
		for (double dVal : dVals)
		{
			if (Double.isNaN(dVal) || Double.isInfinite(dVal))
				oArr.put(JSONObject.NULL);
			else
				oArr.put(dVal);
		}
		return oArr;
	}
}
