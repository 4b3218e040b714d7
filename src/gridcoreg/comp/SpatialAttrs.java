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

import gridcoreg.store.Dataset;
import gridcoreg.store.GridAxis;

/**
 * Writes the geospatial extent and resolution attributes of a dataset from
 * its lat and lon axes.
 */
public abstract class SpatialAttrs
{
	public static final String BOUNDS = "geospatial_bounds";
	public static final String BOUNDS_CRS = "geospatial_bounds_crs";


	private SpatialAttrs()
	{
	}


	/**
	 * Sets geospatial_lat/lon_min, _max, _resolution and _units on the given
	 * dataset, the min and max being the outer pixel edges. When both axes
	 * have a resolution the WKT bounding polygon and its CRS are set too. Axes
	 * with less than two values are skipped.
	 * @param oDataset dataset to update
	 * @return the same dataset
	 */
	public static Dataset adjust(Dataset oDataset)
	{
		double[] dLat = setAxisAttrs(oDataset, oDataset.getLat(), "degrees_north");
		double[] dLon = setAxisAttrs(oDataset, oDataset.getLon(), "degrees_east");
		if (dLat != null && dLon != null)
		{
			oDataset.putAttr(BOUNDS_CRS, "EPSG:4326");
			oDataset.putAttr(BOUNDS, String.format("POLYGON((%s %s, %s %s, %s %s, %s %s, %s %s))",
				dLon[0], dLat[0], dLon[0], dLat[1], dLon[1], dLat[1], dLon[1], dLat[0], dLon[0], dLat[0]));
		}
		return oDataset;
	}


	/**
	 * @return [min, max] of the axis, null if the axis has no resolution
	 */
	private static double[] setAxisAttrs(Dataset oDataset, GridAxis oAxis, String sUnits)
	{
		if (oAxis.size() < 2)
			return null;

		double dRes = oAxis.getPixelSize();
		double dMin = Math.min(oAxis.first(), oAxis.last()) - dRes / 2;
		double dMax = Math.max(oAxis.first(), oAxis.last()) + dRes / 2;
		String sPrefix = "geospatial_" + oAxis.getName();
		oDataset.putAttr(sPrefix + "_min", dMin);
		oDataset.putAttr(sPrefix + "_max", dMax);
		oDataset.putAttr(sPrefix + "_resolution", dRes);
		oDataset.putAttr(sPrefix + "_units", sUnits);
		return new double[]{dMin, dMax};
	}
}
