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

/**
 * The values of a grid axis are not pixel centers relative to the axis origin.
 */
public class GridNotPixelRegisteredException extends InvalidGridException
{
	public GridNotPixelRegisteredException(String sRole, String sDataset, String sAxis, double dLowBound, double dFirst, double dLast)
	{
		super(String.format("The %s dataset %s %s grid is not pixel-registered, can not perform coregistration", sRole, sDataset, sAxis),
			sRole, sDataset, sAxis, dLowBound, dFirst, dLast);
	}
}
