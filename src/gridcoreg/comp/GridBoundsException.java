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
 * A grid axis falls outside of the symmetric global bounds.
 */
public class GridBoundsException extends InvalidGridException
{
	public GridBoundsException(String sRole, String sDataset, String sAxis, double dLowBound, double dFirst, double dLast)
	{
		super(String.format("The %s dataset %s %s grid does not fall into required boundaries. Required boundaries are (%s, %s), dataset boundaries are (%s, %s). Running the normalize operation may help.",
			sRole, sDataset, sAxis, dLowBound, Math.abs(dLowBound), dFirst, dLast),
			sRole, sDataset, sAxis, dLowBound, dFirst, dLast);
	}
}
