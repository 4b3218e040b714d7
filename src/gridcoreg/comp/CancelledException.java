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
 * The caller requested cancellation through the progress monitor.
 */
public class CancelledException extends CoregistrationException
{
	public CancelledException(String sLabel)
	{
		super(sLabel == null ? "cancelled" : String.format("%s cancelled", sLabel));
	}
}
