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

import gridcoreg.system.Monitor;
import java.util.List;
import java.util.Map;

/**
 * An operation that can be exposed to a command surface through an
 * {@link OperationRegistry}.
 */
public interface Operation
{
	/**
	 * @return the name the operation is registered under
	 */
	public String getName();


	/**
	 * @return the declared inputs, in order
	 */
	public List<OperationInput> getInputs();


	/**
	 * Runs the operation.
	 * @param oInputs input values by name, already validated and completed
	 * with defaults
	 * @param oMonitor progress monitor
	 * @return the result of the operation
	 */
	public Object invoke(Map<String, Object> oInputs, Monitor oMonitor);
}
