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
package gridcoreg;

import gridcoreg.ops.CoregisterOp;
import gridcoreg.ops.OperationRegistry;
import gridcoreg.store.Dataset;
import gridcoreg.store.DatasetJson;
import gridcoreg.system.CoregConfig;
import gridcoreg.system.LogMonitor;
import java.nio.file.Paths;
import java.util.HashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line entry point.
 * <pre>
 * coregister &lt;master.json&gt; &lt;slave.json&gt; &lt;out.json&gt; [-us method] [-ds method]
 * </pre>
 * @author aaron.cherney
 */
public class Main
{
	private static final Logger LOGGER = LogManager.getLogger(Main.class);


	private static final String USAGE = "usage: coregister <master.json> <slave.json> <out.json> [-us nearest|linear] [-ds first|last|mean|mode|var|std]";


	public static void main(String[] sArgs)
	{
		System.exit(run(sArgs, OperationRegistry.createDefault(CoregConfig.load())));
	}


	/**
	 * Parses the arguments and runs the requested operation.
	 * @param sArgs command line arguments
	 * @param oRegistry available operations
	 * @return process exit code, 0 on success
	 */
	public static int run(String[] sArgs, OperationRegistry oRegistry)
	{
		if (sArgs.length < 4 || !CoregisterOp.NAME.equals(sArgs[0]))
		{
			LOGGER.error(USAGE);
			return 2;
		}

		HashMap<String, Object> oInputs = new HashMap<>();
		for (int nIndex = 4; nIndex < sArgs.length; nIndex += 2)
		{
			if (nIndex + 1 >= sArgs.length)
			{
				LOGGER.error(USAGE);
				return 2;
			}
			if ("-us".equals(sArgs[nIndex]))
				oInputs.put(CoregisterOp.METHOD_US, sArgs[nIndex + 1]);
			else if ("-ds".equals(sArgs[nIndex]))
				oInputs.put(CoregisterOp.METHOD_DS, sArgs[nIndex + 1]);
			else
			{
				LOGGER.error(USAGE);
				return 2;
			}
		}

		try
		{
			oInputs.put(CoregisterOp.MASTER, DatasetJson.read(Paths.get(sArgs[1])));
			oInputs.put(CoregisterOp.SLAVE, DatasetJson.read(Paths.get(sArgs[2])));
			Dataset oResult = (Dataset)oRegistry.invoke(CoregisterOp.NAME, oInputs, new LogMonitor(LOGGER));
			DatasetJson.write(oResult, Paths.get(sArgs[3]));
			LOGGER.info(String.format("Wrote %s", sArgs[3]));
			return 0;
		}
		catch (Exception oException)
		{
			LOGGER.error(oException, oException);
			return 1;
		}
	}
}
